package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class AliasMatchStage extends AbstractMatchStage {

    public AliasMatchStage(ClassificationProperties properties) {
        super(properties);
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.ALIAS;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        return context.getLibrary().lookupAlias(context.getNormalizedName())
                .map(alias -> createMatch(alias, alias.getWeight(), context,
                        alias.getCanonicalName() != null
                                ? "Alias of '" + alias.getCanonicalName() + "'"
                                : "Known alias '" + alias.getAlias() + "'"));
    }
}
