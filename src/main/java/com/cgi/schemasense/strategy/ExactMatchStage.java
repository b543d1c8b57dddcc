package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ExactMatchStage extends AbstractMatchStage {

    public ExactMatchStage(ClassificationProperties properties) {
        super(properties);
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.EXACT;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        return context.getLibrary().lookupExact(context.getNormalizedName())
                .map(pattern -> createMatch(pattern, pattern.getWeight(), context,
                        "Exact match on '" + pattern.getName() + "'"));
    }
}
