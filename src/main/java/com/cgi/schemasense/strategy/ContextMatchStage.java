package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.MatchStageType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Generic names ("id", "balance") that only become sensitive inside tables of a given domain.
 */
@Component
public class ContextMatchStage extends AbstractMatchStage {

    public ContextMatchStage(ClassificationProperties properties) {
        super(properties);
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.CONTEXT;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        DomainCategory domain = context.getTableContext().getDomainCategory();
        if (domain == DomainCategory.GENERAL) {
            return Optional.empty();
        }
        return context.getLibrary().lookupContext(context.getNormalizedName(), domain)
                .map(pattern -> createMatch(pattern, pattern.getWeight(), context,
                        "'" + pattern.getToken() + "' in a " + domain.name().toLowerCase() + " table"));
    }
}
