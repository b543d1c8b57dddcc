package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Token-anchored expressions, tried in descending weight order. Last pattern stage.
 */
@Component
public class RegexMatchStage extends AbstractMatchStage {

    public RegexMatchStage(ClassificationProperties properties) {
        super(properties);
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.REGEX;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        return context.getLibrary().lookupRegex(context.getNormalizedName())
                .map(pattern -> createMatch(pattern, pattern.getWeight(), context,
                        "Matches expression '" + pattern.getExpression() + "'"));
    }
}
