package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class FuzzyMatchStage extends AbstractMatchStage {
    private final double threshold;

    public FuzzyMatchStage(ClassificationProperties properties) {
        super(properties);
        this.threshold = properties.getMatching().getFuzzyThreshold();
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.FUZZY;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        return context.getLibrary().lookupFuzzy(context.getNormalizedName(), threshold)
                .map(match -> createMatch(match.getPattern(), match.getPattern().getWeight() * match.getScore(),
                        context, String.format("Similar to '%s' (%.2f)", match.getPattern().getValue(),
                                match.getScore())));
    }
}
