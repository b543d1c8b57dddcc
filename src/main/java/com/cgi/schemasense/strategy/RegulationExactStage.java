package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.pattern.SensitivityPattern;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exact match scoped to the requested regulations. Resolves names that several regulations
 * claim with different PII types: the regulation the table domain maps to is tried first,
 * then the remaining requested ones in declaration order.
 */
@Component
public class RegulationExactStage extends AbstractMatchStage {

    public RegulationExactStage(ClassificationProperties properties) {
        super(properties);
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.REGULATION_EXACT;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        for (Regulation regulation : lookupOrder(context)) {
            Optional<SensitivityPattern.Exact> pattern =
                    context.getLibrary().lookupRegulationExact(regulation, context.getNormalizedName());
            if (pattern.isPresent()) {
                SensitivityPattern.Exact exact = pattern.get();
                return Optional.of(createMatch(exact, exact.getWeight(), context,
                        "Exact " + regulation.getId() + " match on '" + exact.getName() + "'"));
            }
        }
        return Optional.empty();
    }

    private static List<Regulation> lookupOrder(FieldContext context) {
        List<Regulation> order = new ArrayList<>();
        Regulation preferred = context.getPreferredRegulation();
        if (preferred != null && context.getRequestedRegulations().contains(preferred)) {
            order.add(preferred);
        }
        for (Regulation regulation : Regulation.values()) {
            if (regulation != preferred && context.getRequestedRegulations().contains(regulation)) {
                order.add(regulation);
            }
        }
        return order;
    }
}
