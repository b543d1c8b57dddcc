package com.cgi.schemasense.strategy;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Curated rules evaluated before any pattern lookup.
 * Temporal and technical columns are decided here so that later substring-like matching
 * can never turn them into contact or identity data.
 */
@Component
public class OverrideRuleStage extends AbstractMatchStage {
    private static final Set<String> TEMPORAL_SUFFIXES = new HashSet<>(Arrays.asList(
            "date", "dt", "at", "on", "time", "timestamp", "ts"));

    // Temporal columns carrying these tokens are personal dates
    private static final Set<String> PERSONAL_DATE_TOKENS = new HashSet<>(Arrays.asList(
            "birth", "dob", "death", "admission", "discharge", "visit"));

    private static final Set<String> SYSTEM_COLUMNS = new HashSet<>(Arrays.asList(
            "uuid", "guid", "rowid", "row_id", "created_at", "updated_at", "modified_at", "deleted_at",
            "created_by", "updated_by", "modified_by", "version", "row_version", "checksum", "etag",
            "sort_order", "sequence", "seq", "revision", "record_status"));

    private static final Set<String> TECHNICAL_ID_PREFIXES = new HashSet<>(Arrays.asList(
            "request", "job", "batch", "log", "audit", "trace", "correlation", "order", "product",
            "event", "task", "workflow", "message", "invoice", "sku", "category", "item", "shipment"));

    private static final Set<String> FLAG_PREFIXES = new HashSet<>(Arrays.asList("is", "has", "can"));

    private static final Set<String> TECHNICAL_FLAG_WORDS = new HashSet<>(Arrays.asList(
            "active", "deleted", "enabled", "disabled", "verified", "archived", "visible", "published",
            "locked", "default", "valid", "approved", "processed", "synced"));

    public OverrideRuleStage(ClassificationProperties properties) {
        super(properties);
    }

    @Override
    public MatchStageType getStageType() {
        return MatchStageType.OVERRIDE;
    }

    @Override
    public Optional<FieldMatch> attemptMatch(FieldContext context) {
        String name = context.getNormalizedName();
        List<String> tokens = Arrays.asList(name.split("_"));

        if (SYSTEM_COLUMNS.contains(name)) {
            return Optional.of(createNonSensitive(0.95, "System column"));
        }

        String last = tokens.get(tokens.size() - 1);
        if (tokens.size() > 1 && TEMPORAL_SUFFIXES.contains(last)) {
            for (String token : tokens) {
                if (PERSONAL_DATE_TOKENS.contains(token)) {
                    return Optional.of(FieldMatch.builder()
                            .stage(getStageType())
                            .piiType(PIIType.DATE)
                            .riskLevel(RiskLevel.MEDIUM)
                            .confidence(computeConfidence(0.90, 1.0, PIIType.DATE,
                                    context.getColumn().getDataType()))
                            .patternId("override_personal_date")
                            .rationale("Personal date column ('" + token + "')")
                            .build());
                }
            }
            return Optional.of(createNonSensitive(0.90, "Temporal column (suffix '_" + last + "')"));
        }

        if (tokens.size() == 2 && "id".equals(last) && TECHNICAL_ID_PREFIXES.contains(tokens.get(0))) {
            return Optional.of(createNonSensitive(0.85, "Technical identifier"));
        }

        if (tokens.size() > 1 && FLAG_PREFIXES.contains(tokens.get(0))) {
            for (String token : tokens.subList(1, tokens.size())) {
                if (TECHNICAL_FLAG_WORDS.contains(token)) {
                    return Optional.of(createNonSensitive(0.90, "Boolean status flag"));
                }
            }
        }
        return Optional.empty();
    }
}
