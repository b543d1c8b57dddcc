package com.cgi.schemasense.engine;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.FieldAnalysisResult;
import com.cgi.schemasense.model.FieldMatch;
import com.cgi.schemasense.model.TableContext;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.MatchStageType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.pattern.NameNormalizer;
import com.cgi.schemasense.pattern.PatternLibrary;
import com.cgi.schemasense.pattern.PatternLibraryRegistry;
import com.cgi.schemasense.strategy.AliasMatchStage;
import com.cgi.schemasense.strategy.ContextMatchStage;
import com.cgi.schemasense.strategy.ExactMatchStage;
import com.cgi.schemasense.strategy.FieldContext;
import com.cgi.schemasense.strategy.FuzzyMatchStage;
import com.cgi.schemasense.strategy.MatchStage;
import com.cgi.schemasense.strategy.OverrideRuleStage;
import com.cgi.schemasense.strategy.RegexMatchStage;
import com.cgi.schemasense.strategy.RegulationExactStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies single columns by running the match stages in order and stopping at the first
 * stage that decides. Unmatched columns come back non-sensitive; this class never throws
 * for a field.
 */
@Component
public class ClassificationEngine {
    private static final Logger log = LoggerFactory.getLogger(ClassificationEngine.class);

    static final double DEFAULT_CONFIDENCE = 0.05;

    private final List<MatchStage> stages;
    private final RegulationResolver regulationResolver;
    private final PatternLibraryRegistry libraryRegistry;
    private final double lowContextThreshold;

    @Autowired
    public ClassificationEngine(List<MatchStage> stages, RegulationResolver regulationResolver,
                                PatternLibraryRegistry libraryRegistry, ClassificationProperties properties) {
        List<MatchStage> ordered = new ArrayList<>(stages);
        ordered.sort(Comparator.comparingInt(stage -> stage.getStageType().ordinal()));
        this.stages = Collections.unmodifiableList(ordered);
        this.regulationResolver = regulationResolver;
        this.libraryRegistry = libraryRegistry;
        this.lowContextThreshold = properties.getContext().getLowConfidenceThreshold();
        log.info("Classification engine initialized with stages {}",
                ordered.stream().map(MatchStage::getName).collect(Collectors.toList()));
    }

    /**
     * Engine with the standard stage pipeline.
     *
     * @param libraryRegistry Pattern libraries
     * @param properties Configuration
     */
    public ClassificationEngine(PatternLibraryRegistry libraryRegistry, ClassificationProperties properties) {
        this(defaultStages(properties), new RegulationResolver(properties), libraryRegistry, properties);
    }

    public static List<MatchStage> defaultStages(ClassificationProperties properties) {
        return Arrays.asList(
                new OverrideRuleStage(properties),
                new ExactMatchStage(properties),
                new RegulationExactStage(properties),
                new AliasMatchStage(properties),
                new FuzzyMatchStage(properties),
                new ContextMatchStage(properties),
                new RegexMatchStage(properties));
    }

    /**
     * Classifies a column against the default pattern library with no region.
     */
    public FieldAnalysisResult classifyField(ColumnMetadata column, TableContext tableContext,
                                             Set<Regulation> requestedRegulations) {
        return classifyField(column, tableContext, requestedRegulations, null, libraryRegistry.getDefaultLibrary());
    }

    /**
     * Classifies one column.
     *
     * @param column Column to classify
     * @param tableContext Context of the column's table
     * @param requestedRegulations Requested regulations; empty means all
     * @param region Region code used by the regulation mapping, may be null
     * @param library Pattern library to match against
     * @return Result for the column, never null
     */
    public FieldAnalysisResult classifyField(ColumnMetadata column, TableContext tableContext,
                                             Set<Regulation> requestedRegulations, String region,
                                             PatternLibrary library) {
        TableContext context = tableContext != null
                ? tableContext
                : TableContext.general(column != null ? column.getTableName() : null);
        if (column == null || !column.isWellFormed()) {
            return malformed(column, context);
        }
        String normalizedName = NameNormalizer.normalize(column.getColumnName());
        if (normalizedName.isEmpty()) {
            return malformed(column, context);
        }

        if (context.getDomainCategory() != DomainCategory.GENERAL && context.getConfidence() < lowContextThreshold) {
            log.warn("Low context confidence {} for table {} ({}), classifying {} anyway",
                    String.format("%.2f", context.getConfidence()), context.getTableName(),
                    context.getDomainCategory(), column.getFieldRef());
        }

        Set<Regulation> requested = requestedRegulations == null || requestedRegulations.isEmpty()
                ? EnumSet.allOf(Regulation.class)
                : EnumSet.copyOf(requestedRegulations);
        FieldContext fieldContext = FieldContext.builder()
                .column(column)
                .normalizedName(normalizedName)
                .tableContext(context)
                .requestedRegulations(requested)
                .preferredRegulation(regulationResolver.defaultFor(context.getDomainCategory(), region))
                .library(library != null ? library : libraryRegistry.getDefaultLibrary())
                .build();

        for (MatchStage stage : stages) {
            Optional<FieldMatch> match;
            try {
                match = stage.attemptMatch(fieldContext);
            } catch (RuntimeException e) {
                log.error("Error in stage {} for {}: {}", stage.getName(), column.getFieldRef(), e.getMessage(), e);
                continue;
            }
            if (match.isPresent()) {
                return toResult(column, context, match.get(), region, requested);
            }
        }

        return FieldAnalysisResult.nonSensitive(column, DEFAULT_CONFIDENCE, MatchStageType.DEFAULT,
                        "No pattern matched")
                .toBuilder()
                .domainCategory(context.getDomainCategory())
                .build();
    }

    public List<MatchStage> getStages() {
        return stages;
    }

    public RegulationResolver getRegulationResolver() {
        return regulationResolver;
    }

    private FieldAnalysisResult toResult(ColumnMetadata column, TableContext context, FieldMatch match,
                                         String region, Set<Regulation> requested) {
        if (!match.isSensitive()) {
            return FieldAnalysisResult.nonSensitive(column, match.getConfidence(), match.getStage(),
                            match.getRationale())
                    .toBuilder()
                    .patternId(match.getPatternId())
                    .domainCategory(context.getDomainCategory())
                    .build();
        }
        Set<Regulation> regulations = regulationResolver.resolve(match.getPatternRegulations(),
                context.getDomainCategory(), region, requested);
        return FieldAnalysisResult.builder()
                .column(column)
                .sensitive(true)
                .piiType(match.getPiiType())
                .riskLevel(match.getRiskLevel())
                .confidence(match.getConfidence())
                .applicableRegulations(regulations)
                .rationale(match.getRationale())
                .stage(match.getStage())
                .patternId(match.getPatternId())
                .domainCategory(context.getDomainCategory())
                .build();
    }

    private FieldAnalysisResult malformed(ColumnMetadata column, TableContext context) {
        log.warn("Malformed column {} classified as non-sensitive", column != null ? column.getFieldRef() : "null");
        return FieldAnalysisResult.nonSensitive(column, 0.0, MatchStageType.DEFAULT, "Malformed column")
                .toBuilder()
                .domainCategory(context.getDomainCategory())
                .build();
    }
}
