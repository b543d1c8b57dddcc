package com.cgi.schemasense.context;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.ColumnMetadata;
import com.cgi.schemasense.model.TableContext;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.pattern.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Infers the business domain of a table from keywords in its own name and its column names.
 * Stateless apart from configuration; a context is computed fresh for every call.
 */
@Component
public class TableContextResolver {
    private static final Logger log = LoggerFactory.getLogger(TableContextResolver.class);

    private final Map<DomainCategory, Set<String>> keywords;
    private final double tableNameWeight;
    private final double minimumScore;
    private final double dominanceRatio;

    public TableContextResolver(ClassificationProperties properties) {
        ClassificationProperties.Context config = properties.getContext();
        Map<DomainCategory, Set<String>> normalized = new EnumMap<>(DomainCategory.class);
        config.getKeywords().forEach((domain, words) -> {
            Set<String> set = new HashSet<>();
            for (String word : words) {
                set.add(word.toLowerCase(Locale.ROOT).trim());
            }
            normalized.put(domain, Collections.unmodifiableSet(set));
        });
        this.keywords = Collections.unmodifiableMap(normalized);
        this.tableNameWeight = config.getTableNameWeight();
        this.minimumScore = config.getMinimumScore();
        this.dominanceRatio = config.getDominanceRatio();
    }

    /**
     * Resolves the domain of one table.
     *
     * @param tableName Table name
     * @param columns Columns of the table
     * @return Table context; GENERAL when no domain dominates
     */
    public TableContext resolve(String tableName, Collection<ColumnMetadata> columns) {
        Map<DomainCategory, Double> scores = new EnumMap<>(DomainCategory.class);
        addScores(scores, NameNormalizer.tokens(tableName), tableNameWeight);
        if (columns != null) {
            for (ColumnMetadata column : columns) {
                if (column != null) {
                    addScores(scores, NameNormalizer.tokens(column.getColumnName()), 1.0);
                }
            }
        }

        double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        DomainCategory winner = null;
        double best = 0.0;
        // Enum order runs from narrowest to broadest domain, so ties go to the narrower one.
        for (DomainCategory domain : DomainCategory.values()) {
            double score = scores.getOrDefault(domain, 0.0);
            if (score > best) {
                best = score;
                winner = domain;
            }
        }

        if (winner == null || best < minimumScore || best / total < dominanceRatio) {
            log.debug("No dominant domain for table {} (scores {})", tableName, scores);
            return TableContext.builder()
                    .tableName(tableName)
                    .domainCategory(DomainCategory.GENERAL)
                    .domainScores(Collections.unmodifiableMap(scores))
                    .confidence(0.0)
                    .build();
        }

        double confidence = best / total;
        log.debug("Table {} resolved to {} with confidence {}", tableName, winner,
                String.format("%.2f", confidence));
        return TableContext.builder()
                .tableName(tableName)
                .domainCategory(winner)
                .domainScores(Collections.unmodifiableMap(scores))
                .confidence(confidence)
                .build();
    }

    private void addScores(Map<DomainCategory, Double> scores, List<String> tokens, double weight) {
        for (String token : tokens) {
            for (Map.Entry<DomainCategory, Set<String>> entry : keywords.entrySet()) {
                if (matches(token, entry.getValue())) {
                    scores.merge(entry.getKey(), weight, Double::sum);
                }
            }
        }
    }

    private static boolean matches(String token, Set<String> words) {
        if (words.contains(token)) {
            return true;
        }
        return token.length() > 3 && token.endsWith("s") && words.contains(token.substring(0, token.length() - 1));
    }
}
