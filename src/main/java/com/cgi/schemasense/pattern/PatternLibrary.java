package com.cgi.schemasense.pattern;

import com.cgi.schemasense.exception.ClassificationInputException;
import com.cgi.schemasense.exception.PatternLoadException;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.model.enums.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Immutable collection of sensitivity patterns, built once from flat records.
 * Safe to share between threads without locking.
 */
public final class PatternLibrary {
    private static final Logger log = LoggerFactory.getLogger(PatternLibrary.class);

    private static final String REGEX_META = "^$\\[](){}|*+?";
    private static final double DEFAULT_WEIGHT = 1.0;

    private final List<PatternRecord> records;
    private final Map<String, SensitivityPattern.Exact> exactPatterns;
    private final Map<String, String> compactExactNames;
    private final Set<String> ambiguousNames;
    private final Map<Regulation, Map<String, SensitivityPattern.Exact>> regulationExactPatterns;
    private final Map<String, SensitivityPattern.Alias> aliasPatterns;
    private final List<SensitivityPattern> fuzzyCandidates;
    private final List<SensitivityPattern.Regex> regexPatterns;
    private final Map<String, Map<DomainCategory, SensitivityPattern.Context>> contextPatterns;
    private final Map<Regulation, List<SensitivityPattern>> regulationSubsets;
    private final int skippedRecords;

    /**
     * Content hash of the accepted records. Two libraries built from the same records share it.
     */
    private final String version;

    private PatternLibrary(List<PatternRecord> records, List<SensitivityPattern> patterns, int skippedRecords) {
        this.records = Collections.unmodifiableList(records);
        this.skippedRecords = skippedRecords;
        this.version = versionOf(records);

        Builder builder = new Builder();
        for (SensitivityPattern pattern : patterns) {
            pattern.accept(builder);
        }

        Map<String, SensitivityPattern.Exact> exact = new LinkedHashMap<>();
        Set<String> ambiguous = new HashSet<>();
        builder.exactByName.forEach((name, candidates) -> {
            Set<PIIType> types = candidates.stream().map(SensitivityPattern::getPiiType)
                    .collect(Collectors.toCollection(() -> EnumSet.noneOf(PIIType.class)));
            if (types.size() > 1) {
                ambiguous.add(name);
            } else {
                exact.put(name, mergeSameType(name, candidates));
            }
        });
        Map<String, String> compact = new HashMap<>();
        exact.keySet().forEach(name -> compact.putIfAbsent(NameNormalizer.compact(name), name));

        List<SensitivityPattern> fuzzy = new ArrayList<>(builder.fuzzy);
        fuzzy.addAll(exact.values());

        List<SensitivityPattern.Regex> regex = new ArrayList<>(builder.regex);
        // Stable sort: equal weights keep source order.
        regex.sort(Comparator.comparingDouble(SensitivityPattern::getWeight).reversed());

        Map<Regulation, List<SensitivityPattern>> subsets = new EnumMap<>(Regulation.class);
        for (SensitivityPattern pattern : patterns) {
            for (Regulation regulation : pattern.getRegulations()) {
                subsets.computeIfAbsent(regulation, r -> new ArrayList<>()).add(pattern);
            }
        }
        subsets.replaceAll((r, list) -> Collections.unmodifiableList(list));

        Map<Regulation, Map<String, SensitivityPattern.Exact>> regulationExact = new EnumMap<>(Regulation.class);
        builder.regulationExact.forEach((r, map) -> regulationExact.put(r, Collections.unmodifiableMap(map)));

        this.exactPatterns = Collections.unmodifiableMap(exact);
        this.compactExactNames = Collections.unmodifiableMap(compact);
        this.ambiguousNames = Collections.unmodifiableSet(ambiguous);
        this.regulationExactPatterns = Collections.unmodifiableMap(regulationExact);
        this.aliasPatterns = Collections.unmodifiableMap(builder.aliases);
        this.fuzzyCandidates = Collections.unmodifiableList(fuzzy);
        this.regexPatterns = Collections.unmodifiableList(regex);
        this.contextPatterns = Collections.unmodifiableMap(builder.context);
        this.regulationSubsets = Collections.unmodifiableMap(subsets);
    }

    /**
     * Builds a library from flat records. A malformed record is skipped with a warning;
     * loading never aborts on a single bad record.
     *
     * @param patternRecords Records to load
     * @return The immutable library
     */
    public static PatternLibrary load(Collection<PatternRecord> patternRecords) {
        List<PatternRecord> accepted = new ArrayList<>();
        List<SensitivityPattern> patterns = new ArrayList<>();
        int skipped = 0;
        int index = 0;
        for (PatternRecord record : patternRecords) {
            index++;
            try {
                patterns.add(toPattern(record, index));
                accepted.add(record);
            } catch (PatternLoadException e) {
                skipped++;
                log.warn("Skipping pattern record #{}: {}", index, e.getMessage());
            }
        }
        PatternLibrary library = new PatternLibrary(accepted, patterns, skipped);
        log.info("Pattern library loaded: {} exact, {} ambiguous, {} alias, {} fuzzy candidates, {} regex, "
                        + "{} context patterns ({} records skipped)",
                library.exactPatterns.size(), library.ambiguousNames.size(), library.aliasPatterns.size(),
                library.fuzzyCandidates.size(), library.regexPatterns.size(),
                library.contextPatterns.size(), skipped);
        return library;
    }

    /**
     * Direct hit on the normalized name. Names claimed by several regulations with
     * conflicting PII types are not answered here.
     */
    public Optional<SensitivityPattern.Exact> lookupExact(String name) {
        String normalized = NameNormalizer.normalize(name);
        if (ambiguousNames.contains(normalized)) {
            return Optional.empty();
        }
        SensitivityPattern.Exact pattern = exactPatterns.get(normalized);
        if (pattern == null) {
            String canonical = compactExactNames.get(NameNormalizer.compact(normalized));
            if (canonical != null) {
                pattern = exactPatterns.get(canonical);
            }
        }
        return Optional.ofNullable(pattern);
    }

    /**
     * Exact hit restricted to the patterns of one regulation.
     */
    public Optional<SensitivityPattern.Exact> lookupRegulationExact(Regulation regulation, String name) {
        Map<String, SensitivityPattern.Exact> patterns = regulationExactPatterns.get(regulation);
        if (patterns == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(patterns.get(NameNormalizer.normalize(name)));
    }

    boolean isAmbiguous(String name) {
        return ambiguousNames.contains(NameNormalizer.normalize(name));
    }

    public Optional<SensitivityPattern.Alias> lookupAlias(String name) {
        return Optional.ofNullable(aliasPatterns.get(NameNormalizer.normalize(name)));
    }

    /**
     * Highest-similarity candidate at or above the threshold. Ties are broken by higher
     * weight, then by the shorter pattern.
     */
    public Optional<PatternMatch> lookupFuzzy(String name, double threshold) {
        String normalized = NameNormalizer.normalize(name);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        PatternMatch best = null;
        for (SensitivityPattern candidate : fuzzyCandidates) {
            double score = StringSimilarity.similarity(normalized, candidate.getValue());
            if (score < threshold) {
                continue;
            }
            if (best == null || isBetter(score, candidate, best)) {
                best = new PatternMatch(candidate, score);
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * First regex pattern matching the name, in fixed priority order.
     */
    public Optional<SensitivityPattern.Regex> lookupRegex(String name) {
        String normalized = NameNormalizer.normalize(name);
        for (SensitivityPattern.Regex pattern : regexPatterns) {
            if (pattern.matches(normalized)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    /**
     * Context pattern for a generic name inside a table of the given domain. The whole name is
     * tried first, then its last token.
     */
    public Optional<SensitivityPattern.Context> lookupContext(String name, DomainCategory domain) {
        String normalized = NameNormalizer.normalize(name);
        SensitivityPattern.Context pattern = contextFor(normalized, domain);
        if (pattern == null) {
            List<String> tokens = NameNormalizer.tokens(normalized);
            if (tokens.size() > 1) {
                pattern = contextFor(tokens.get(tokens.size() - 1), domain);
            }
        }
        return Optional.ofNullable(pattern);
    }

    List<SensitivityPattern> patternsFor(Regulation regulation) {
        return regulationSubsets.getOrDefault(regulation, List.of());
    }

    /**
     * Records this library was built from, without the skipped ones.
     */
    public List<PatternRecord> getRecords() {
        return records;
    }

    /**
     * Identifies the pattern content. Cached results are only valid for the version that
     * produced them.
     */
    public String getVersion() {
        return version;
    }

    public int getSkippedRecords() {
        return skippedRecords;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("exactPatterns", exactPatterns.size());
        stats.put("ambiguousNames", ambiguousNames.size());
        stats.put("aliasPatterns", aliasPatterns.size());
        stats.put("fuzzyCandidates", fuzzyCandidates.size());
        stats.put("regexPatterns", regexPatterns.size());
        stats.put("contextPatterns", contextPatterns.values().stream().mapToInt(Map::size).sum());
        Map<String, Integer> perRegulation = new LinkedHashMap<>();
        regulationSubsets.forEach((r, list) -> perRegulation.put(r.getId(), list.size()));
        stats.put("patternsPerRegulation", perRegulation);
        stats.put("skippedRecords", skippedRecords);
        stats.put("version", version);
        return stats;
    }

    private SensitivityPattern.Context contextFor(String token, DomainCategory domain) {
        Map<DomainCategory, SensitivityPattern.Context> byDomain = contextPatterns.get(token);
        return byDomain != null ? byDomain.get(domain) : null;
    }

    private static String versionOf(List<PatternRecord> records) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (PatternRecord record : records) {
                digest.update(record.toString().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\n');
            }
            byte[] bytes = digest.digest();
            StringBuilder hex = new StringBuilder(16);
            for (int i = 0; i < 8; i++) {
                hex.append(String.format("%02x", bytes[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean isBetter(double score, SensitivityPattern candidate, PatternMatch best) {
        if (score != best.getScore()) {
            return score > best.getScore();
        }
        SensitivityPattern current = best.getPattern();
        if (candidate.getWeight() != current.getWeight()) {
            return candidate.getWeight() > current.getWeight();
        }
        return candidate.getValue().length() < current.getValue().length();
    }

    private static SensitivityPattern.Exact mergeSameType(String name, List<SensitivityPattern.Exact> candidates) {
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        SensitivityPattern.Exact best = candidates.stream()
                .max(Comparator.comparingDouble(SensitivityPattern::getConfidence))
                .orElseThrow();
        Set<Regulation> regulations = EnumSet.noneOf(Regulation.class);
        candidates.forEach(c -> regulations.addAll(c.getRegulations()));
        return new SensitivityPattern.Exact(best.getId(), name, best.getPiiType(), best.getRiskLevel(),
                best.getConfidence(), regulations, best.getWeight());
    }

    private static SensitivityPattern toPattern(PatternRecord record, int index) {
        if (record == null) {
            throw new PatternLoadException("record is null");
        }
        String value = record.getPattern();
        if (value == null || value.isBlank()) {
            throw new PatternLoadException("pattern is blank");
        }
        PIIType piiType = parseEnum(PIIType.class, record.getPiiType(), "pii_type");
        if (piiType == PIIType.NONE) {
            throw new PatternLoadException("pii_type NONE cannot mark a field as sensitive");
        }
        Double confidence = record.getConfidence();
        if (confidence == null || confidence <= 0.0 || confidence > 1.0) {
            throw new PatternLoadException("confidence must be within (0,1]: " + confidence);
        }
        double weight = record.getWeight() != null ? record.getWeight() : DEFAULT_WEIGHT;
        if (weight <= 0.0) {
            throw new PatternLoadException("weight must be positive: " + weight);
        }
        RiskLevel risk = record.getRisk() != null && !record.getRisk().isBlank()
                ? parseEnum(RiskLevel.class, record.getRisk(), "risk")
                : null;
        Set<Regulation> regulations = parseRegulations(record.getRegulation());
        PatternKind kind = record.getKind() != null && !record.getKind().isBlank()
                ? parseEnum(PatternKind.class, record.getKind(), "kind")
                : inferKind(value);

        String id = kind.name().toLowerCase(Locale.ROOT) + "_" + index;
        switch (kind) {
            case EXACT:
                return new SensitivityPattern.Exact(id, value, piiType, risk, confidence, regulations, weight);
            case ALIAS:
                return new SensitivityPattern.Alias(id, value, record.getAliasOf(), piiType, risk, confidence,
                        regulations, weight);
            case FUZZY:
                return new SensitivityPattern.Fuzzy(id, value, piiType, risk, confidence, regulations, weight);
            case REGEX:
                try {
                    return new SensitivityPattern.Regex(id, value, piiType, risk, confidence, regulations, weight);
                } catch (PatternSyntaxException e) {
                    throw new PatternLoadException("invalid regex '" + value + "': " + e.getDescription(), e);
                }
            case CONTEXT:
                DomainCategory domain = parseEnum(DomainCategory.class, record.getDomain(), "domain");
                return new SensitivityPattern.Context(id, value, domain, piiType, risk, confidence,
                        regulations, weight);
            default:
                throw new PatternLoadException("unsupported kind " + kind);
        }
    }

    private static PatternKind inferKind(String value) {
        for (char c : value.toCharArray()) {
            if (REGEX_META.indexOf(c) >= 0) {
                return PatternKind.REGEX;
            }
        }
        return PatternKind.EXACT;
    }

    private static Set<Regulation> parseRegulations(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        Set<Regulation> regulations = new LinkedHashSet<>();
        for (String id : value.split("[,|]")) {
            if (id.isBlank()) {
                continue;
            }
            try {
                regulations.add(Regulation.fromId(id));
            } catch (ClassificationInputException e) {
                throw new PatternLoadException("unknown regulation '" + id.trim() + "'", e);
            }
        }
        return regulations;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PatternLoadException(field + " is missing");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new PatternLoadException("unknown " + field + " '" + value + "'", e);
        }
    }

    /**
     * Sorts patterns into the per-kind structures.
     */
    private static final class Builder implements SensitivityPattern.Visitor<Void> {
        private final Map<String, List<SensitivityPattern.Exact>> exactByName = new LinkedHashMap<>();
        private final Map<Regulation, Map<String, SensitivityPattern.Exact>> regulationExact =
                new EnumMap<>(Regulation.class);
        private final Map<String, SensitivityPattern.Alias> aliases = new LinkedHashMap<>();
        private final List<SensitivityPattern> fuzzy = new ArrayList<>();
        private final List<SensitivityPattern.Regex> regex = new ArrayList<>();
        private final Map<String, Map<DomainCategory, SensitivityPattern.Context>> context = new HashMap<>();

        @Override
        public Void visitExact(SensitivityPattern.Exact pattern) {
            exactByName.computeIfAbsent(pattern.getName(), n -> new ArrayList<>()).add(pattern);
            for (Regulation regulation : pattern.getRegulations()) {
                regulationExact.computeIfAbsent(regulation, r -> new LinkedHashMap<>())
                        .merge(pattern.getName(), pattern,
                                (existing, candidate) -> candidate.getConfidence() > existing.getConfidence()
                                        ? candidate : existing);
            }
            return null;
        }

        @Override
        public Void visitAlias(SensitivityPattern.Alias pattern) {
            aliases.merge(pattern.getAlias(), pattern,
                    (existing, candidate) -> candidate.getConfidence() > existing.getConfidence() ? candidate : existing);
            return null;
        }

        @Override
        public Void visitFuzzy(SensitivityPattern.Fuzzy pattern) {
            fuzzy.add(pattern);
            return null;
        }

        @Override
        public Void visitRegex(SensitivityPattern.Regex pattern) {
            regex.add(pattern);
            return null;
        }

        @Override
        public Void visitContext(SensitivityPattern.Context pattern) {
            context.computeIfAbsent(pattern.getToken(), t -> new EnumMap<>(DomainCategory.class))
                    .put(pattern.getDomain(), pattern);
            return null;
        }
    }
}
