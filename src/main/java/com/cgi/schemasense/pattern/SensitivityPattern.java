package com.cgi.schemasense.pattern;

import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.PIIType;
import com.cgi.schemasense.model.enums.Regulation;
import com.cgi.schemasense.model.enums.RiskLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable sensitivity pattern. Each kind is its own subclass carrying only the fields it needs;
 * callers dispatch over the kinds through {@link Visitor}.
 */
@Getter
public abstract class SensitivityPattern {
    private final String id;
    private final PIIType piiType;
    private final RiskLevel riskLevel;
    private final double confidence;
    private final Set<Regulation> regulations;
    private final double weight;

    protected SensitivityPattern(String id, PIIType piiType, RiskLevel riskLevel, double confidence,
                                 Set<Regulation> regulations, double weight) {
        this.id = id;
        this.piiType = piiType;
        this.riskLevel = riskLevel != null ? riskLevel : piiType.getDefaultRisk();
        this.confidence = confidence;
        this.regulations = regulations == null || regulations.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(regulations));
        this.weight = weight;
    }

    public abstract PatternKind getKind();

    /**
     * Text the pattern is keyed on: the name, alias, template, expression or token.
     */
    public abstract String getValue();

    public abstract <R> R accept(Visitor<R> visitor);

    public boolean isRegulationSpecific() {
        return !regulations.isEmpty();
    }

    public interface Visitor<R> {
        R visitExact(Exact pattern);

        R visitAlias(Alias pattern);

        R visitFuzzy(Fuzzy pattern);

        R visitRegex(Regex pattern);

        R visitContext(Context pattern);
    }

    @Getter
    public static final class Exact extends SensitivityPattern {
        private final String name;

        public Exact(String id, String name, PIIType piiType, RiskLevel riskLevel, double confidence,
                     Set<Regulation> regulations, double weight) {
            super(id, piiType, riskLevel, confidence, regulations, weight);
            this.name = NameNormalizer.normalize(name);
        }

        @Override
        public PatternKind getKind() {
            return PatternKind.EXACT;
        }

        @Override
        public String getValue() {
            return name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExact(this);
        }
    }

    /**
     * Organization-specific synonym of a canonical field name.
     */
    @Getter
    public static final class Alias extends SensitivityPattern {
        private final String alias;
        private final String canonicalName;

        public Alias(String id, String alias, String canonicalName, PIIType piiType, RiskLevel riskLevel,
                     double confidence, Set<Regulation> regulations, double weight) {
            super(id, piiType, riskLevel, confidence, regulations, weight);
            this.alias = NameNormalizer.normalize(alias);
            this.canonicalName = canonicalName != null ? NameNormalizer.normalize(canonicalName) : null;
        }

        @Override
        public PatternKind getKind() {
            return PatternKind.ALIAS;
        }

        @Override
        public String getValue() {
            return alias;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAlias(this);
        }
    }

    @Getter
    public static final class Fuzzy extends SensitivityPattern {
        private final String template;

        public Fuzzy(String id, String template, PIIType piiType, RiskLevel riskLevel, double confidence,
                     Set<Regulation> regulations, double weight) {
            super(id, piiType, riskLevel, confidence, regulations, weight);
            this.template = NameNormalizer.normalize(template);
        }

        @Override
        public PatternKind getKind() {
            return PatternKind.FUZZY;
        }

        @Override
        public String getValue() {
            return template;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFuzzy(this);
        }
    }

    /**
     * Token expression anchored on underscore boundaries: {@code cell} matches
     * {@code cell_phone} but never {@code cancelled_date}.
     */
    @Getter
    public static final class Regex extends SensitivityPattern {
        private final String expression;
        private final Pattern compiled;

        public Regex(String id, String expression, PIIType piiType, RiskLevel riskLevel, double confidence,
                     Set<Regulation> regulations, double weight) {
            super(id, piiType, riskLevel, confidence, regulations, weight);
            this.expression = expression;
            this.compiled = Pattern.compile("(?:^|_)(?:" + expression + ")(?:_|$)");
        }

        public boolean matches(String normalizedName) {
            Matcher matcher = compiled.matcher(normalizedName);
            return matcher.find();
        }

        @Override
        public PatternKind getKind() {
            return PatternKind.REGEX;
        }

        @Override
        public String getValue() {
            return expression;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRegex(this);
        }
    }

    /**
     * Generic name that is only sensitive inside tables of one domain.
     */
    @Getter
    public static final class Context extends SensitivityPattern {
        private final String token;
        private final DomainCategory domain;

        public Context(String id, String token, DomainCategory domain, PIIType piiType, RiskLevel riskLevel,
                       double confidence, Set<Regulation> regulations, double weight) {
            super(id, piiType, riskLevel, confidence, regulations, weight);
            this.token = NameNormalizer.normalize(token);
            this.domain = domain;
        }

        @Override
        public PatternKind getKind() {
            return PatternKind.CONTEXT;
        }

        @Override
        public String getValue() {
            return token;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContext(this);
        }
    }
}
