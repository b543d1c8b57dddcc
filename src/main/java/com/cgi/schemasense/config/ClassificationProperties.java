package com.cgi.schemasense.config;

import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.Regulation;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the classification engine.
 * Maps to properties with the prefix "schemasense" in the application properties.
 * Every value has a default so components can be built without a Spring context.
 */
@Component
@ConfigurationProperties(prefix = "schemasense")
@Getter
@Setter
public class ClassificationProperties {

    private Matching matching = new Matching();
    private Context context = new Context();
    private Regulations regulations = new Regulations();
    private Cache cache = new Cache();
    private Batch batch = new Batch();
    private Orchestration orchestration = new Orchestration();
    private Ai ai = new Ai();
    private Tenants tenants = new Tenants();

    @Getter
    @Setter
    public static class Matching {
        /**
         * Minimum similarity for a fuzzy candidate to be accepted.
         */
        private double fuzzyThreshold = 0.75;

        /**
         * Confidence added when the column's SQL type agrees with the PII type.
         */
        private double dataTypeBonus = 0.05;

        /**
         * Location of the default pattern records.
         */
        private String patternResource = "patterns/sensitivity-patterns.json";
    }

    @Getter
    @Setter
    public static class Context {
        /**
         * Keywords per domain. Table and column names are tokenized and matched against these sets.
         */
        private Map<DomainCategory, Set<String>> keywords = defaultKeywords();

        /**
         * Weight of a keyword hit in the table name relative to a hit in a column name.
         */
        private double tableNameWeight = 2.0;

        /**
         * Minimum score the winning domain needs before it is considered at all.
         */
        private double minimumScore = 1.0;

        /**
         * Minimum share of the total score the winner must hold to count as dominant.
         */
        private double dominanceRatio = 0.40;

        /**
         * Context confidence below which the engine logs a warning.
         */
        private double lowConfidenceThreshold = 0.50;

        private static Map<DomainCategory, Set<String>> defaultKeywords() {
            Map<DomainCategory, Set<String>> keywords = new EnumMap<>(DomainCategory.class);
            keywords.put(DomainCategory.HEALTHCARE, new LinkedHashSet<>(List.of(
                    "patient", "medical", "clinical", "clinic", "hospital", "diagnosis", "diagnoses",
                    "prescription", "medication", "treatment", "physician", "doctor", "nurse", "lab",
                    "mrn", "icd", "npi", "allergy", "allergies", "vitals", "admission", "discharge",
                    "encounter", "pharmacy", "health", "healthcare", "procedure", "symptom")));
            keywords.put(DomainCategory.FINANCIAL, new LinkedHashSet<>(List.of(
                    "account", "bank", "banking", "credit", "debit", "card", "payment", "transaction",
                    "balance", "loan", "mortgage", "iban", "swift", "routing", "ledger", "billing",
                    "cvv", "wallet", "deposit", "finance", "financial")));
            keywords.put(DomainCategory.EDUCATION, new LinkedHashSet<>(List.of(
                    "student", "course", "enrollment", "grade", "gpa", "transcript", "school",
                    "teacher", "faculty", "campus", "semester", "classroom", "exam", "tuition")));
            keywords.put(DomainCategory.BUSINESS, new LinkedHashSet<>(List.of(
                    "customer", "client", "employee", "staff", "vendor", "supplier", "order", "product",
                    "sales", "department", "company", "shipping", "directory", "crm", "lead", "contact")));
            return keywords;
        }
    }

    @Getter
    @Setter
    public static class Regulations {
        /**
         * Regulation assigned to sensitive fields of each table domain.
         */
        private Map<DomainCategory, Regulation> domainDefaults = defaultDomainMapping();

        /**
         * Per-region replacements for the domain mapping, keyed by region code.
         */
        private Map<String, Map<DomainCategory, Regulation>> regionOverrides = new HashMap<>();

        /**
         * Regulations that replace the domain mapping when a regulation-specific pattern triggers them.
         */
        private Set<Regulation> patternOverrides = EnumSet.of(Regulation.PCI_DSS, Regulation.CCPA);

        private static Map<DomainCategory, Regulation> defaultDomainMapping() {
            Map<DomainCategory, Regulation> mapping = new EnumMap<>(DomainCategory.class);
            mapping.put(DomainCategory.HEALTHCARE, Regulation.HIPAA);
            mapping.put(DomainCategory.FINANCIAL, Regulation.GDPR);
            mapping.put(DomainCategory.EDUCATION, Regulation.GDPR);
            mapping.put(DomainCategory.BUSINESS, Regulation.GDPR);
            mapping.put(DomainCategory.GENERAL, Regulation.GDPR);
            return mapping;
        }
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * Minimum Jaccard similarity over column tuples for a cached session to be reused.
         */
        private double similarityThreshold = 0.95;

        /**
         * Capacity of the in-memory tier.
         */
        private int maxEntries = 500;

        /**
         * Time an entry stays valid after it was written.
         */
        private Duration ttl = Duration.ofHours(24);

        /**
         * Whether entries are also written to the embedded database.
         */
        private boolean persistentEnabled = true;

        /**
         * Capacity of the persistent tier; least recently used rows are evicted first.
         */
        private int maxPersistentEntries = 5000;
    }

    @Getter
    @Setter
    public static class Batch {
        /**
         * Schemas with at most this many columns are processed as a single batch.
         */
        private int smallSchemaThreshold = 20;

        /**
         * Tables with at least this many columns are always split into sub-batches.
         */
        private int largeTableThreshold = 75;

        /**
         * Maximum number of columns in one batch.
         */
        private int maxBatchSize = 50;

        /**
         * Number of batches classified concurrently.
         */
        private int workerLimit = 4;
    }

    @Getter
    @Setter
    public static class Orchestration {
        /**
         * Fields whose local confidence is below this value are edge cases.
         */
        private double confidenceThreshold = 0.70;

        /**
         * Maximum fraction of a schema's fields that may be escalated to the AI collaborator.
         */
        private double aiCeiling = 0.05;

        /**
         * Overall time budget of a session.
         */
        private Duration sessionTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Ai {
        private boolean enabled = false;
        private String url = "http://localhost:8001/classify";
        private Duration timeout = Duration.ofSeconds(15);
        private int maxFieldsPerCall = 8;
    }

    @Getter
    @Setter
    public static class Tenants {
        /**
         * Keep tenant alias records in the embedded database so they survive restarts.
         */
        private boolean persistentEnabled = true;
    }
}
