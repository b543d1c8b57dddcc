package com.cgi.schemasense.engine;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.Regulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the regulations of a sensitive field from its table domain.
 * <p>
 * A regulation-specific pattern may replace the domain mapping, but only for the regulations
 * configured as pattern overrides (PCI-DSS, CCPA by default) and only when they were requested.
 * Otherwise the region mapping applies, then the domain default. HIPAA is reserved for
 * healthcare tables; a configuration mapping it anywhere else is rejected.
 */
@Component
public class RegulationResolver {
    private static final Logger log = LoggerFactory.getLogger(RegulationResolver.class);

    private final Map<DomainCategory, Regulation> domainDefaults;
    private final Map<String, Map<DomainCategory, Regulation>> regionOverrides;
    private final Set<Regulation> patternOverrides;

    public RegulationResolver(ClassificationProperties properties) {
        ClassificationProperties.Regulations config = properties.getRegulations();

        Map<DomainCategory, Regulation> defaults = new EnumMap<>(DomainCategory.class);
        defaults.putAll(config.getDomainDefaults());
        for (DomainCategory domain : DomainCategory.values()) {
            Regulation regulation = defaults.get(domain);
            if (regulation == null) {
                throw new IllegalArgumentException("No default regulation configured for domain " + domain);
            }
            checkHipaa(domain, regulation, "domain default");
        }

        Map<String, Map<DomainCategory, Regulation>> regions = new HashMap<>();
        config.getRegionOverrides().forEach((region, mapping) -> {
            Map<DomainCategory, Regulation> copy = new EnumMap<>(DomainCategory.class);
            mapping.forEach((domain, regulation) -> {
                checkHipaa(domain, regulation, "region " + region);
                copy.put(domain, regulation);
            });
            regions.put(regionKey(region), Collections.unmodifiableMap(copy));
        });

        Set<Regulation> overrides = config.getPatternOverrides().isEmpty()
                ? EnumSet.noneOf(Regulation.class)
                : EnumSet.copyOf(config.getPatternOverrides());
        if (overrides.contains(Regulation.HIPAA)) {
            throw new IllegalArgumentException("HIPAA cannot override the domain mapping outside healthcare tables");
        }

        this.domainDefaults = Collections.unmodifiableMap(defaults);
        this.regionOverrides = Collections.unmodifiableMap(regions);
        this.patternOverrides = Collections.unmodifiableSet(overrides);
        log.info("Regulation resolver initialized: defaults={}, regions={}, pattern overrides={}",
                domainDefaults, regionOverrides.keySet(), patternOverrides);
    }

    /**
     * Regulation a domain maps to, taking the region mapping into account.
     *
     * @param domain Table domain
     * @param region Region code, may be null
     * @return Mapped regulation
     */
    public Regulation defaultFor(DomainCategory domain, String region) {
        DomainCategory effective = domain != null ? domain : DomainCategory.GENERAL;
        if (region != null && !region.isBlank()) {
            Map<DomainCategory, Regulation> mapping = regionOverrides.get(regionKey(region));
            if (mapping != null && mapping.containsKey(effective)) {
                return mapping.get(effective);
            }
        }
        return domainDefaults.get(effective);
    }

    /**
     * Regulations of a sensitive field. Never empty.
     *
     * @param patternRegulations Regulations the matching pattern is tagged with
     * @param domain Table domain
     * @param region Region code, may be null
     * @param requested Requested regulations; empty means all
     * @return Applicable regulations
     */
    public Set<Regulation> resolve(Set<Regulation> patternRegulations, DomainCategory domain, String region,
                                   Set<Regulation> requested) {
        Set<Regulation> triggered = EnumSet.noneOf(Regulation.class);
        if (patternRegulations != null) {
            for (Regulation regulation : patternRegulations) {
                if (patternOverrides.contains(regulation)
                        && (requested == null || requested.isEmpty() || requested.contains(regulation))) {
                    triggered.add(regulation);
                }
            }
        }
        if (!triggered.isEmpty()) {
            return triggered;
        }
        return EnumSet.of(defaultFor(domain, region));
    }

    public Map<DomainCategory, Regulation> getDomainDefaults() {
        return domainDefaults;
    }

    private static void checkHipaa(DomainCategory domain, Regulation regulation, String source) {
        if (regulation == Regulation.HIPAA && domain != DomainCategory.HEALTHCARE) {
            throw new IllegalArgumentException("HIPAA is reserved for healthcare tables, but " + source
                    + " maps it to " + domain);
        }
    }

    private static String regionKey(String region) {
        return region.trim().toUpperCase(Locale.ROOT);
    }
}
