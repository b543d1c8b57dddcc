package com.cgi.schemasense.engine;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.model.enums.DomainCategory;
import com.cgi.schemasense.model.enums.Regulation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegulationResolverTest {

    private static final Set<Regulation> ALL = EnumSet.allOf(Regulation.class);

    private static ClassificationProperties californiaProperties() {
        ClassificationProperties properties = new ClassificationProperties();
        Map<DomainCategory, Regulation> california = new EnumMap<>(DomainCategory.class);
        california.put(DomainCategory.GENERAL, Regulation.CCPA);
        california.put(DomainCategory.BUSINESS, Regulation.CCPA);
        properties.getRegulations().getRegionOverrides().put("US-CA", california);
        return properties;
    }

    @Test
    void domainDefaults() {
        RegulationResolver resolver = new RegulationResolver(new ClassificationProperties());

        assertEquals(Set.of(Regulation.HIPAA), resolver.resolve(Set.of(), DomainCategory.HEALTHCARE, null, ALL));
        assertEquals(Set.of(Regulation.GDPR), resolver.resolve(Set.of(), DomainCategory.FINANCIAL, null, ALL));
        assertEquals(Set.of(Regulation.GDPR), resolver.resolve(Set.of(), DomainCategory.GENERAL, null, ALL));
    }

    @Test
    @DisplayName("HIPAA-tagged patterns do not pull non-healthcare tables into HIPAA")
    void hipaaPatternOutsideHealthcare() {
        RegulationResolver resolver = new RegulationResolver(new ClassificationProperties());

        assertEquals(Set.of(Regulation.GDPR),
                resolver.resolve(Set.of(Regulation.HIPAA), DomainCategory.FINANCIAL, null, ALL));
    }

    @Test
    void pciPatternOverridesDomainWhenRequested() {
        RegulationResolver resolver = new RegulationResolver(new ClassificationProperties());

        assertEquals(Set.of(Regulation.PCI_DSS),
                resolver.resolve(Set.of(Regulation.PCI_DSS), DomainCategory.FINANCIAL, null, ALL));
        assertEquals(Set.of(Regulation.GDPR),
                resolver.resolve(Set.of(Regulation.PCI_DSS), DomainCategory.FINANCIAL, null,
                        EnumSet.of(Regulation.GDPR)));
    }

    @Test
    void regionOverrideReplacesDomainDefault() {
        RegulationResolver resolver = new RegulationResolver(californiaProperties());

        assertEquals(Regulation.CCPA, resolver.defaultFor(DomainCategory.BUSINESS, "us-ca"));
        assertEquals(Regulation.GDPR, resolver.defaultFor(DomainCategory.FINANCIAL, "US-CA"));
        assertEquals(Regulation.GDPR, resolver.defaultFor(DomainCategory.BUSINESS, "EU"));
        assertEquals(Regulation.HIPAA, resolver.defaultFor(DomainCategory.HEALTHCARE, "US-CA"));
    }

    @Test
    void rejectsHipaaOutsideHealthcare() {
        ClassificationProperties domainMisconfigured = new ClassificationProperties();
        domainMisconfigured.getRegulations().getDomainDefaults().put(DomainCategory.FINANCIAL, Regulation.HIPAA);
        assertThrows(IllegalArgumentException.class, () -> new RegulationResolver(domainMisconfigured));

        ClassificationProperties regionMisconfigured = new ClassificationProperties();
        regionMisconfigured.getRegulations().getRegionOverrides()
                .put("US", Map.of(DomainCategory.BUSINESS, Regulation.HIPAA));
        assertThrows(IllegalArgumentException.class, () -> new RegulationResolver(regionMisconfigured));

        ClassificationProperties overrideMisconfigured = new ClassificationProperties();
        overrideMisconfigured.getRegulations().setPatternOverrides(EnumSet.of(Regulation.HIPAA));
        assertThrows(IllegalArgumentException.class, () -> new RegulationResolver(overrideMisconfigured));
    }

    @Test
    void rejectsIncompleteDomainMapping() {
        ClassificationProperties properties = new ClassificationProperties();
        properties.getRegulations().getDomainDefaults().remove(DomainCategory.EDUCATION);

        assertThrows(IllegalArgumentException.class, () -> new RegulationResolver(properties));
    }
}
