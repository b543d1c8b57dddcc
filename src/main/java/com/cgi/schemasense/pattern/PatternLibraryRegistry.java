package com.cgi.schemasense.pattern;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.exception.ClassificationInputException;
import com.cgi.schemasense.exception.PatternLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the default pattern library and the per-tenant libraries derived from it.
 * A tenant library is the default records plus the tenant's alias records; registering
 * aliases builds a new library and swaps it in. When an alias store is configured,
 * accepted aliases are written to it and reloaded on startup.
 */
@Component
public class PatternLibraryRegistry {
    private static final Logger log = LoggerFactory.getLogger(PatternLibraryRegistry.class);

    private final PatternLibrary defaultLibrary;
    private final TenantAliasRepository aliasRepository;
    private final Map<String, PatternLibrary> tenantLibraries = new ConcurrentHashMap<>();
    private final Map<String, List<PatternRecord>> tenantAliases = new ConcurrentHashMap<>();

    @Autowired
    public PatternLibraryRegistry(PatternSource patternSource, TenantAliasRepository aliasRepository,
                                  ClassificationProperties properties) {
        this(PatternLibrary.load(patternSource.loadRecords()),
                properties.getTenants().isPersistentEnabled() ? aliasRepository : null);
    }

    public PatternLibraryRegistry(PatternLibrary defaultLibrary) {
        this(defaultLibrary, null);
    }

    /**
     * Creates a registry and restores the tenant libraries held by the alias store.
     *
     * @param defaultLibrary Library shared by every tenant
     * @param aliasRepository Alias store, or null to keep aliases in memory only
     */
    public PatternLibraryRegistry(PatternLibrary defaultLibrary, TenantAliasRepository aliasRepository) {
        this.defaultLibrary = defaultLibrary;
        this.aliasRepository = aliasRepository;
        if (aliasRepository != null) {
            Map<String, List<PatternRecord>> stored = aliasRepository.findAllByTenant();
            stored.forEach((tenant, aliases) -> rebuild(tenant, aliases));
            log.info("Restored alias records for {} tenants", stored.size());
        }
    }

    public PatternLibrary getDefaultLibrary() {
        return defaultLibrary;
    }

    /**
     * Library for a tenant, or the default library when the tenant has no aliases.
     *
     * @param tenant Tenant identifier, may be null
     * @return Pattern library to classify with
     */
    public PatternLibrary forTenant(String tenant) {
        if (tenant == null || tenant.isBlank()) {
            return defaultLibrary;
        }
        return tenantLibraries.getOrDefault(tenantKey(tenant), defaultLibrary);
    }

    /**
     * Adds alias records for a tenant and rebuilds its library. Records the library rejects are
     * neither kept nor stored.
     *
     * @param tenant Tenant identifier
     * @param aliases Alias records; records without a kind are treated as aliases
     * @return The rebuilt tenant library
     */
    public synchronized PatternLibrary registerAliases(String tenant, List<PatternRecord> aliases) {
        if (tenant == null || tenant.isBlank()) {
            throw new ClassificationInputException("Tenant must not be blank");
        }
        if (aliases == null || aliases.isEmpty()) {
            throw new ClassificationInputException("No alias records supplied for tenant " + tenant);
        }
        String key = tenantKey(tenant);
        List<PatternRecord> incoming = new ArrayList<>();
        for (PatternRecord alias : aliases) {
            if (alias == null) {
                continue;
            }
            if (alias.getKind() == null || alias.getKind().isBlank()) {
                alias.setKind(PatternKind.ALIAS.name());
            } else if (!PatternKind.ALIAS.name().equalsIgnoreCase(alias.getKind().trim())) {
                throw new PatternLoadException("Tenant records must be aliases, got kind " + alias.getKind());
            }
            incoming.add(alias);
        }

        List<PatternRecord> merged = new ArrayList<>(tenantAliases.getOrDefault(key, List.of()));
        merged.addAll(incoming);
        List<PatternRecord> records = new ArrayList<>(defaultLibrary.getRecords());
        records.addAll(merged);
        PatternLibrary library = PatternLibrary.load(records);

        Set<PatternRecord> accepted = Collections.newSetFromMap(new IdentityHashMap<>());
        accepted.addAll(library.getRecords());
        List<PatternRecord> acceptedIncoming = new ArrayList<>();
        for (PatternRecord alias : incoming) {
            if (accepted.contains(alias)) {
                acceptedIncoming.add(alias);
            }
        }
        merged.removeIf(alias -> !accepted.contains(alias));

        if (aliasRepository != null && !acceptedIncoming.isEmpty()) {
            aliasRepository.saveAll(key, acceptedIncoming);
        }
        tenantAliases.put(key, List.copyOf(merged));
        tenantLibraries.put(key, library);
        log.info("Registered {} of {} alias records for tenant {} ({} in total)", acceptedIncoming.size(),
                aliases.size(), tenant, merged.size());
        return library;
    }

    /**
     * Alias records registered for a tenant, in registration order.
     *
     * @param tenant Tenant identifier
     * @return The tenant's aliases; empty when it has none
     */
    public List<PatternRecord> exportAliases(String tenant) {
        if (tenant == null || tenant.isBlank()) {
            throw new ClassificationInputException("Tenant must not be blank");
        }
        return tenantAliases.getOrDefault(tenantKey(tenant), List.of());
    }

    public int getTenantCount() {
        return tenantLibraries.size();
    }

    private void rebuild(String key, List<PatternRecord> aliases) {
        List<PatternRecord> records = new ArrayList<>(defaultLibrary.getRecords());
        records.addAll(aliases);
        tenantAliases.put(key, List.copyOf(aliases));
        tenantLibraries.put(key, PatternLibrary.load(records));
    }

    private static String tenantKey(String tenant) {
        return tenant.trim().toLowerCase(Locale.ROOT);
    }
}
