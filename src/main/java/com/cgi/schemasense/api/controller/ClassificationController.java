package com.cgi.schemasense.api.controller;

import com.cgi.schemasense.api.dto.ApiResponse;
import com.cgi.schemasense.api.dto.ClassificationRequest;
import com.cgi.schemasense.cache.SchemaCache;
import com.cgi.schemasense.exception.ClassificationInputException;
import com.cgi.schemasense.model.ClassificationSession;
import com.cgi.schemasense.pattern.PatternLibrary;
import com.cgi.schemasense.pattern.PatternLibraryRegistry;
import com.cgi.schemasense.pattern.PatternRecord;
import com.cgi.schemasense.service.ClassificationMetricsCollector;
import com.cgi.schemasense.service.HybridOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for schema classification.
 */
@RestController
@RequestMapping("/api/classification")
@Tag(name = "Schema Classification", description = "API for classifying database columns by sensitivity and regulation")
public class ClassificationController {
    private static final Logger log = LoggerFactory.getLogger(ClassificationController.class);

    private final HybridOrchestrator orchestrator;
    private final SchemaCache schemaCache;
    private final PatternLibraryRegistry libraryRegistry;
    private final ClassificationMetricsCollector metricsCollector;

    @Autowired
    public ClassificationController(HybridOrchestrator orchestrator, SchemaCache schemaCache,
                                    PatternLibraryRegistry libraryRegistry,
                                    ClassificationMetricsCollector metricsCollector) {
        this.orchestrator = orchestrator;
        this.schemaCache = schemaCache;
        this.libraryRegistry = libraryRegistry;
        this.metricsCollector = metricsCollector;
    }

    @Operation(summary = "Classify the columns of a schema")
    @PostMapping("/scan")
    public ResponseEntity<ApiResponse<ClassificationSession>> scan(@RequestBody ClassificationRequest request) {
        if (request == null) {
            throw new ClassificationInputException("Request body is required");
        }
        int size = request.getSchema() != null ? request.getSchema().size() : 0;
        log.info("Starting schema classification: {} columns, regulations {}, region {}",
                size, request.getRegulations(), request.getRegion());

        ClassificationSession session = orchestrator.classifySchema(request.getSchema(),
                HybridOrchestrator.parseRegulations(request.getRegulations()),
                request.getRegion(), request.getTenant());

        log.info("Schema classification completed: {} sensitive fields out of {}",
                session.getSensitiveFields(), session.getTotalFields());
        if (session.isIncomplete()) {
            log.warn("Session {} hit its time budget, {} diagnostics recorded",
                    session.getSessionId(), session.getDiagnostics().size());
            return ResponseEntity.ok(ApiResponse.partial(session,
                    "Time budget expired; some fields carry fallback results"));
        }
        return ResponseEntity.ok(ApiResponse.success(session));
    }

    @Operation(summary = "Register tenant-specific alias patterns")
    @PostMapping("/tenants/{tenant}/aliases")
    public ResponseEntity<ApiResponse<Map<String, Object>>> registerAliases(
            @PathVariable String tenant,
            @RequestBody List<PatternRecord> aliases) {

        log.info("Registering {} aliases for tenant {}", aliases != null ? aliases.size() : 0, tenant);
        PatternLibrary library = libraryRegistry.registerAliases(tenant, aliases);
        return ResponseEntity.ok(ApiResponse.success(library.getStatistics()));
    }

    @Operation(summary = "Export the alias patterns registered for a tenant")
    @GetMapping("/tenants/{tenant}/aliases")
    public ResponseEntity<ApiResponse<List<PatternRecord>>> exportAliases(@PathVariable String tenant) {
        return ResponseEntity.ok(ApiResponse.success(libraryRegistry.exportAliases(tenant)));
    }

    @Operation(summary = "Get pattern library statistics")
    @GetMapping("/patterns/stats")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getPatternStatistics(
            @RequestParam(required = false) String tenant) {
        return ResponseEntity.ok(ApiResponse.success(libraryRegistry.forTenant(tenant).getStatistics()));
    }

    @Operation(summary = "Get schema cache statistics")
    @GetMapping("/cache/stats")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getCacheStatistics() {
        return ResponseEntity.ok(ApiResponse.success(schemaCache.getStatistics()));
    }

    @Operation(summary = "Clear the schema cache")
    @DeleteMapping("/cache")
    public ResponseEntity<ApiResponse<String>> clearCache() {
        log.info("Clearing schema cache");
        schemaCache.clear();
        return ResponseEntity.ok(ApiResponse.success("Schema cache cleared"));
    }

    @Operation(summary = "Get classification metrics")
    @GetMapping("/metrics")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getMetrics() {
        return ResponseEntity.ok(ApiResponse.success(metricsCollector.getMetricsReport()));
    }

    @Operation(summary = "Reset classification metrics")
    @DeleteMapping("/metrics")
    public ResponseEntity<ApiResponse<String>> resetMetrics() {
        log.info("Resetting classification metrics");
        metricsCollector.resetMetrics();
        return ResponseEntity.ok(ApiResponse.success("Metrics reset"));
    }
}
