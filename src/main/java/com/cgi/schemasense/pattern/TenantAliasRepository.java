package com.cgi.schemasense.pattern;

import com.cgi.schemasense.exception.AliasStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Tenant alias records, stored in the {@code tenant_alias} table so registrations survive restarts.
 */
@Repository
public class TenantAliasRepository {
    private static final Logger log = LoggerFactory.getLogger(TenantAliasRepository.class);

    private static final String COLUMNS = "tenant, pattern, pii_type, confidence, regulation, alias_of, risk, weight";

    private static final RowMapper<PatternRecord> ROW_MAPPER = (rs, rowNum) -> PatternRecord.builder()
            .pattern(rs.getString("pattern"))
            .piiType(rs.getString("pii_type"))
            .confidence((Double) rs.getObject("confidence"))
            .regulation(rs.getString("regulation"))
            .aliasOf(rs.getString("alias_of"))
            .risk(rs.getString("risk"))
            .weight((Double) rs.getObject("weight"))
            .kind(PatternKind.ALIAS.name())
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public TenantAliasRepository(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    TenantAliasRepository(DataSource dataSource, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(10);
        this.clock = clock;
    }

    /**
     * Appends alias records for a tenant in one batch.
     *
     * @param tenant Normalized tenant key
     * @param records Accepted alias records
     */
    public void saveAll(String tenant, List<PatternRecord> records) {
        long now = clock.millis();
        List<Object[]> rows = new ArrayList<>(records.size());
        for (PatternRecord record : records) {
            rows.add(new Object[]{tenant, record.getPattern(), record.getPiiType(), record.getConfidence(),
                    record.getRegulation(), record.getAliasOf(), record.getRisk(), record.getWeight(), now});
        }
        execute("store tenant aliases", jdbc -> jdbc.batchUpdate(
                "INSERT INTO tenant_alias (" + COLUMNS + ", created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)", rows));
    }

    public List<PatternRecord> findByTenant(String tenant) {
        return execute("find tenant aliases", jdbc -> jdbc.query(
                "SELECT " + COLUMNS + " FROM tenant_alias WHERE tenant = ? ORDER BY id", ROW_MAPPER, tenant));
    }

    /**
     * Every stored alias, grouped by tenant in registration order.
     */
    public Map<String, List<PatternRecord>> findAllByTenant() {
        return execute("load tenant aliases", jdbc -> {
            Map<String, List<PatternRecord>> byTenant = new LinkedHashMap<>();
            jdbc.query("SELECT " + COLUMNS + " FROM tenant_alias ORDER BY id", rs -> {
                byTenant.computeIfAbsent(rs.getString("tenant"), k -> new ArrayList<>())
                        .add(ROW_MAPPER.mapRow(rs, rs.getRow()));
            });
            return byTenant;
        });
    }

    private <T> T execute(String operationName, Function<JdbcTemplate, T> operation) {
        try {
            log.debug("Executing alias store operation: {}", operationName);
            return operation.apply(jdbcTemplate);
        } catch (DataAccessException e) {
            log.error("Database error during {}: {}", operationName, e.getMessage(), e);
            throw new AliasStoreException("Error during " + operationName, e);
        }
    }
}
