package decentralabs.gmp.service.relay;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import javax.sql.DataSource;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import decentralabs.gmp.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Last processed source nonce per route. Written through to the {@code relay_cursors}
 * table when a datasource is configured, kept in memory either way so a database
 * outage never stalls the relay.
 */
@Repository
@Slf4j
public class RelayCursorRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Map<RelayRoute, Long> cursors = new ConcurrentHashMap<>();

    public RelayCursorRepository(ObjectProvider<DataSource> dataSource) {
        DataSource ds = dataSource.getIfAvailable();
        this.jdbcTemplate = ds != null ? new JdbcTemplate(ds) : null;
    }

    RelayCursorRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long load(RelayRoute route) {
        Long cached = cursors.get(route);
        if (cached != null) {
            return cached;
        }
        long stored = findStored(route).orElse(0L);
        cursors.put(route, stored);
        return stored;
    }

    public void save(RelayRoute route, long lastNonce) {
        cursors.put(route, lastNonce);
        if (jdbcTemplate == null) {
            return;
        }
        try {
            jdbcTemplate.update(
                """
                INSERT INTO relay_cursors (src_chain_id, dst_chain_id, last_nonce, updated_at)
                VALUES (?, ?, ?, ?)
                ON DUPLICATE KEY UPDATE
                    last_nonce = VALUES(last_nonce),
                    updated_at = VALUES(updated_at)
                """,
                route.srcChainId(),
                route.dstChainId(),
                lastNonce,
                Timestamp.from(Instant.now())
            );
        } catch (Exception e) {
            log.warn("Cursor persistence skipped for route {}: {}", route.name(), LogSanitizer.sanitize(e.getMessage()));
        }
    }

    private Optional<Long> findStored(RelayRoute route) {
        if (jdbcTemplate == null) {
            return Optional.empty();
        }
        try {
            List<Long> rows = jdbcTemplate.queryForList(
                "SELECT last_nonce FROM relay_cursors WHERE src_chain_id = ? AND dst_chain_id = ?",
                Long.class,
                route.srcChainId(),
                route.dstChainId()
            );
            return rows.stream().findFirst();
        } catch (Exception e) {
            log.warn("Cursor lookup skipped for route {}: {}", route.name(), LogSanitizer.sanitize(e.getMessage()));
            return Optional.empty();
        }
    }
}
