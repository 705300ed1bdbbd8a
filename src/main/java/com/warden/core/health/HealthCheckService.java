package com.warden.core.health;

import com.warden.applier.Applier;
import com.warden.applier.ScriptApplier;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import com.warden.core.persistence.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final Ledger ledger;
    private final Applier applier;

    public HealthCheckService(DataSource dataSource, Ledger ledger, Applier applier) {
        this.dataSource = dataSource;
        this.ledger = ledger;
        this.applier = applier;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        results.add(checkLedger());
        results.add(checkApplier());
        return results;
    }

    private HealthStatus checkDatabase() {
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkLedger() {
        try {
            long events = ledger.events().count();
            int pending = ledger.updates().listByState(UpdateState.PENDING).size();
            var metadata = Map.of("events", String.valueOf(events), "pending", String.valueOf(pending));
            if (pending > 0) {
                return new HealthStatus("ledger", HealthStatus.Status.DEGRADED,
                        pending + " update(s) pending; run 'warden recover' if no apply is in progress", metadata);
            }
            return new HealthStatus("ledger", HealthStatus.Status.UP, "Event log readable", metadata);
        } catch (DataAccessException | StorageException e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                    "Ledger error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkApplier() {
        if (applier instanceof ScriptApplier script) {
            Path dir = script.getPluginDir();
            if (!Files.isDirectory(dir)) {
                return new HealthStatus("applier", HealthStatus.Status.DEGRADED,
                        "Plugin directory missing: " + dir, Map.of("pluginDir", dir.toString()));
            }
            return new HealthStatus("applier", HealthStatus.Status.UP,
                    "Script applier ready", Map.of("pluginDir", dir.toString()));
        }
        return new HealthStatus("applier", HealthStatus.Status.UP,
                "Applier available (" + applier.describe() + ")", Map.of());
    }
}
