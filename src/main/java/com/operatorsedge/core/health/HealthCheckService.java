package com.operatorsedge.core.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.operatorsedge.core.health.HealthStatus.Area;
import com.operatorsedge.core.junction.JunctionState;
import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.plan.PlanContextLoader;
import com.operatorsedge.core.platform.ProjectPaths;
import com.operatorsedge.core.store.LoadedState;
import com.operatorsedge.core.store.StateFiles;
import com.operatorsedge.core.store.StateStore;
import com.operatorsedge.core.store.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only installation checks: where the supervisor thinks it runs, whether its
 * state files parse, and whether legacy data is still waiting to be migrated.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProjectPaths paths;
    private final StateStore store;
    private final PlanContextLoader planLoader;

    public HealthCheckService(ProjectPaths paths, StateStore store, PlanContextLoader planLoader) {
        this.paths = paths;
        this.store = store;
        this.planLoader = planLoader;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPlatform());
        results.add(checkStateDirectory());
        for (String file : StateFiles.CURRENT) {
            results.add(checkStateFile(file));
        }
        results.add(checkLegacy());
        results.add(checkPlanFile());
        return results;
    }

    private HealthStatus checkPlatform() {
        return HealthStatus.up(Area.INSTALLATION, "platform", paths.platform() + " at " + paths.projectDir())
                .withFact("project_dir", paths.projectDir().toString());
    }

    private HealthStatus checkStateDirectory() {
        Path dir = paths.stateDir();
        HealthStatus status;
        if (!Files.exists(dir)) {
            status = HealthStatus.degraded(Area.INSTALLATION, "state-dir", "does not exist yet; created on first write");
        } else if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            status = HealthStatus.down(Area.INSTALLATION, "state-dir", "not a writable directory");
        } else {
            status = HealthStatus.up(Area.INSTALLATION, "state-dir", "writable");
        }
        return status.withFact("path", dir.toString());
    }

    private HealthStatus checkStateFile(String file) {
        LoadedState<JsonNode> loaded;
        try {
            loaded = store.inspect(file, JsonNode.class, MissingNode::getInstance);
        } catch (StateStoreException e) {
            log.warn("Health check could not read {}: {}", file, e.getMessage());
            return HealthStatus.down(Area.STATE, file, "Unreadable: " + e.getMessage());
        }
        return switch (loaded.status()) {
            case MISSING -> HealthStatus.up(Area.STATE, file, "Not created yet; defaults apply");
            case CORRUPT -> HealthStatus.down(Area.STATE, file,
                    "Corrupt (" + loaded.error() + "); defaults apply until the next write");
            case VALID -> {
                HealthStatus valid = HealthStatus.up(Area.STATE, file, "Valid");
                JsonNode schema = loaded.value().path("schema_version");
                yield schema.isMissingNode() ? valid : valid.withFact("schema_version", schema.asText());
            }
        };
    }

    private HealthStatus checkLegacy() {
        if (!store.exists(StateFiles.LEGACY_DISPATCH)) {
            return HealthStatus.up(Area.STATE, "legacy", "No legacy state");
        }
        JsonNode junction = store.read(StateFiles.JUNCTION, JsonNode.class, MissingNode::getInstance);
        int schema = junction.path("schema_version").asInt(0);
        HealthStatus status = schema >= JunctionState.CURRENT_SCHEMA_VERSION
                ? HealthStatus.up(Area.STATE, "legacy", StateFiles.LEGACY_DISPATCH + " present, already migrated")
                : HealthStatus.degraded(Area.STATE, "legacy",
                        StateFiles.LEGACY_DISPATCH + " present and not migrated; run 'edge migrate'");
        return status.withFact("schema_version", String.valueOf(schema));
    }

    private HealthStatus checkPlanFile() {
        String file = planLoader.getPlanFile().toString();
        if (!planLoader.exists()) {
            return HealthStatus.degraded(Area.PLAN, "plan", "not found; no objective").withFact("path", file);
        }
        String error = planLoader.readError();
        if (error != null) {
            return HealthStatus.down(Area.PLAN, "plan", "Unparseable: " + error).withFact("path", file);
        }
        PlanContext plan = planLoader.load();
        if (!plan.hasObjective()) {
            return HealthStatus.up(Area.PLAN, "plan", "No objective set").withFact("path", file);
        }
        return HealthStatus.up(Area.PLAN, "plan",
                        plan.completedCount() + "/" + plan.steps().size() + " steps completed")
                .withFact("path", file)
                .withFact("objective", plan.objective());
    }
}
