package com.operatorsedge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.operatorsedge.core.junction.LegacyJunctionReader;
import com.operatorsedge.core.plan.PlanContextLoader;
import com.operatorsedge.core.platform.ProjectPaths;
import com.operatorsedge.core.store.StateJson;
import com.operatorsedge.core.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the path-dependent infrastructure: where the state and plan files live and
 * the store that guards them.
 */
@Configuration
public class EdgeConfig {

    private static final Logger log = LoggerFactory.getLogger(EdgeConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper stateObjectMapper() {
        return StateJson.newMapper();
    }

    @Bean
    public ProjectPaths projectPaths(EdgeProperties properties) {
        ProjectPaths paths = ProjectPaths.resolve(properties, System.getenv(), Path.of("").toAbsolutePath());
        log.debug("Project {} on {}, state in {}", paths.projectDir(), paths.platform(), paths.stateDir());
        return paths;
    }

    @Bean
    public StateStore stateStore(ProjectPaths paths, ObjectMapper stateObjectMapper, EdgeProperties properties) {
        return new StateStore(paths.stateDir(), stateObjectMapper,
                Duration.ofMillis(properties.getStore().getLockTimeoutMs()),
                properties.getStore().getLockPollMs());
    }

    @Bean
    public LegacyJunctionReader legacyJunctionReader(StateStore stateStore) {
        return new LegacyJunctionReader(stateStore);
    }

    @Bean
    public PlanContextLoader planContextLoader(ProjectPaths paths) {
        return new PlanContextLoader(paths.planFile());
    }
}
