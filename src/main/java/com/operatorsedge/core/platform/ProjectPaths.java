package com.operatorsedge.core.platform;

import com.operatorsedge.core.config.EdgeProperties;

import java.nio.file.Path;
import java.util.Map;

/**
 * Resolved locations of the project, its state directory and its plan file.
 *
 * @param projectDir project root
 * @param stateDir   directory holding the state files
 * @param planFile   the agent-owned plan file
 * @param platform   detected agent host
 */
public record ProjectPaths(
    Path projectDir,
    Path stateDir,
    Path planFile,
    HostPlatform platform
) {

    public static final String STATE_SUBDIR = ".claude/state";
    public static final String PLAN_FILE_NAME = "active_context.yaml";

    /**
     * Project directory order: {@code edge.project-dir}, {@code CLAUDE_PROJECT_DIR},
     * {@code CODEX_PROJECT_DIR}, then {@code workingDir}. State directory and plan file
     * default to locations under the project directory.
     */
    public static ProjectPaths resolve(EdgeProperties properties, Map<String, String> env, Path workingDir) {
        Path projectDir;
        if (!properties.getProjectDir().isBlank()) {
            projectDir = Path.of(properties.getProjectDir());
        } else if (HostPlatform.isSet(env, "CLAUDE_PROJECT_DIR")) {
            projectDir = Path.of(env.get("CLAUDE_PROJECT_DIR"));
        } else if (HostPlatform.isSet(env, "CODEX_PROJECT_DIR")) {
            projectDir = Path.of(env.get("CODEX_PROJECT_DIR"));
        } else {
            projectDir = workingDir;
        }
        projectDir = projectDir.toAbsolutePath().normalize();

        Path stateDir = properties.getStateDir().isBlank()
                ? projectDir.resolve(STATE_SUBDIR)
                : projectDir.resolve(properties.getStateDir()).normalize();
        Path planFile = properties.getPlanFile().isBlank()
                ? projectDir.resolve(PLAN_FILE_NAME)
                : projectDir.resolve(properties.getPlanFile()).normalize();

        return new ProjectPaths(projectDir, stateDir, planFile, HostPlatform.detect(env));
    }
}
