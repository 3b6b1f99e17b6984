package com.operatorsedge.core.platform;

import com.operatorsedge.core.config.EdgeProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProjectPathsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Falls back to the working directory with default locations")
    void defaults() {
        ProjectPaths paths = ProjectPaths.resolve(new EdgeProperties(), Map.of(), tempDir);

        assertEquals(tempDir.toAbsolutePath().normalize(), paths.projectDir());
        assertEquals(paths.projectDir().resolve(".claude/state"), paths.stateDir());
        assertEquals(paths.projectDir().resolve("active_context.yaml"), paths.planFile());
        assertEquals(HostPlatform.GENERIC, paths.platform());
    }

    @Test
    @DisplayName("CLAUDE_PROJECT_DIR wins over CODEX_PROJECT_DIR and the working directory")
    void claudeEnvironment() {
        Path project = tempDir.resolve("proj");
        ProjectPaths paths = ProjectPaths.resolve(new EdgeProperties(), Map.of(
                "CLAUDE_PROJECT_DIR", project.toString(),
                "CODEX_PROJECT_DIR", tempDir.resolve("other").toString()), tempDir);

        assertEquals(project.toAbsolutePath().normalize(), paths.projectDir());
        assertEquals(HostPlatform.CLAUDE_CODE, paths.platform());
    }

    @Test
    @DisplayName("Codex host is detected from CODEX_PROJECT_DIR or CODEX_HOME")
    void codexEnvironment() {
        ProjectPaths paths = ProjectPaths.resolve(new EdgeProperties(),
                Map.of("CODEX_PROJECT_DIR", tempDir.toString()), Path.of("/elsewhere"));

        assertEquals(tempDir.toAbsolutePath().normalize(), paths.projectDir());
        assertEquals(HostPlatform.CODEX_CLI, paths.platform());
        assertEquals(HostPlatform.CODEX_CLI, HostPlatform.detect(Map.of("CODEX_HOME", "/home/u/.codex")));
        assertEquals(HostPlatform.GENERIC, HostPlatform.detect(Map.of("CLAUDE_PROJECT_DIR", " ")));
    }

    @Test
    @DisplayName("Configured paths override the environment and resolve against the project")
    void configuredPaths() {
        var properties = new EdgeProperties();
        properties.setProjectDir(tempDir.toString());
        properties.setStateDir("var/edge");
        properties.setPlanFile("plans/current.yaml");

        ProjectPaths paths = ProjectPaths.resolve(properties,
                Map.of("CLAUDE_PROJECT_DIR", "/ignored"), Path.of("/elsewhere"));

        Path project = tempDir.toAbsolutePath().normalize();
        assertEquals(project, paths.projectDir());
        assertEquals(project.resolve("var/edge"), paths.stateDir());
        assertEquals(project.resolve("plans/current.yaml"), paths.planFile());
        assertEquals(HostPlatform.CLAUDE_CODE, paths.platform());
    }
}
