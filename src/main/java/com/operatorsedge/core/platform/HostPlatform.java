package com.operatorsedge.core.platform;

import java.util.Map;

/**
 * Agent host the supervisor runs under, detected from the environment.
 */
public enum HostPlatform {
    CLAUDE_CODE,
    CODEX_CLI,
    GENERIC;

    public static HostPlatform detect(Map<String, String> env) {
        if (isSet(env, "CLAUDE_PROJECT_DIR")) {
            return CLAUDE_CODE;
        }
        if (isSet(env, "CODEX_PROJECT_DIR") || isSet(env, "CODEX_HOME")) {
            return CODEX_CLI;
        }
        return GENERIC;
    }

    static boolean isSet(Map<String, String> env, String name) {
        String value = env.get(name);
        return value != null && !value.isBlank();
    }
}
