package com.operatorsedge.core.scanner;

/**
 * A marker comment found while patrolling the project.
 *
 * @param path   file path relative to the project root
 * @param line   1-based line number
 * @param marker {@code TODO}, {@code FIXME} or {@code XXX}
 * @param text   the rest of the comment, trimmed
 */
public record PatrolFinding(String path, int line, String marker, String text) {

    public String describe() {
        return path + ":" + line + " " + marker + (text.isEmpty() ? "" : " " + text);
    }
}
