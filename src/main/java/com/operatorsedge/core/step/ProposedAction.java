package com.operatorsedge.core.step;

/**
 * An action a step wants to run next. Every proposed action is classified before
 * the loop lets it proceed unattended.
 */
public record ProposedAction(Kind kind, String text) {

    public enum Kind {
        SHELL,
        CONTROL
    }

    public static ProposedAction shell(String command) {
        return new ProposedAction(Kind.SHELL, command);
    }

    public static ProposedAction control(String command) {
        return new ProposedAction(Kind.CONTROL, command);
    }
}
