package com.operatorsedge.core.dispatch;

import com.operatorsedge.core.junction.JunctionDecision;

import java.util.Locale;
import java.util.Optional;

/**
 * A human response parsed from the turn's command string.
 *
 * @param kind            what the human decided
 * @param suppressMinutes window for {@link Kind#DISMISS}, null for the default
 */
public record HumanDecision(Kind kind, Integer suppressMinutes) {

    public enum Kind {
        APPROVE,
        SKIP,
        DISMISS,
        STOP,
        START;

        /**
         * Junction resolution for this decision; {@code START} resolves nothing.
         */
        public Optional<JunctionDecision> junctionDecision() {
            return switch (this) {
                case APPROVE -> Optional.of(JunctionDecision.APPROVE);
                case SKIP -> Optional.of(JunctionDecision.SKIP);
                case DISMISS -> Optional.of(JunctionDecision.DISMISS);
                case STOP -> Optional.of(JunctionDecision.STOP);
                case START -> Optional.empty();
            };
        }
    }

    /**
     * Parses {@code approve}, {@code skip}, {@code dismiss [minutes]}, {@code stop}/{@code off}
     * and {@code start}/{@code on}. A leading {@code /} or {@code edge} word is ignored.
     *
     * @return the decision, or empty when the text is blank or not a decision
     */
    public static Optional<HumanDecision> parse(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        String[] words = command.strip().toLowerCase(Locale.ROOT).split("\\s+");
        int i = 0;
        if (words[i].startsWith("/")) {
            words[i] = words[i].substring(1);
        }
        if ((words[i].equals("edge") || words[i].isEmpty()) && words.length > 1) {
            i++;
        }

        Kind kind = switch (words[i]) {
            case "approve", "yes", "proceed" -> Kind.APPROVE;
            case "skip" -> Kind.SKIP;
            case "dismiss" -> Kind.DISMISS;
            case "stop", "off" -> Kind.STOP;
            case "start", "on" -> Kind.START;
            default -> null;
        };
        if (kind == null) {
            return Optional.empty();
        }

        Integer minutes = null;
        if (kind == Kind.DISMISS && i + 1 < words.length && words[i + 1].matches("\\d{1,6}")) {
            int value = Integer.parseInt(words[i + 1]);
            minutes = value > 0 ? value : null;
        }
        return Optional.of(new HumanDecision(kind, minutes));
    }

    public String word() {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
