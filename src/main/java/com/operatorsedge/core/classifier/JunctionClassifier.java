package com.operatorsedge.core.classifier;

import com.operatorsedge.core.config.EdgeProperties;
import com.operatorsedge.core.model.JunctionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps a proposed action to a {@link JunctionType}. Deterministic and side-effect free.
 * <p>
 * When in doubt the verdict pauses: unknown control commands are AMBIGUOUS, and shell
 * commands are checked as a whole and per chained segment.
 */
@Service
public class JunctionClassifier {

    private static final Logger log = LoggerFactory.getLogger(JunctionClassifier.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CHAIN_SEPARATOR = Pattern.compile("\\s*(?:&&|\\|\\||;|\\|)\\s*");

    // "0 errors", "no failures", "without warnings" are success reports, not signals
    private static final Pattern NEGATED_COUNT = Pattern.compile(
            "\\b(?:0|no|zero|without)\\s+(?:errors?|failures?|failed|exceptions?|mismatch(?:es)?)\\b");

    private final Set<String> safeControlCommands;

    public JunctionClassifier(EdgeProperties properties) {
        this.safeControlCommands = properties.getClassifier().getSafeControlCommands().stream()
                .map(c -> c.strip().toLowerCase(Locale.ROOT))
                .filter(c -> !c.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public JunctionType classifyShellCommand(String command) {
        return matchShellCommand(command).map(RuleMatch::verdict).orElse(JunctionType.NONE);
    }

    /**
     * Returns the deciding rule for a shell command, or empty when the command is safe.
     */
    public Optional<RuleMatch> matchShellCommand(String command) {
        String normalized = normalize(command);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(normalized);
        for (String segment : CHAIN_SEPARATOR.split(normalized)) {
            if (!segment.isBlank() && !segment.equals(normalized)) {
                candidates.add(segment.strip());
            }
        }

        Optional<RuleMatch> match = firstMatch(ClassificationRules.SHELL_PRECEDENCE, candidates);
        match.ifPresent(m -> log.debug("Shell command matched {}", m.describe()));
        return match;
    }

    /**
     * Only allow-listed control commands run unattended; blank or unknown names pause.
     * A leading {@code /}, an {@code edge} prefix and any arguments are ignored.
     */
    public JunctionType classifyControlCommand(String name) {
        String command = controlCommandName(name);
        if (command.isEmpty() || !safeControlCommands.contains(command)) {
            log.debug("Control command '{}' is not allow-listed", name);
            return JunctionType.AMBIGUOUS;
        }
        return JunctionType.NONE;
    }

    public OutputJunction detectOutputJunction(String text) {
        String normalized = NEGATED_COUNT.matcher(normalize(text)).replaceAll(" ");
        if (normalized.isBlank()) {
            return OutputJunction.none();
        }
        return firstMatch(ClassificationRules.OUTPUT_PRECEDENCE, List.of(normalized))
                .map(m -> new OutputJunction(m.verdict(), "Output signals " + m.describe()))
                .orElse(OutputJunction.none());
    }

    static String controlCommandName(String name) {
        String command = normalize(name);
        while (command.startsWith("/")) {
            command = command.substring(1);
        }
        if (command.startsWith("edge-") || command.startsWith("edge:")) {
            command = command.substring(5);
        } else if (command.equals("edge") || command.startsWith("edge ")) {
            command = command.substring(4).strip();
        }
        int space = command.indexOf(' ');
        return space < 0 ? command : command.substring(0, space);
    }

    private static Optional<RuleMatch> firstMatch(List<JunctionType> precedence, List<String> candidates) {
        for (JunctionType tier : precedence) {
            for (ClassificationRule rule : ClassificationRules.tier(tier)) {
                for (String candidate : candidates) {
                    Optional<String> hit = rule.match(candidate);
                    if (hit.isPresent()) {
                        return Optional.of(new RuleMatch(rule, hit.get()));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
