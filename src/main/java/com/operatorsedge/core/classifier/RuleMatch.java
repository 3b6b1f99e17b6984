package com.operatorsedge.core.classifier;

import com.operatorsedge.core.model.JunctionType;

import java.util.Locale;

/**
 * A rule that fired, and the text it fired on.
 */
public record RuleMatch(
    ClassificationRule rule,
    String matchedText
) {

    public JunctionType verdict() {
        return rule.verdict();
    }

    public String describe() {
        return rule.verdict().name().toLowerCase(Locale.ROOT) + " (" + rule.name() + "): \"" + matchedText.strip() + "\"";
    }
}
