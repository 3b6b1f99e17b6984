package com.operatorsedge.core.classifier;

import com.operatorsedge.core.model.JunctionType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of a rule table: a predicate over normalized text and the verdict it yields.
 *
 * @param name    short identifier reported in junction reasons
 * @param pattern matched with {@link Matcher#find()} against lowercased text
 * @param verdict junction type produced on a match
 */
public record ClassificationRule(
    String name,
    Pattern pattern,
    JunctionType verdict
) {

    public static ClassificationRule of(String name, String regex, JunctionType verdict) {
        return new ClassificationRule(name, Pattern.compile(regex), verdict);
    }

    /**
     * Returns the matched fragment, or empty when the rule does not apply.
     */
    public Optional<String> match(String normalizedText) {
        Matcher matcher = pattern.matcher(normalizedText);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
