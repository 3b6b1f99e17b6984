package com.operatorsedge.core.classifier;

import com.operatorsedge.core.model.JunctionType;

import java.util.List;
import java.util.Map;

import static com.operatorsedge.core.model.JunctionType.AMBIGUOUS;
import static com.operatorsedge.core.model.JunctionType.BLOCKED;
import static com.operatorsedge.core.model.JunctionType.EXTERNAL;
import static com.operatorsedge.core.model.JunctionType.IRREVERSIBLE;

/**
 * Ordered rule tables used by {@link JunctionClassifier}.
 * <p>
 * Patterns run against lowercased text with collapsed whitespace. Rules anchored with
 * {@code ^} only fire at the start of a command, which is why chained commands are also
 * evaluated segment by segment.
 */
public final class ClassificationRules {

    /** Tier order for shell commands: the first tier with any match decides. */
    public static final List<JunctionType> SHELL_PRECEDENCE = List.of(IRREVERSIBLE, EXTERNAL);

    /** Tier order for free-text output: a failure outranks an open choice. */
    public static final List<JunctionType> OUTPUT_PRECEDENCE = List.of(BLOCKED, AMBIGUOUS);

    // Optional flags/arguments between a command word and the flag we care about.
    private static final String ARGS = "(?:\\S+\\s+)*?";

    static final List<ClassificationRule> IRREVERSIBLE_RULES = List.of(
            ClassificationRule.of("recursive-or-forced-delete",
                    "\\brm\\s+" + ARGS + "-(?:-recursive|-force|[a-z]*[rf][a-z]*)\\b", IRREVERSIBLE),
            ClassificationRule.of("windows-recursive-delete",
                    "\\b(?:(?:rmdir|rd)\\s+" + ARGS + "/s|del\\s+" + ARGS + "/[sfq]|remove-item\\b.*-recurse)\\b", IRREVERSIBLE),
            ClassificationRule.of("find-delete", "\\bfind\\b.*\\s-delete\\b", IRREVERSIBLE),
            ClassificationRule.of("git-push", "\\bgit\\s+" + ARGS + "push\\b", IRREVERSIBLE),
            ClassificationRule.of("git-reset-hard", "\\bgit\\s+reset\\s+" + ARGS + "--hard\\b", IRREVERSIBLE),
            ClassificationRule.of("git-clean-force", "\\bgit\\s+clean\\s+" + ARGS + "-[a-z]*f", IRREVERSIBLE),
            ClassificationRule.of("git-history-rewrite",
                    "\\bgit\\s+(?:rebase|filter-branch|filter-repo|commit\\s+" + ARGS + "--amend)\\b", IRREVERSIBLE),
            ClassificationRule.of("git-branch-delete", "\\bgit\\s+branch\\s+" + ARGS + "-(?:d|-delete)\\b", IRREVERSIBLE),
            ClassificationRule.of("git-discard-changes",
                    "\\bgit\\s+(?:(?:checkout|restore)\\s+" + ARGS + "(?:--\\s+)?\\.(?:\\s|$)|stash\\s+(?:drop|clear))", IRREVERSIBLE),
            ClassificationRule.of("recursive-permission-change",
                    "\\bch(?:mod|own|grp)\\s+" + ARGS + "-(?:-recursive|[a-z]*r[a-z]*)\\b", IRREVERSIBLE),
            ClassificationRule.of("world-writable", "\\bchmod\\s+" + ARGS + "0?777\\b", IRREVERSIBLE),
            ClassificationRule.of("filesystem-format",
                    "\\b(?:mkfs(?:\\.[a-z0-9]+)?|wipefs|shred)\\b|\\bformat\\s+[a-z]:", IRREVERSIBLE),
            ClassificationRule.of("raw-device-write",
                    "\\bdd\\s+" + ARGS + "of=/dev/|>\\s*/dev/(?:sd|hd|nvme|disk|xvd)", IRREVERSIBLE),
            ClassificationRule.of("fork-bomb", ":\\s*\\(\\s*\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*}\\s*;\\s*:", IRREVERSIBLE),
            ClassificationRule.of("sql-destructive",
                    "\\b(?:drop\\s+(?:table|database|schema)|truncate\\s+table)\\b", IRREVERSIBLE),
            ClassificationRule.of("infrastructure-teardown",
                    "\\b(?:terraform|pulumi)\\s+" + ARGS + "destroy\\b|\\bkubectl\\s+" + ARGS + "delete\\b", IRREVERSIBLE),
            ClassificationRule.of("system-power", "^(?:sudo\\s+)?(?:shutdown|reboot|halt|poweroff)\\b", IRREVERSIBLE)
    );

    static final List<ClassificationRule> EXTERNAL_RULES = List.of(
            ClassificationRule.of("kubernetes", "\\b(?:kubectl|helm|kustomize)\\b", EXTERNAL),
            ClassificationRule.of("infrastructure",
                    "\\b(?:terraform|pulumi|ansible-playbook)\\b|\\bcdk\\s+deploy\\b", EXTERNAL),
            ClassificationRule.of("cloud-cli",
                    "^(?:sudo\\s+)?(?:aws|gcloud|gsutil|az|doctl|heroku|flyctl|vercel|netlify|firebase|wrangler)\\s", EXTERNAL),
            ClassificationRule.of("container-registry", "\\b(?:docker|podman)\\s+(?:push|login)\\b", EXTERNAL),
            ClassificationRule.of("package-publish",
                    "\\b(?:(?:npm|yarn|pnpm|cargo|poetry)\\s+publish|twine\\s+upload|gem\\s+push|dotnet\\s+nuget\\s+push)\\b"
                            + "|\\bmvnw?\\s+" + ARGS + "deploy\\b|\\bgradlew?\\s+" + ARGS + "publish", EXTERNAL),
            ClassificationRule.of("http-client",
                    "\\b(?:curl|wget|httpie|invoke-webrequest|invoke-restmethod)\\b", EXTERNAL),
            ClassificationRule.of("remote-shell", "^(?:sudo\\s+)?(?:ssh|scp|sftp)\\s|\\brsync\\b.*\\s\\S+:\\S*", EXTERNAL),
            ClassificationRule.of("github-cli", "\\bgh\\s+(?:pr|release|issue|repo|api|workflow)\\b", EXTERNAL),
            ClassificationRule.of("remote-database",
                    "\\b(?:psql|mysql|mongosh|mongo|redis-cli)\\s+" + ARGS + "(?:-h|--host)\\b", EXTERNAL)
    );

    static final List<ClassificationRule> BLOCKED_RULES = List.of(
            ClassificationRule.of("error", "\\berrors?\\b", BLOCKED),
            ClassificationRule.of("exception", "\\b(?:exception|traceback)\\b", BLOCKED),
            ClassificationRule.of("failure", "\\b(?:failed|failure|failing|fails)\\b", BLOCKED),
            ClassificationRule.of("fatal", "\\b(?:fatal|panic(?:ked)?)\\b", BLOCKED),
            ClassificationRule.of("mismatch", "\\bmismatch(?:ed)?\\b", BLOCKED),
            ClassificationRule.of("cannot-proceed", "\\b(?:cannot|can't|could not|couldn't|unable to)\\b", BLOCKED),
            ClassificationRule.of("not-found", "\\b(?:not found|no such file)\\b", BLOCKED),
            ClassificationRule.of("permission-denied", "\\bpermission denied\\b", BLOCKED),
            ClassificationRule.of("timeout", "\\btimed? ?out\\b", BLOCKED),
            ClassificationRule.of("blocked", "\\bblocked\\b", BLOCKED)
    );

    static final List<ClassificationRule> AMBIGUOUS_RULES = List.of(
            ClassificationRule.of("choose-between", "\\bchoose (?:between|from|one)\\b", AMBIGUOUS),
            ClassificationRule.of("which-option", "\\bwhich (?:option|approach|one|would you)\\b", AMBIGUOUS),
            ClassificationRule.of("alternatives", "\\b(?:alternatively|alternatives?)\\b", AMBIGUOUS),
            ClassificationRule.of("options-list", "\\boption [a-c1-3]\\b|\\boptions:", AMBIGUOUS),
            ClassificationRule.of("several-approaches",
                    "\\b(?:multiple|several|two|different) (?:approaches|options|ways)\\b", AMBIGUOUS),
            ClassificationRule.of("asks-preference", "\\b(?:would you (?:prefer|like)|do you want|should i)\\b", AMBIGUOUS),
            ClassificationRule.of("either-or", "\\beither\\b.+\\bor\\b", AMBIGUOUS),
            ClassificationRule.of("trade-off", "\\btrade-?offs?\\b", AMBIGUOUS),
            ClassificationRule.of("unclear", "\\b(?:unclear|ambiguous)\\b", AMBIGUOUS)
    );

    static final Map<JunctionType, List<ClassificationRule>> TIERS = Map.of(
            IRREVERSIBLE, IRREVERSIBLE_RULES,
            EXTERNAL, EXTERNAL_RULES,
            BLOCKED, BLOCKED_RULES,
            AMBIGUOUS, AMBIGUOUS_RULES
    );

    private ClassificationRules() {}

    public static List<ClassificationRule> tier(JunctionType type) {
        return TIERS.getOrDefault(type, List.of());
    }
}
