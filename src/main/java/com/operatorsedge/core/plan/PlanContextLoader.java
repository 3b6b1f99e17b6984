package com.operatorsedge.core.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads {@code active_context.yaml}. The file is owned by the agent and never written here.
 * <p>
 * A missing or unreadable file yields {@link PlanContext#empty()}, which every consumer
 * treats as "no objective". The placeholder objective written by project setup also
 * counts as no objective.
 */
public class PlanContextLoader {

    private static final Logger log = LoggerFactory.getLogger(PlanContextLoader.class);

    static final String PLACEHOLDER_OBJECTIVE = "Set your objective here";

    private final Path planFile;
    private final ObjectMapper yaml;

    public PlanContextLoader(Path planFile) {
        this.planFile = planFile;
        this.yaml = new YAMLMapper();
    }

    public Path getPlanFile() {
        return planFile;
    }

    public boolean exists() {
        return Files.isRegularFile(planFile);
    }

    /**
     * Parses the file without interpreting it.
     *
     * @return the parse error, or null when the file is missing or parses
     */
    public String readError() {
        if (!exists()) {
            return null;
        }
        try {
            yaml.readTree(planFile.toFile());
            return null;
        } catch (IOException e) {
            return e.getMessage();
        }
    }

    public PlanContext load() {
        if (!exists()) {
            log.debug("No plan file at {}", planFile);
            return PlanContext.empty();
        }
        JsonNode root;
        try {
            root = yaml.readTree(planFile.toFile());
        } catch (IOException e) {
            log.warn("Plan file {} is unreadable, treating as no objective: {}", planFile, e.getMessage());
            return PlanContext.empty();
        }
        if (root == null || !root.isObject()) {
            return PlanContext.empty();
        }
        return parse(root);
    }

    static PlanContext parse(JsonNode root) {
        String objective = textOrNull(root.path("objective"));
        if (objective != null && objective.strip().equals(PLACEHOLDER_OBJECTIVE)) {
            objective = null;
        }

        var steps = new ArrayList<PlanStep>();
        JsonNode plan = root.path("plan");
        if (plan.isArray()) {
            int index = 0;
            for (JsonNode node : plan) {
                steps.add(node.isObject()
                        ? new PlanStep(index,
                                textOrNull(node.path("description")),
                                StepStatus.parse(textOrNull(node.path("status"))),
                                textOrNull(node.path("proof")),
                                textOrNull(node.path("command")),
                                textOrNull(node.path("control")))
                        : new PlanStep(index, node.asText(), StepStatus.PENDING, null, null, null));
                index++;
            }
        }

        return new PlanContext(
                objective,
                root.path("current_step").asInt(0),
                steps,
                notes(root.path("constraints"), "constraint"),
                notes(root.path("risks"), "risk"),
                notes(root.path("lessons"), "lesson"));
    }

    /**
     * Notes may be plain strings or small maps such as {@code {risk: ..., mitigation: ...}};
     * the named field wins, then {@code description}, then the whole entry.
     */
    private static List<String> notes(JsonNode node, String field) {
        if (!node.isArray()) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (JsonNode entry : node) {
            String text;
            if (entry.isObject()) {
                text = textOrNull(entry.path(field));
                if (text == null) text = textOrNull(entry.path("description"));
                if (text == null) text = entry.toString();
            } else {
                text = textOrNull(entry);
            }
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }
}
