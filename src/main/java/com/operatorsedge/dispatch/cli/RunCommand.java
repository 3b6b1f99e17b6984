package com.operatorsedge.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.operatorsedge.core.dispatch.DispatchLoop;
import com.operatorsedge.core.dispatch.DispatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: edge run [decision...] [--output-file FILE | --output TEXT]
 * <p>
 * Runs one dispatch turn and prints the turn result as JSON on stdout. The exit code
 * is 0 whenever a result was printed; the result's {@code status} tells the host what happened.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Run one dispatch turn and print the result as JSON")
@Component
public class RunCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(arity = "0..*", paramLabel = "DECISION",
            description = "Human decision or command: approve, skip, dismiss [minutes], stop/off, start/on")
    private List<String> words = new ArrayList<>();

    @Option(names = "--output-file", paramLabel = "FILE",
            description = "File holding the agent's last output, checked for failure or open-choice language")
    private Path outputFile;

    @Option(names = "--output", paramLabel = "TEXT", description = "The agent's last output, inline")
    private String output;

    private final DispatchLoop dispatchLoop;
    private final ObjectMapper mapper;

    public RunCommand(DispatchLoop dispatchLoop, ObjectMapper mapper) {
        this.dispatchLoop = dispatchLoop;
        this.mapper = mapper;
    }

    @Override
    public void run() {
        String command = words == null || words.isEmpty() ? null : String.join(" ", words);
        DispatchResult result = dispatchLoop.runTurn(command, agentOutput());
        try {
            System.out.println(mapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Turn result not serializable: " + e.getMessage(), e);
        }
    }

    private String agentOutput() {
        if (output != null) {
            return output;
        }
        if (outputFile == null) {
            return null;
        }
        try {
            return Files.readString(outputFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read agent output from {}: {}", outputFile, e.getMessage());
            return null;
        }
    }
}
