package com.operatorsedge.core.scanner;

import com.operatorsedge.core.config.EdgeProperties;
import com.operatorsedge.core.plan.PlanContext;
import com.operatorsedge.core.platform.ProjectPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the project tree and collects {@code TODO}, {@code FIXME} and {@code XXX} markers.
 * <p>
 * Common build-tool, VCS and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are excluded, as is the supervisor's own {@code .claude} directory.
 * Ignored directories are pruned, not descended. The walk stops after
 * {@code edge.patrol.max-files} files or {@code edge.patrol.max-findings} findings.
 */
@Service
public class ProjectPatrolScanner implements PatrolScanner {

    private static final Logger log = LoggerFactory.getLogger(ProjectPatrolScanner.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next",
            ".claude", ".codex", ".proof", ".venv", "venv"
    );

    /** Extensions worth reading; everything else is treated as binary or generated. */
    private static final Set<String> TEXT_EXTENSIONS = Set.of(
            "java", "kt", "py", "js", "ts", "tsx", "jsx", "go", "rs", "rb", "c", "h", "cpp",
            "cs", "sh", "md", "yaml", "yml", "toml", "sql", "html", "css", "scala", "swift"
    );

    private static final long MAX_FILE_BYTES = 512 * 1024;

    private static final Pattern MARKER = Pattern.compile("\\b(TODO|FIXME|XXX)\\b[:(\\s]*(.*)");

    private final Path projectRoot;
    private final int maxFiles;
    private final int maxFindings;

    public ProjectPatrolScanner(ProjectPaths paths, EdgeProperties properties) {
        this.projectRoot = paths.projectDir();
        this.maxFiles = properties.getPatrol().getMaxFiles();
        this.maxFindings = properties.getPatrol().getMaxFindings();
    }

    @Override
    public List<PatrolFinding> scan(PlanContext plan) {
        if (!Files.isDirectory(projectRoot)) {
            return List.of();
        }
        List<Path> files = collectFiles();
        var findings = new ArrayList<PatrolFinding>();
        for (Path file : files) {
            if (findings.size() >= maxFindings) {
                break;
            }
            scanFile(file, findings);
        }
        log.debug("Patrol scanned {} files, {} findings", files.size(), findings.size());
        return findings;
    }

    /**
     * Collects readable text files, pruning ignored directories without descending into them.
     * Every regular file visited counts toward {@code max-files}, text or not.
     */
    private List<Path> collectFiles() {
        var files = new ArrayList<Path>();
        int[] visited = {0};
        try {
            Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(projectRoot) && IGNORE_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (++visited[0] > maxFiles) {
                        log.debug("Patrol stopped after {} files", maxFiles);
                        return FileVisitResult.TERMINATE;
                    }
                    if (isText(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Patrol could not visit {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Patrol walk of " + projectRoot + " failed", e);
        }
        return files;
    }

    private void scanFile(Path file, List<PatrolFinding> findings) {
        List<String> lines;
        try {
            if (Files.size(file) > MAX_FILE_BYTES) {
                return;
            }
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("Skipping non-UTF-8 file {}", file);
            return;
        } catch (IOException e) {
            log.warn("Could not read {} during patrol: {}", file, e.getMessage());
            return;
        }
        String relative = projectRoot.relativize(file).toString().replace('\\', '/');
        for (int i = 0; i < lines.size() && findings.size() < maxFindings; i++) {
            Matcher matcher = MARKER.matcher(lines.get(i));
            if (matcher.find()) {
                findings.add(new PatrolFinding(relative, i + 1, matcher.group(1), matcher.group(2).strip()));
            }
        }
    }

    private static boolean isText(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && TEXT_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
