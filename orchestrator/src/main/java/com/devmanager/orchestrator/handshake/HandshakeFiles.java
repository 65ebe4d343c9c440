package com.devmanager.orchestrator.handshake;

import com.devmanager.orchestrator.engine.EngineException;
import com.devmanager.orchestrator.engine.EngineException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * The file contract between the engine and the Worker for one project.
 *
 *   {@code <workspace>/<instructionsDir>/<instructionFile>}  written by the engine, read by the Worker
 *   {@code <workspace>/<logsDir>/<resultFile>}               written by the Worker, read by the engine
 *   {@code <workspace>/<logsDir>/processed/}                 consumed results, never deleted
 *
 * The instruction file is overwritten every cycle. A result file is moved into
 * processed/ under a timestamped name once its content is in the history, so
 * the next cycle starts from an empty logs directory.
 */
public class HandshakeFiles {

    private static final Logger log = LoggerFactory.getLogger(HandshakeFiles.class);

    public static final String PROCESSED_DIR = "processed";

    private static final DateTimeFormatter ARCHIVE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS");

    private final Path instructionsDir;
    private final Path logsDir;
    private final String instructionFileName;
    private final String resultFileName;

    public HandshakeFiles(Path workspaceRoot,
                          String instructionsDir,
                          String logsDir,
                          String instructionFileName,
                          String resultFileName) {
        this.instructionsDir     = workspaceRoot.resolve(instructionsDir).toAbsolutePath().normalize();
        this.logsDir             = workspaceRoot.resolve(logsDir).toAbsolutePath().normalize();
        this.instructionFileName = instructionFileName;
        this.resultFileName      = resultFileName;
    }

    /** Create the instructions, logs and processed directories if missing. */
    public void ensureDirectories() {
        try {
            Files.createDirectories(instructionsDir);
            Files.createDirectories(logsDir.resolve(PROCESSED_DIR));
        } catch (IOException e) {
            throw new EngineException(Kind.FILE_WRITE,
                    "Could not create handshake directories under " + logsDir.getParent() + ": " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Instruction side
    // ------------------------------------------------------------------

    public void writeInstruction(String instruction) {
        Path target = instructionFile();
        try {
            Files.createDirectories(instructionsDir);
            Files.writeString(target, instruction, StandardCharsets.UTF_8);
            log.info("Instruction written to {} ({} chars)", target, instruction.length());
        } catch (IOException e) {
            throw new EngineException(Kind.FILE_WRITE,
                    "Failed to write instruction file " + target + ": " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Result side
    // ------------------------------------------------------------------

    /**
     * True only for the fixed result filename directly inside the logs
     * directory; files in processed/ or any other name do not count.
     */
    public boolean isResultFile(Path path) {
        if (path == null) return false;
        Path normalized = path.toAbsolutePath().normalize();
        return normalized.getFileName() != null
                && normalized.getFileName().toString().equals(resultFileName)
                && logsDir.equals(normalized.getParent());
    }

    public String readResult(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EngineException(Kind.FILE_READ,
                    "Failed to read result file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Move a consumed result into processed/ with a timestamp suffix.
     *
     * @return the archived path
     */
    public Path archiveResult(Path path) {
        Path processed = logsDir.resolve(PROCESSED_DIR);
        String base = resultFileName;
        String ext  = "";
        int dot = resultFileName.lastIndexOf('.');
        if (dot > 0) {
            base = resultFileName.substring(0, dot);
            ext  = resultFileName.substring(dot);
        }
        String stamp = LocalDateTime.now().format(ARCHIVE_STAMP);
        try {
            Files.createDirectories(processed);
            Path target = processed.resolve(base + "_" + stamp + ext);
            for (int n = 1; Files.exists(target); n++) {
                target = processed.resolve(base + "_" + stamp + "_" + n + ext);
            }
            Files.move(path, target, StandardCopyOption.ATOMIC_MOVE);
            log.info("Processed result moved to {}", target);
            return target;
        } catch (IOException e) {
            throw new EngineException(Kind.FILE_WRITE,
                    "Failed to archive result file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Archive a result file left over from an earlier, abandoned wait so the
     * next watch cannot mistake it for the answer to a new instruction.
     * Called before every instruction write.
     *
     * @return the archived path, or empty when no result file was present
     */
    public Optional<Path> archiveStaleResult() {
        Path stale = resultFile();
        if (!Files.isRegularFile(stale)) return Optional.empty();
        log.warn("Stale result file {} found before a new instruction, archiving it unread", stale);
        return Optional.of(archiveResult(stale));
    }

    // ------------------------------------------------------------------
    // Paths
    // ------------------------------------------------------------------

    public Path instructionFile() { return instructionsDir.resolve(instructionFileName); }
    public Path resultFile()      { return logsDir.resolve(resultFileName); }
    public Path logsDir()         { return logsDir; }
    public Path instructionsDir() { return instructionsDir; }
    public String resultFileName() { return resultFileName; }
}
