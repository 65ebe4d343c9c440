package com.devmanager.orchestrator.handshake;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFileWatcherTest {

    @TempDir Path logs;

    BlockingQueue<Path> detected;
    ResultFileWatcher   watcher;

    @BeforeEach
    void setUp() {
        detected = new LinkedBlockingQueue<>();
        watcher  = new ResultFileWatcher(logs, "worker_step_output.txt", Duration.ofMillis(50), detected::add);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
    }

    @Test
    void createdResultFile_isReported() throws Exception {
        watcher.start();

        Files.writeString(logs.resolve("worker_step_output.txt"), "done");

        Path path = detected.poll(10, TimeUnit.SECONDS);
        assertThat(path).isNotNull();
        assertThat(path.getFileName().toString()).isEqualTo("worker_step_output.txt");
    }

    @Test
    void existingResultFile_isReportedOnStart() throws Exception {
        Files.writeString(logs.resolve("worker_step_output.txt"), "already there");

        watcher.start();

        assertThat(detected.poll(5, TimeUnit.SECONDS)).isNotNull();
    }

    @Test
    void otherFilesAndSubdirectories_areIgnored() throws Exception {
        watcher.start();

        Files.writeString(logs.resolve("notes.txt"), "x");
        Path processed = Files.createDirectories(logs.resolve("processed"));
        Files.writeString(processed.resolve("worker_step_output.txt"), "archived");

        assertThat(detected.poll(500, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void stop_endsWatchingAndIsIdempotent() throws IOException, InterruptedException {
        watcher.start();
        watcher.stop();
        watcher.stop();

        Files.writeString(logs.resolve("worker_step_output.txt"), "late");

        assertThat(watcher.isRunning()).isFalse();
        assertThat(detected.poll(300, TimeUnit.MILLISECONDS)).isNull();
    }
}
