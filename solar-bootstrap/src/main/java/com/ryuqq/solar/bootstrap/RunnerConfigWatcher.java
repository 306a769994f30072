package com.ryuqq.solar.bootstrap;

import com.ryuqq.solar.adapter.config.YamlConfigurationLoader;
import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.runner.RunnerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * runners.yaml 변경 감시 (수정 시각 폴링).
 *
 * <p>변경이 감지되면 다시 읽어 제출합니다. 잘못된 파일은 로그만 남기고 현재 Runner를 유지합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class RunnerConfigWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunnerConfigWatcher.class);

    private final YamlConfigurationLoader loader;
    private final Path configDir;
    private final Path runnersFile;
    private final Consumer<List<RunnerSettings>> submitter;

    private ScheduledExecutorService scheduler;
    private FileTime lastModified;

    public RunnerConfigWatcher(
        YamlConfigurationLoader loader,
        Path configDir,
        Consumer<List<RunnerSettings>> submitter
    ) {
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        if (configDir == null) {
            throw new IllegalArgumentException("configDir cannot be null");
        }
        if (submitter == null) {
            throw new IllegalArgumentException("submitter cannot be null");
        }
        this.loader = loader;
        this.configDir = configDir;
        this.runnersFile = configDir.resolve(YamlConfigurationLoader.RUNNERS_FILE);
        this.submitter = submitter;
        this.lastModified = modifiedTime();
    }

    /**
     * 주기적 폴링 시작.
     *
     * @param interval 폴링 주기
     */
    public synchronized void start(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "runner-config-watcher");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::pollSafely, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Watching {} every {}", runnersFile, interval);
    }

    /**
     * 1회 변경 확인.
     *
     * @return 변경을 감지해 제출했으면 true
     */
    public synchronized boolean poll() {
        FileTime current = modifiedTime();
        if (current == null || current.equals(lastModified)) {
            return false;
        }
        lastModified = current;
        try {
            List<RunnerSettings> runners = loader.loadRunners(configDir);
            log.info("{} changed, submitting {} runner entries", runnersFile.getFileName(), runners.size());
            submitter.accept(runners);
            return true;
        } catch (ConfigurationException e) {
            log.error("Ignoring invalid {}: {}", runnersFile.getFileName(), e.getProblems());
            return false;
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void pollSafely() {
        try {
            poll();
        } catch (RuntimeException e) {
            log.error("Runner configuration watch failed", e);
        }
    }

    private FileTime modifiedTime() {
        if (!Files.exists(runnersFile)) {
            return null;
        }
        try {
            return Files.getLastModifiedTime(runnersFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read modification time of " + runnersFile, e);
        }
    }
}
