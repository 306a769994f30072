package com.ryuqq.solar.bootstrap;

import com.ryuqq.solar.adapter.config.YamlConfigurationLoader;
import com.ryuqq.solar.adapter.runner.DefaultRunnerTypes;
import com.ryuqq.solar.adapter.runner.SimulatedSensorProvider;
import com.ryuqq.solar.application.runner.RunnerTypeRegistry;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RunnerConfigWatcher 변경 감지 테스트.
 *
 * @author Solar Team
 * @since 1.0.0
 */
class RunnerConfigWatcherTest {

    private static final String ONE_RUNNER = """
        runners:
          ups:
            type: pipower
            measurement_interval: 0.5
        """;

    private static final String TWO_RUNNERS = """
        runners:
          ups:
            type: pipower
            measurement_interval: 0.5
          solar_power:
            type: ina219
            i2c_address: "0x41"
        """;

    @TempDir
    Path configDir;

    private final List<List<RunnerSettings>> submitted = new CopyOnWriteArrayList<>();
    private RunnerConfigWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        writeRunners(ONE_RUNNER, Instant.parse("2026-06-01T08:00:00Z"));
        RunnerTypeRegistry registry = DefaultRunnerTypes.registry(new SimulatedSensorProvider());
        watcher = new RunnerConfigWatcher(new YamlConfigurationLoader(registry::supports), configDir, submitted::add);
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    @Test
    void poll_변경이_없으면_제출하지_않음() {
        assertThat(watcher.poll()).isFalse();
        assertThat(submitted).isEmpty();
    }

    @Test
    void poll_수정되면_다시_읽어_한번만_제출() throws IOException {
        writeRunners(TWO_RUNNERS, Instant.parse("2026-06-01T08:05:00Z"));

        assertThat(watcher.poll()).isTrue();
        assertThat(watcher.poll()).isFalse();

        assertThat(submitted).hasSize(1);
        assertThat(submitted.get(0)).extracting(RunnerSettings::key)
            .containsExactly(RunnerKey.of("ups"), RunnerKey.of("solar_power"));
    }

    @Test
    void poll_잘못된_파일은_제출하지_않음() throws IOException {
        writeRunners("""
            runners:
              cam:
                type: webcam
            """, Instant.parse("2026-06-01T08:05:00Z"));

        assertThat(watcher.poll()).isFalse();
        assertThat(submitted).isEmpty();
    }

    @Test
    void start_스케줄러가_변경을_감지() throws Exception {
        watcher.start(Duration.ofMillis(20));

        writeRunners(TWO_RUNNERS, Instant.parse("2026-06-01T08:05:00Z"));

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (submitted.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(submitted).isNotEmpty();
    }

    private void writeRunners(String content, Instant modified) throws IOException {
        Path file = configDir.resolve(YamlConfigurationLoader.RUNNERS_FILE);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }
}
