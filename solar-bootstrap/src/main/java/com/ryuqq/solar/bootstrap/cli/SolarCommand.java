package com.ryuqq.solar.bootstrap.cli;

import com.ryuqq.solar.adapter.config.SolarConfiguration;
import com.ryuqq.solar.adapter.config.ValidationError;
import com.ryuqq.solar.adapter.config.ValidationResult;
import com.ryuqq.solar.adapter.config.YamlConfigurationLoader;
import com.ryuqq.solar.adapter.runner.DefaultRunnerTypes;
import com.ryuqq.solar.adapter.runner.SensorProvider;
import com.ryuqq.solar.application.runner.RunnerTypeRegistry;
import com.ryuqq.solar.bootstrap.LoggingActionSink;
import com.ryuqq.solar.bootstrap.RunnerConfigWatcher;
import com.ryuqq.solar.bootstrap.SensorProviders;
import com.ryuqq.solar.bootstrap.SolarApplication;
import com.ryuqq.solar.core.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * solar 명령.
 *
 * <pre>
 * solar run --config-dir config [--simulated] [--watch-runners-ms 5000]
 * solar validate --config-dir config
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
@Command(
        name = "solar",
        mixinStandardHelpOptions = true,
        version = "solar 1.0.0",
        description = "Solar robot runner supervisor and schedule controller",
        subcommands = {
                SolarCommand.RunCommand.class,
                SolarCommand.ValidateCommand.class
        }
)
public final class SolarCommand implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_CONFIG = 2;

    private static final Logger log = LoggerFactory.getLogger(SolarCommand.class);

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: run | validate");
    }

    /**
     * 시뮬레이션 여부와 관계없이 모든 기본 타입을 인식하는 로더 (검증용).
     */
    static YamlConfigurationLoader loader() {
        RunnerTypeRegistry types = DefaultRunnerTypes.registry(SensorProviders.resolve(true));
        return new YamlConfigurationLoader(types::supports);
    }

    @Command(name = "run", description = "Load configuration, start runners and the control loop until interrupted")
    static final class RunCommand implements Callable<Integer> {

        @ParentCommand
        SolarCommand parent;

        @Mixin
        ConfigDirOption config;

        @Option(names = {"--simulated"}, defaultValue = "false", description = "Use simulated sensors")
        boolean simulated;

        @Option(names = {"--watch-runners-ms"}, defaultValue = "0",
                description = "Poll interval for runners.yaml changes; 0 disables")
        long watchRunnersMs;

        @Override
        public Integer call() throws Exception {
            PrintWriter err = parent.spec.commandLine().getErr();
            SolarApplication application;
            try {
                SensorProvider sensors = SensorProviders.resolve(simulated);
                Clock clock = Clock.systemDefaultZone();
                RunnerTypeRegistry registry = DefaultRunnerTypes.builder(sensors, clock).build();
                YamlConfigurationLoader loader = new YamlConfigurationLoader(registry::supports);
                SolarConfiguration configuration = loader.load(config.configDir);
                application = SolarApplication.create(configuration, registry, new LoggingActionSink(), clock);
                application.start();

                RunnerConfigWatcher watcher = null;
                if (watchRunnersMs > 0) {
                    watcher = new RunnerConfigWatcher(loader, config.configDir, application::submitRunnerConfiguration);
                    watcher.start(Duration.ofMillis(watchRunnersMs));
                }
                installShutdownHook(application, watcher);
            } catch (ConfigurationException e) {
                printProblems(err, e);
                return EXIT_INVALID_CONFIG;
            }

            log.info("Solar control running{} (config: {})", simulated ? " in simulation" : "", config.configDir);
            application.awaitStop();
            return EXIT_OK;
        }

        private static void installShutdownHook(SolarApplication application, RunnerConfigWatcher watcher) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (watcher != null) {
                    watcher.close();
                }
                application.stop();
            }, "solar-shutdown-hook"));
        }
    }

    @Command(name = "validate", description = "Validate configuration files and print every problem")
    static final class ValidateCommand implements Callable<Integer> {

        @ParentCommand
        SolarCommand parent;

        @Mixin
        ConfigDirOption config;

        @Override
        public Integer call() {
            PrintWriter out = parent.spec.commandLine().getOut();
            ValidationResult result = loader().validate(config.configDir);
            for (ValidationError warning : result.warnings()) {
                out.println("WARN  " + warning);
            }
            for (ValidationError error : result.errors()) {
                out.println("ERROR " + error);
            }
            if (!result.isValid()) {
                out.println(result.errors().size() + " error(s) in " + config.configDir);
                return EXIT_INVALID_CONFIG;
            }
            SolarConfiguration configuration = result.configuration();
            out.println("Configuration OK: " + configuration.runners().size() + " runners, "
                    + configuration.schedule().size() + " tasks, "
                    + configuration.locations().size() + " locations");
            return EXIT_OK;
        }
    }

    private static void printProblems(PrintWriter err, ConfigurationException e) {
        err.println("Configuration rejected:");
        for (String problem : e.getProblems()) {
            err.println("  - " + problem);
        }
    }
}
