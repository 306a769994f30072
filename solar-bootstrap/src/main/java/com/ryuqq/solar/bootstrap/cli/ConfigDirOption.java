package com.ryuqq.solar.bootstrap.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * 서브커맨드 공통 옵션.
 *
 * @author Solar Team
 * @since 1.0.0
 */
final class ConfigDirOption {

    @Option(names = {"--config-dir"}, defaultValue = "config",
            description = "Directory holding solar.yaml, runners.yaml, daily_schedule.yaml and locations.yaml")
    Path configDir;
}
