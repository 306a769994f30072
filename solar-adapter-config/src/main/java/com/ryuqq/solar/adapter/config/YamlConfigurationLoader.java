package com.ryuqq.solar.adapter.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.runner.RunnerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 설정 디렉터리의 YAML 문서를 읽어 {@link SolarConfiguration}을 만듭니다.
 *
 * <pre>
 * &lt;configDir&gt;/
 *   solar.yaml           (필수) application, battery_safety, dock
 *   runners.yaml         (필수) runners
 *   daily_schedule.yaml  (필수) tasks
 *   locations.yaml       (선택) 이름 → {x, y}
 * </pre>
 *
 * <p>파일 누락, YAML 문법 오류, 값 오류를 모두 모아 한 번에 보고합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class YamlConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlConfigurationLoader.class);

    public static final String SOLAR_FILE = "solar.yaml";
    public static final String RUNNERS_FILE = "runners.yaml";
    public static final String SCHEDULE_FILE = "daily_schedule.yaml";
    public static final String LOCATIONS_FILE = "locations.yaml";

    private final ConfigurationValidator validator;

    public YamlConfigurationLoader(Predicate<String> knownRunnerType) {
        this.validator = new ConfigurationValidator(knownRunnerType);
    }

    /**
     * 검증만 수행 (예외를 던지지 않음).
     *
     * @param configDir 설정 디렉터리
     * @return 검증 결과 (파일 오류 포함)
     */
    public ValidationResult validate(Path configDir) {
        if (configDir == null) {
            throw new IllegalArgumentException("configDir cannot be null");
        }
        List<ValidationError> fileErrors = new ArrayList<>();
        if (!Files.isDirectory(configDir)) {
            fileErrors.add(new ValidationError(configDir.toString(), "not a directory"));
            return new ValidationResult(null, fileErrors, List.of());
        }
        JsonNode solar = read(configDir.resolve(SOLAR_FILE), true, fileErrors);
        JsonNode runners = read(configDir.resolve(RUNNERS_FILE), true, fileErrors);
        JsonNode schedule = read(configDir.resolve(SCHEDULE_FILE), true, fileErrors);
        JsonNode locations = read(configDir.resolve(LOCATIONS_FILE), false, fileErrors);

        ValidationResult result = validator.validate(solar, runners, schedule, locations);
        if (fileErrors.isEmpty()) {
            return result;
        }
        List<ValidationError> errors = new ArrayList<>(fileErrors);
        errors.addAll(result.errors());
        return new ValidationResult(null, errors, result.warnings());
    }

    /**
     * 설정 로드.
     *
     * @param configDir 설정 디렉터리
     * @return 검증된 설정
     * @throws ConfigurationException 문제가 하나라도 있는 경우 (모든 문제 포함)
     */
    public SolarConfiguration load(Path configDir) {
        ValidationResult result = validate(configDir);
        for (ValidationError warning : result.warnings()) {
            log.warn("Configuration warning - {}", warning);
        }
        if (!result.isValid()) {
            throw new ConfigurationException("Invalid configuration in " + configDir,
                result.errors().stream().map(ValidationError::toString).toList());
        }
        SolarConfiguration configuration = result.configuration();
        log.info("Loaded configuration from {}: {} runners, {} tasks, {} locations", configDir,
            configuration.runners().size(), configuration.schedule().size(), configuration.locations().size());
        return configuration;
    }

    /**
     * runners.yaml만 다시 읽기 (실행 중 재설정용).
     *
     * @throws ConfigurationException 파일을 읽을 수 없거나 내용이 잘못된 경우
     */
    public List<RunnerSettings> loadRunners(Path configDir) {
        List<ValidationError> fileErrors = new ArrayList<>();
        JsonNode runners = read(configDir.resolve(RUNNERS_FILE), true, fileErrors);
        if (!fileErrors.isEmpty()) {
            throw new ConfigurationException("Invalid runner configuration",
                fileErrors.stream().map(ValidationError::toString).toList());
        }
        return validator.validateRunners(runners);
    }

    private static JsonNode read(Path file, boolean required, List<ValidationError> errors) {
        String name = file.getFileName().toString();
        if (!Files.exists(file)) {
            if (required) {
                errors.add(new ValidationError(name, "file not found"));
            }
            return null;
        }
        try {
            JsonNode node = Yamls.mapper().readTree(file.toFile());
            if (node == null || node.isMissingNode() || node.isNull()) {
                return null;
            }
            return node;
        } catch (JsonProcessingException e) {
            errors.add(new ValidationError(name, "YAML parse error: " + e.getOriginalMessage()
                + (e.getLocation() == null ? "" : " (line " + e.getLocation().getLineNr() + ")")));
            return null;
        } catch (IOException e) {
            errors.add(new ValidationError(name, "could not be read: " + e.getMessage()));
            return null;
        }
    }
}
