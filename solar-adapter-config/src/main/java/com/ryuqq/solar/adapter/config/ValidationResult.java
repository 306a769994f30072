package com.ryuqq.solar.adapter.config;

import java.util.List;
import java.util.Optional;

/**
 * 설정 검증 결과.
 *
 * <p>오류가 하나라도 있으면 configuration은 비어 있습니다. 경고는 결과에 영향을 주지 않습니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public record ValidationResult(
    SolarConfiguration configuration,
    List<ValidationError> errors,
    List<ValidationError> warnings
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (!errors.isEmpty()) {
            configuration = null;
        }
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Optional<SolarConfiguration> configurationIfValid() {
        return Optional.ofNullable(configuration);
    }
}
