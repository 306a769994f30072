package com.ryuqq.solar.application.runner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 타입 태그 → RunnerFactory 레지스트리 (불변).
 *
 * <p>태그는 대소문자를 구분하지 않습니다. 별칭(alias)은 등록된 타입과 같은 팩토리로 해석됩니다.</p>
 *
 * <pre>{@code
 * RunnerTypeRegistry registry = RunnerTypeRegistry.builder()
 *     .register("power_monitor", PowerMonitorRunner::new)
 *     .alias("ina219", "power_monitor")
 *     .build();
 * }</pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class RunnerTypeRegistry {

    private final Map<String, RunnerFactory> factories;

    private RunnerTypeRegistry(Map<String, RunnerFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 타입 태그로 팩토리 조회.
     *
     * @param type 타입 태그
     * @return 팩토리, 없으면 empty
     */
    public Optional<RunnerFactory> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(normalize(type)));
    }

    /**
     * 지원하는 타입인지 확인.
     */
    public boolean supports(String type) {
        return find(type).isPresent();
    }

    /**
     * 등록된 모든 태그 (별칭 포함, 등록 순서).
     */
    public Set<String> types() {
        return factories.keySet();
    }

    private static String normalize(String type) {
        return type.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * RunnerTypeRegistry 빌더.
     */
    public static final class Builder {

        private final Map<String, RunnerFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 타입 등록.
         *
         * @throws IllegalArgumentException 태그가 비어 있거나 이미 등록된 경우
         */
        public Builder register(String type, RunnerFactory factory) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("type cannot be null or blank");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            String key = normalize(type);
            if (factories.containsKey(key)) {
                throw new IllegalArgumentException("Runner type already registered: " + key);
            }
            factories.put(key, factory);
            return this;
        }

        /**
         * 기존 타입의 별칭 등록.
         *
         * @throws IllegalArgumentException 대상 타입이 등록되지 않은 경우
         */
        public Builder alias(String alias, String type) {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            RunnerFactory factory = factories.get(normalize(type));
            if (factory == null) {
                throw new IllegalArgumentException("Cannot alias unknown runner type: " + type);
            }
            return register(alias, factory);
        }

        public RunnerTypeRegistry build() {
            return new RunnerTypeRegistry(factories);
        }
    }
}
