/**
 * YAML 설정 어댑터.
 *
 * <p>{@link com.ryuqq.solar.adapter.config.YamlConfigurationLoader}가 파일을 읽고
 * {@link com.ryuqq.solar.adapter.config.ConfigurationValidator}가 값을 검증하여
 * core 설정 레코드로 변환합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.adapter.config;
