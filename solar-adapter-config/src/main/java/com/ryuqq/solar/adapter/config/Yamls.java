package com.ryuqq.solar.adapter.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * 공유 YAML ObjectMapper.
 *
 * <p>같은 문서 안의 중복 키는 파싱 오류로 처리합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class Yamls {

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private Yamls() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
