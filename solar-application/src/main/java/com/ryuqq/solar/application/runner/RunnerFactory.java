package com.ryuqq.solar.application.runner;

import com.ryuqq.solar.core.runner.RunnerSettings;

/**
 * 타입 태그 하나에 대응하는 Runner 생성자.
 *
 * @author Solar Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunnerFactory {

    /**
     * 설정으로부터 CREATED 상태의 Runner 생성.
     *
     * <p>생성자는 I/O를 수행하지 않아야 하며, 장치 연결은 initialize()에서 합니다.</p>
     *
     * @param settings Runner 설정
     * @return 새 Runner
     * @throws IllegalArgumentException 타입별 속성이 잘못된 경우
     */
    AbstractRunner create(RunnerSettings settings);
}
