package com.ryuqq.solar.core.spi;

import com.ryuqq.solar.core.schedule.SelectedAction;

/**
 * 선택된 행동을 수행하는 외부 실행자.
 *
 * <p>제어 루프 스레드에서 호출되므로 오래 블로킹하면 안 됩니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionSink {

    /**
     * 새 선택 결과 전달.
     *
     * @param action 선택된 행동
     */
    void accept(SelectedAction action);
}
