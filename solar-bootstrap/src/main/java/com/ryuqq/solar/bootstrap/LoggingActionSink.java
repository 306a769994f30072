package com.ryuqq.solar.bootstrap;

import com.ryuqq.solar.core.schedule.SelectedAction;
import com.ryuqq.solar.core.spi.ActionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 선택된 행동을 로그로만 남기는 ActionSink (주행 실행기 연결 전 기본값).
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class LoggingActionSink implements ActionSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingActionSink.class);

    @Override
    public void accept(SelectedAction action) {
        if (action.isOverride()) {
            log.warn("Action: {} -> {} {} (override: {})",
                action.kind(), action.target(), action.actions(), action.overrideReason());
            return;
        }
        log.info("Action: {} -> {} {}", action.kind(), action.target(), action.actions());
    }
}
