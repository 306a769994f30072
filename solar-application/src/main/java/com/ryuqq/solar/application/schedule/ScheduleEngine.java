package com.ryuqq.solar.application.schedule;

import com.ryuqq.solar.core.safety.SafetyEnvelope;
import com.ryuqq.solar.core.schedule.DailySchedule;
import com.ryuqq.solar.core.schedule.DockPolicy;
import com.ryuqq.solar.core.schedule.OverrideReason;
import com.ryuqq.solar.core.schedule.ScheduleTask;
import com.ryuqq.solar.core.schedule.SelectedAction;
import com.ryuqq.solar.core.spi.DistanceEstimator;
import com.ryuqq.solar.core.statemachine.EvaluationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 시각과 안전 엔벨로프로부터 현재 행동을 선택합니다.
 *
 * <p><strong>틱 처리 흐름:</strong></p>
 * <pre>
 * 1. now를 분 단위로 절삭
 * 2. 매칭 작업 필터링 (ExactTime: 해당 분만 / TimeWindow: [start, end), 자정 넘김 지원)
 * 3. 동률 처리: ExactTime 매칭이 TimeWindow 매칭보다 우선, 같은 종류는 먼저 선언된 작업
 * 4. 안전 오버라이드:
 *    - lowBattery (stale 포함) → Dock
 *    - 대상 거리 미상 또는 allowedDistance 초과 → Dock
 *    - Dock 자체는 거리 사유로 오버라이드하지 않음
 * 5. SelectedAction 반환 (SCHEDULED / OVERRIDE / IDLE)
 * </pre>
 *
 * <p>틱은 직렬화됩니다. 상태 조회({@link #state()}, {@link #lastSelection()})는 락 없이 가능합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class ScheduleEngine {

    private static final Logger log = LoggerFactory.getLogger(ScheduleEngine.class);

    private final DailySchedule schedule;
    private final DockPolicy dock;
    private final DistanceEstimator distanceEstimator;

    private volatile EvaluationState state = EvaluationState.IDLE;
    private volatile SelectedAction lastSelection;

    public ScheduleEngine(DailySchedule schedule, DockPolicy dock, DistanceEstimator distanceEstimator) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule cannot be null");
        }
        if (dock == null) {
            throw new IllegalArgumentException("dock cannot be null");
        }
        if (distanceEstimator == null) {
            throw new IllegalArgumentException("distanceEstimator cannot be null");
        }
        this.schedule = schedule;
        this.dock = dock;
        this.distanceEstimator = distanceEstimator;
    }

    /**
     * 1회 평가.
     *
     * @param now 현재 시각 (초 이하 무시)
     * @param envelope 이번 틱의 안전 엔벨로프
     * @return 선택된 행동
     */
    public synchronized SelectedAction tick(LocalTime now, SafetyEnvelope envelope) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        state = EvaluationState.EVALUATING;
        try {
            LocalTime minute = now.truncatedTo(ChronoUnit.MINUTES);
            ScheduleTask picked = pick(minute).orElse(null);
            SelectedAction selection = applySafety(picked, envelope);

            lastSelection = selection;
            state = EvaluationState.SELECTED;
            log.debug("Tick {} (battery {}%, allowed {}): {} -> {}",
                minute, envelope.batteryPercentage(), envelope.allowedDistance(), picked, selection.kind());
            return selection;
        } catch (RuntimeException e) {
            state = EvaluationState.IDLE;
            throw e;
        }
    }

    /**
     * 주어진 분에 스케줄이 고르는 작업 (안전 규칙 적용 전).
     *
     * @param minuteOfDay 시각
     * @return 작업, 매칭이 없으면 empty
     */
    public Optional<ScheduleTask> pick(LocalTime minuteOfDay) {
        ScheduleTask firstWindow = null;
        for (ScheduleTask task : schedule.tasks()) {
            if (!task.trigger().matches(minuteOfDay)) {
                continue;
            }
            if (task.trigger().isExact()) {
                return Optional.of(task);
            }
            if (firstWindow == null) {
                firstWindow = task;
            }
        }
        return Optional.ofNullable(firstWindow);
    }

    public EvaluationState state() {
        return state;
    }

    public Optional<SelectedAction> lastSelection() {
        return Optional.ofNullable(lastSelection);
    }

    public DailySchedule schedule() {
        return schedule;
    }

    public DockPolicy dock() {
        return dock;
    }

    private SelectedAction applySafety(ScheduleTask picked, SafetyEnvelope envelope) {
        if (envelope.lowBattery()) {
            OverrideReason reason = envelope.stale() ? OverrideReason.STALE_BATTERY : OverrideReason.LOW_BATTERY;
            return SelectedAction.override(dock, reason, picked);
        }
        if (picked == null) {
            return SelectedAction.idle();
        }
        String target = picked.target();
        if (target == null || dock.isDock(target)) {
            return SelectedAction.scheduled(picked);
        }
        OptionalDouble distance = distanceEstimator.distanceFromDock(target);
        if (distance.isEmpty()) {
            return SelectedAction.override(dock, OverrideReason.UNKNOWN_DISTANCE, picked);
        }
        if (!envelope.permits(distance.getAsDouble())) {
            return SelectedAction.override(dock, OverrideReason.OUT_OF_RANGE, picked);
        }
        return SelectedAction.scheduled(picked);
    }
}
