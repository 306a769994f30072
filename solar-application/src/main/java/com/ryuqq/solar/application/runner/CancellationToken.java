package com.ryuqq.solar.application.runner;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 협조적 취소 신호.
 *
 * <p>워커 스레드는 반복마다 {@link #isCancelled()}를 확인하고, 사이클 사이 대기는
 * {@link #await(Duration)}로 수행하여 취소 즉시 깨어납니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /**
     * 취소 요청 (멱등).
     */
    public void cancel() {
        cancelled.countDown();
    }

    /**
     * 취소 여부.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * 취소되거나 시간이 지날 때까지 대기.
     *
     * <p>대기 중 인터럽트되면 인터럽트 플래그를 복구하고 취소된 것으로 간주합니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 취소(또는 인터럽트)로 깨어났으면 true, 시간 만료면 false
     */
    public boolean await(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        try {
            return cancelled.await(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
