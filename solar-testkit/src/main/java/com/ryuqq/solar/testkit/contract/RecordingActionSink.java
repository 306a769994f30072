package com.ryuqq.solar.testkit.contract;

import com.ryuqq.solar.core.schedule.SelectedAction;
import com.ryuqq.solar.core.spi.ActionSink;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ActionSink that records every accepted action in order.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class RecordingActionSink implements ActionSink {

    private final List<SelectedAction> accepted = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();

    @Override
    public void accept(SelectedAction action) {
        accepted.add(action);
        synchronized (monitor) {
            monitor.notifyAll();
        }
    }

    public List<SelectedAction> actions() {
        return List.copyOf(accepted);
    }

    public Optional<SelectedAction> last() {
        List<SelectedAction> snapshot = actions();
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }

    /**
     * Waits until at least {@code count} actions were accepted.
     *
     * @param count expected minimum number of actions
     * @param timeout maximum time to wait
     * @return true if the count was reached in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCount(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (accepted.size() < count) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0) {
                    return false;
                }
                monitor.wait(remainingMillis);
            }
            return true;
        }
    }

    public void clear() {
        accepted.clear();
    }
}
