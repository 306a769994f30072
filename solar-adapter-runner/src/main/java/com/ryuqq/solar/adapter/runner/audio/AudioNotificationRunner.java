package com.ryuqq.solar.adapter.runner.audio;

import com.ryuqq.solar.application.runner.AbstractRunner;
import com.ryuqq.solar.core.runner.RunnerSettings;

import java.time.Clock;
import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 오디오 알림 Runner ({@code audio}).
 *
 * <p>크기 제한이 있는 우선순위 대기열에서 사이클마다 최대 1건을 꺼내 재생합니다.
 * 우선순위가 높은 것부터, 같은 우선순위는 먼저 들어온 것부터 재생합니다.</p>
 *
 * <p>재생 실패는 WARN으로 기록하고 사이클 실패로 집계하지 않습니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class AudioNotificationRunner extends AbstractRunner {

    private static final Comparator<AudioNotification> PLAY_ORDER =
        Comparator.comparingInt(AudioNotification::priority).reversed()
            .thenComparingLong(AudioNotification::sequence);

    private final AudioDevice device;
    private final AudioRunnerConfig config;

    private final PriorityQueue<AudioNotification> queue = new PriorityQueue<>(PLAY_ORDER);
    private final AtomicLong sequence = new AtomicLong();

    public AudioNotificationRunner(RunnerSettings settings, AudioDevice device) {
        this(settings, device, Clock.systemUTC());
    }

    public AudioNotificationRunner(RunnerSettings settings, AudioDevice device, Clock clock) {
        super(settings, clock);
        if (device == null) {
            throw new IllegalArgumentException("device cannot be null");
        }
        this.device = device;
        this.config = AudioRunnerConfig.from(settings);
    }

    @Override
    protected boolean initialize() {
        if (!device.open()) {
            log.error("{} - audio device could not be opened", settings().label());
            return false;
        }
        if (!device.isHealthy()) {
            log.error("{} - audio device health check failed", settings().label());
            return false;
        }
        return true;
    }

    @Override
    protected void workCycle() {
        AudioNotification next;
        synchronized (queue) {
            next = queue.poll();
        }
        if (next == null) {
            return;
        }
        boolean played = next.isTts() && config.enableTts()
            ? device.speak(next.message())
            : device.playNotification(next.type(), config.volume());
        if (!played) {
            log.warn("{} - failed to play notification: {} {}", settings().label(), next.type(), next.message());
        }
    }

    @Override
    protected boolean checkHealth() {
        return device.isHealthy();
    }

    @Override
    protected void cleanup() {
        device.close();
    }

    /**
     * 알림 대기열에 추가.
     *
     * @param type 알림 종류
     * @param message 메시지
     * @param priority 클수록 먼저 재생
     * @return 대기열이 가득 차 있으면 false
     */
    public boolean queueNotification(String type, String message, int priority) {
        synchronized (queue) {
            if (queue.size() >= config.maxQueueSize()) {
                log.warn("{} - notification queue full, dropping {}", settings().label(), type);
                return false;
            }
            queue.add(new AudioNotification(type, message, priority, sequence.getAndIncrement()));
            return true;
        }
    }

    public int queueSize() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public void clearQueue() {
        synchronized (queue) {
            queue.clear();
        }
    }

    public AudioRunnerConfig config() {
        return config;
    }
}
