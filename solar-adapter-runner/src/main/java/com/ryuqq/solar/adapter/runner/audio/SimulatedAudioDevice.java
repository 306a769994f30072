package com.ryuqq.solar.adapter.runner.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 소리를 내지 않고 재생 내역만 기록하는 장치.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class SimulatedAudioDevice implements AudioDevice {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAudioDevice.class);

    private final List<String> played = new CopyOnWriteArrayList<>();
    private volatile boolean open;

    @Override
    public boolean open() {
        open = true;
        return true;
    }

    @Override
    public boolean isHealthy() {
        return open;
    }

    @Override
    public boolean playNotification(String type, double volume) {
        if (!open) {
            return false;
        }
        log.info("[audio] notification '{}' (volume {})", type, volume);
        played.add(type);
        return true;
    }

    @Override
    public boolean speak(String text) {
        if (!open) {
            return false;
        }
        log.info("[audio] speak: {}", text);
        played.add("tts:" + text);
        return true;
    }

    @Override
    public void close() {
        open = false;
    }

    /**
     * 재생된 알림 (TTS는 {@code tts:} 접두사).
     */
    public List<String> played() {
        return List.copyOf(played);
    }
}
