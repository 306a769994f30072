package com.ryuqq.solar.adapter.runner.audio;

import com.ryuqq.solar.core.runner.RunnerSettings;

/**
 * AudioNotificationRunner 속성.
 *
 * @param maxQueueSize 대기열 최대 크기 (기본 100)
 * @param volume 알림 볼륨 0.0~1.0 (기본 1.0)
 * @param enableTts TTS 사용 여부 (기본 false, 끄면 tts 알림도 알림음으로 재생)
 * @author Solar Team
 * @since 1.0.0
 */
public record AudioRunnerConfig(int maxQueueSize, double volume, boolean enableTts) {

    public AudioRunnerConfig() {
        this(100, 1.0, false);
    }

    public AudioRunnerConfig {
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("max_queue_size must be positive (current: " + maxQueueSize + ")");
        }
        if (volume < 0.0 || volume > 1.0) {
            throw new IllegalArgumentException(
                "notification_volume must be between 0.0 and 1.0 (current: " + volume + ")"
            );
        }
    }

    public static AudioRunnerConfig from(RunnerSettings settings) {
        AudioRunnerConfig defaults = new AudioRunnerConfig();
        return new AudioRunnerConfig(
            settings.intProperty("max_queue_size", defaults.maxQueueSize()),
            settings.doubleProperty("notification_volume", defaults.volume()),
            settings.booleanProperty("enable_tts", defaults.enableTts())
        );
    }
}
