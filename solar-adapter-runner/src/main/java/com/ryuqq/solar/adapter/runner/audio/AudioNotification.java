package com.ryuqq.solar.adapter.runner.audio;

/**
 * 대기열의 알림 1건.
 *
 * @param type 알림 종류 ({@code tts}면 message를 음성으로 읽음)
 * @param message 메시지 (빈 문자열 가능)
 * @param priority 클수록 먼저 재생
 * @param sequence 같은 우선순위 내 FIFO 순서
 * @author Solar Team
 * @since 1.0.0
 */
public record AudioNotification(String type, String message, int priority, long sequence) {

    public static final String TTS = "tts";

    public AudioNotification {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (message == null) {
            message = "";
        }
    }

    public boolean isTts() {
        return TTS.equals(type);
    }
}
