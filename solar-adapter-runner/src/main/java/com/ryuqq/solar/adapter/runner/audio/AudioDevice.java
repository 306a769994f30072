package com.ryuqq.solar.adapter.runner.audio;

/**
 * 오디오 출력 장치 어댑터.
 *
 * <p>재생 메서드는 실패 시 false를 반환하며 예외를 던지지 않습니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public interface AudioDevice extends AutoCloseable {

    /**
     * 장치 열기.
     *
     * @return 성공 여부
     */
    boolean open();

    boolean isHealthy();

    /**
     * 알림음 재생.
     *
     * @param type 알림 종류
     * @param volume 0.0~1.0
     * @return 재생 성공 여부
     */
    boolean playNotification(String type, double volume);

    /**
     * 음성 합성 재생.
     *
     * @param text 읽을 문장
     * @return 재생 성공 여부
     */
    boolean speak(String text);

    @Override
    void close();
}
