/**
 * Runner 어댑터 계층 - AbstractRunner 구현체와 센서 어댑터.
 *
 * <h2>Runner 타입</h2>
 * <ul>
 *   <li>{@code power_monitor} / {@code ina219} - 전압/전류/전력 측정, 연속 저전력/고전력 경보</li>
 *   <li>{@code ups_monitor} / {@code pipower} - UPS 배터리 전압, USB 입력, 충전 상태</li>
 *   <li>{@code audio} - 우선순위 알림 대기열</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (PowerMonitorRunner, UpsMonitorRunner, AudioNotificationRunner)
 *   ↓ extends
 * application (AbstractRunner, RunnerTypeRegistry)
 *   ↓ depends on
 * core (RunnerSettings, BatterySource)
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.adapter.runner;
