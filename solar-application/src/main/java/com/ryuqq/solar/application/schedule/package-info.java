/**
 * Daily schedule evaluation with battery and range overrides.
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.application.schedule;
