/**
 * Battery sampling and safety envelope computation.
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.application.safety;
