/**
 * Service Provider Interfaces for the external collaborators of the control core.
 *
 * <ul>
 *   <li>{@link com.ryuqq.solar.core.spi.BatterySource} - battery percentage reading</li>
 *   <li>{@link com.ryuqq.solar.core.spi.DistanceEstimator} - distance from the dock to a named target</li>
 *   <li>{@link com.ryuqq.solar.core.spi.ActionSink} - executor of the selected action</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.core.spi;
