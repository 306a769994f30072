/**
 * Core value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.solar.core.model.RunnerKey} - validated runner identifier</li>
 *   <li>{@link com.ryuqq.solar.core.model.Position} - planar coordinate with the dock at the origin</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.core.model;
