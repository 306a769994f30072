/**
 * Battery safety model: samples, policy and the derived envelope.
 *
 * <p>The envelope is derived per evaluation from the latest sample and never cached across ticks.
 * Missing or stale data always produces a low-battery envelope.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.core.safety;
