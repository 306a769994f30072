/**
 * Runner supervision framework.
 *
 * <p>{@link com.ryuqq.solar.application.runner.AbstractRunner} implements the lifecycle and error policy,
 * {@link com.ryuqq.solar.application.runner.RunnerManager} owns the registry and the worker threads, and
 * {@link com.ryuqq.solar.application.runner.RunnerTypeRegistry} resolves type tags to factories.</p>
 *
 * <p><strong>Threading model:</strong></p>
 * <ul>
 *   <li>One daemon platform thread per runner, named {@code runner-<key>}</li>
 *   <li>Cooperative cancellation via {@link com.ryuqq.solar.application.runner.CancellationToken}</li>
 *   <li>Bounded join on shutdown, then interrupt and abandon</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.application.runner;
