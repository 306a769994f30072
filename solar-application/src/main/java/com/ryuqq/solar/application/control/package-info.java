/**
 * The main control loop tying battery sampling, schedule evaluation, action dispatch and runner health together.
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.application.control;
