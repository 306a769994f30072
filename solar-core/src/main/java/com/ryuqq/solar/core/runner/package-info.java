/**
 * Runner configuration and status records shared between the manager and its readers.
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.core.runner;
