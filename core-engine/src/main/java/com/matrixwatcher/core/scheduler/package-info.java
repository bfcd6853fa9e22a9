/**
 * Cooperative, priority-aware scheduler for repeating tasks: sensor polling,
 * persistence and health checks.
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.scheduler;
