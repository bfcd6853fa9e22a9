package com.matrixwatcher.core.scheduler;

/**
 * Observable state of a registered task.
 *
 * @since 1.0.0
 */
public enum TaskState {
    IDLE,
    RUNNING,
    PAUSED
}
