/**
 * Configuration model for the watcher.
 *
 * <p>
 * {@link com.matrixwatcher.core.config.WatcherSettings} is a plain bean; the
 * runtime module fills it from YAML and asks it for configured components.
 * </p>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.config;
