/**
 * Glue that drives a sensor reading through every analysis stage.
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.pipeline;
