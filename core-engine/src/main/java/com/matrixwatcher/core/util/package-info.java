/**
 * Small data structures used by the analysis components.
 */
package com.matrixwatcher.core.util;
