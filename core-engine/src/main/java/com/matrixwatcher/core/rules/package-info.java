/**
 * Declarative table of external events and the predicates that recognise
 * them in sensor payloads.
 *
 * <p>
 * An {@link com.matrixwatcher.core.rules.EventDefinition} is plain data; the
 * {@link com.matrixwatcher.core.rules.EventRuleFactory} turns it into an
 * {@link com.matrixwatcher.core.rules.EventRule}, and the
 * {@link com.matrixwatcher.core.rules.EventRuleRegistry} keeps the ordered
 * table.
 * </p>
 *
 * @since 1.0.0
 */
package com.matrixwatcher.core.rules;
