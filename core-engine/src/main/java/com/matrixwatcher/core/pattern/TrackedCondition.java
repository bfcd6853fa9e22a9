package com.matrixwatcher.core.pattern;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A buffered condition plus the event types it has already been matched to.
 */
final class TrackedCondition {

    private final Condition condition;
    private final Set<String> matchedEvents = new LinkedHashSet<>();

    TrackedCondition(Condition condition) {
        this.condition = condition;
    }

    TrackedCondition(Condition condition, Collection<String> matchedEvents) {
        this(condition);
        this.matchedEvents.addAll(matchedEvents);
    }

    Condition condition() {
        return condition;
    }

    boolean isMatched(String eventType) {
        return matchedEvents.contains(eventType);
    }

    void markMatched(String eventType) {
        matchedEvents.add(eventType);
    }

    Set<String> matchedEvents() {
        return matchedEvents;
    }
}
