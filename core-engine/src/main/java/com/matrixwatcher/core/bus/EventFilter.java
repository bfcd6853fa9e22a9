package com.matrixwatcher.core.bus;

import com.matrixwatcher.core.model.Event;
import com.matrixwatcher.core.model.EventType;
import com.matrixwatcher.core.model.Severity;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Conjunctive subscription filter.
 *
 * <p>
 * An event passes when it satisfies <em>every</em> supplied criterion. An
 * absent criterion ({@code null} or empty collection) admits everything.
 * </p>
 *
 * @since 1.0.0
 */
public final class EventFilter {

    private static final EventFilter ALL = new EventFilter(null, null, null);

    private final Set<EventType> eventTypes;
    private final Set<String> sources;
    private final Severity minSeverity;

    private EventFilter(Collection<EventType> eventTypes, Collection<String> sources, Severity minSeverity) {
        this.eventTypes = eventTypes == null || eventTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(eventTypes));
        this.sources = sources == null || sources.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sources));
        this.minSeverity = minSeverity;
    }

    /**
     * @return a filter that admits every event
     */
    public static EventFilter all() {
        return ALL;
    }

    /**
     * @param eventTypes  admitted types, or {@code null} for any
     * @param sources     admitted sources, or {@code null} for any
     * @param minSeverity lowest admitted severity, or {@code null} for any
     * @return new filter
     */
    public static EventFilter of(Collection<EventType> eventTypes, Collection<String> sources,
            Severity minSeverity) {
        return new EventFilter(eventTypes, sources, minSeverity);
    }

    public static EventFilter ofTypes(EventType first, EventType... rest) {
        return new EventFilter(EnumSet.of(first, rest), null, null);
    }

    public static EventFilter ofSources(Collection<String> sources) {
        return new EventFilter(null, sources, null);
    }

    public static EventFilter minSeverity(Severity minSeverity) {
        return new EventFilter(null, null, minSeverity);
    }

    /**
     * @param event candidate event
     * @return {@code true} if the event satisfies every criterion
     */
    public boolean matches(Event event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.getEventType())) {
            return false;
        }
        if (!sources.isEmpty() && !sources.contains(event.getSource())) {
            return false;
        }
        return minSeverity == null || event.getSeverity().isAtLeast(minSeverity);
    }

    public Set<EventType> getEventTypes() {
        return eventTypes;
    }

    public Set<String> getSources() {
        return sources;
    }

    public Severity getMinSeverity() {
        return minSeverity;
    }

    @Override
    public String toString() {
        return "EventFilter{types=" + eventTypes + ", sources=" + sources
                + ", minSeverity=" + minSeverity + '}';
    }
}
