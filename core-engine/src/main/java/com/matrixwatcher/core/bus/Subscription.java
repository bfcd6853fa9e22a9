package com.matrixwatcher.core.bus;

import com.matrixwatcher.core.model.Event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One registered handler with its filter and failed-delivery buffer.
 *
 * <p>
 * {@link #deliveryLock} serialises handler invocations so a subscriber sees
 * events in publish order even with concurrent publishers. The same lock
 * guards the buffer.
 * </p>
 */
final class Subscription {

    private final String id;
    private final EventHandler handler;
    private final EventFilter filter;
    private final int maxBufferSize;

    private final ReentrantLock deliveryLock = new ReentrantLock();
    private final Deque<Event> buffer = new ArrayDeque<>();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    Subscription(String id, EventHandler handler, EventFilter filter, int maxBufferSize) {
        this.id = id;
        this.handler = handler;
        this.filter = filter;
        this.maxBufferSize = maxBufferSize;
    }

    String getId() {
        return id;
    }

    EventFilter getFilter() {
        return filter;
    }

    /**
     * Invoke the handler. Errors other than {@link VirtualMachineError} count
     * as handler failures.
     *
     * @return the failure, or {@code null} on success
     */
    Throwable deliver(Event event) {
        deliveryLock.lock();
        try {
            handler.handle(event);
            delivered.incrementAndGet();
            return null;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            bufferFailed(event);
            return e;
        } finally {
            deliveryLock.unlock();
        }
    }

    private void bufferFailed(Event event) {
        if (buffer.size() >= maxBufferSize) {
            buffer.pollFirst();
            dropped.incrementAndGet();
        }
        buffer.addLast(event);
    }

    long getDelivered() {
        return delivered.get();
    }

    long getDropped() {
        return dropped.get();
    }

    int getBufferSize() {
        deliveryLock.lock();
        try {
            return buffer.size();
        } finally {
            deliveryLock.unlock();
        }
    }

    List<Event> snapshotBuffer() {
        deliveryLock.lock();
        try {
            return new ArrayList<>(buffer);
        } finally {
            deliveryLock.unlock();
        }
    }

    List<Event> drainBuffer() {
        deliveryLock.lock();
        try {
            List<Event> out = new ArrayList<>(buffer);
            buffer.clear();
            return out;
        } finally {
            deliveryLock.unlock();
        }
    }
}
