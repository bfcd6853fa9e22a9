package com.matrixwatcher.core.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Fixed-capacity FIFO buffer backed by an array and a head cursor.
 *
 * <p>
 * Appending to a full buffer overwrites the oldest element. Iteration runs
 * oldest to newest.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Owners guard access with their own lock.
 * </p>
 *
 * @param <E> element type
 * @since 1.0.0
 */
public final class RingBuffer<E> implements Iterable<E> {

    private final Object[] elements;
    private int head;
    private int size;

    /**
     * @param capacity maximum number of retained elements; must be &gt;= 1
     * @throws IllegalArgumentException if {@code capacity} &lt; 1
     */
    public RingBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.elements = new Object[capacity];
    }

    /**
     * Append an element, evicting the oldest one when full.
     *
     * @param element value to append
     * @return the evicted element, or empty if nothing was evicted
     */
    public Optional<E> add(E element) {
        int tail = (head + size) % elements.length;
        if (size < elements.length) {
            elements[tail] = element;
            size++;
            return Optional.empty();
        }
        E evicted = elementAt(head);
        elements[head] = element;
        head = (head + 1) % elements.length;
        return Optional.ofNullable(evicted);
    }

    /**
     * @param index 0 for the oldest element
     * @return the element at {@code index}
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public E get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of range [0, " + size + ")");
        }
        return elementAt((head + index) % elements.length);
    }

    /**
     * @return the newest element, or empty when the buffer is empty
     */
    public Optional<E> last() {
        return size == 0 ? Optional.empty() : Optional.ofNullable(get(size - 1));
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == elements.length;
    }

    public void clear() {
        for (int i = 0; i < elements.length; i++) {
            elements[i] = null;
        }
        head = 0;
        size = 0;
    }

    /**
     * @return oldest-first copy of the contents
     */
    public List<E> toList() {
        List<E> out = new ArrayList<>(size);
        for (E e : this) {
            out.add(e);
        }
        return out;
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<>() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < size;
            }

            @Override
            public E next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(cursor++);
            }
        };
    }

    @SuppressWarnings("unchecked")
    private E elementAt(int slot) {
        return (E) elements[slot];
    }

    @Override
    public String toString() {
        return "RingBuffer{size=" + size + ", capacity=" + elements.length + '}';
    }
}
