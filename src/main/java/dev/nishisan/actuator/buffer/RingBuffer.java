/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.actuator.buffer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity circular buffer. Pushing into a full buffer silently discards the
 * oldest element. Snapshots are independent copies in insertion order (oldest first).
 *
 * @param <E> element type
 */
public class RingBuffer<E> {
    public static final int DEFAULT_CAPACITY = 100;

    private final Object[] elements;
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private int head;
    private int size;

    public RingBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive.");
        }
        this.capacity = capacity;
        this.elements = new Object[capacity];
    }

    public void push(E element) {
        lock.lock();
        try {
            int tail = (head + size) % capacity;
            elements[tail] = element;
            if (size == capacity) {
                // overwrote the oldest slot
                head = (head + 1) % capacity;
            } else {
                size++;
            }
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    public List<E> snapshot() {
        lock.lock();
        try {
            List<E> copy = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                copy.add((E) elements[(head + i) % capacity]);
            }
            return Collections.unmodifiableList(copy);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            Arrays.fill(elements, null);
            head = 0;
            size = 0;
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
