/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.serialog;

import java.util.ArrayList;
import java.util.List;

/**
 * Arrival-ordered queue of {@link Entry} nodes, linked through the entries themselves so
 * that an entry stays a valid queue position while other entries are appended behind it
 * or removed around it. {@code null} stands for the end of the queue.
 *
 * <p>Entries are never reordered. The consumer either removes an entry after running it
 * or skips over it in place.</p>
 *
 * <p>Not thread-safe; every call happens under the {@link EntryScheduler} lock.</p>
 */
final class EntryQueue {

    private Entry head;
    private Entry tail;
    private int size;

    void append(Entry entry) {
        if (entry.linked) {
            throw new IllegalArgumentException("Entry is already queued: " + entry);
        }
        entry.prev = tail;
        entry.next = null;
        if (tail == null) {
            head = entry;
        } else {
            tail.next = entry;
        }
        tail = entry;
        entry.linked = true;
        size++;
    }

    /**
     * Unlinks {@code entry}.
     *
     * @param entry a queued entry
     * @return the entry that followed it, or null if it was the last one
     */
    Entry remove(Entry entry) {
        if (!entry.linked) {
            throw new IllegalArgumentException("Entry is not queued: " + entry);
        }
        Entry successor = entry.next;
        if (entry.prev == null) {
            head = successor;
        } else {
            entry.prev.next = successor;
        }
        if (successor == null) {
            tail = entry.prev;
        } else {
            successor.prev = entry.prev;
        }
        entry.prev = null;
        entry.next = null;
        entry.linked = false;
        size--;
        return successor;
    }

    /**
     * Finds the first entry at or after {@code from} that belongs to {@code producer},
     * skipping entries of other producers without touching them.
     *
     * @param from where to start, or null for the end of the queue
     * @param producer the producer to look for
     * @return the matching entry, or null if the scan reached the end
     */
    Entry nextOf(Entry from, ProducerHandle producer) {
        Entry candidate = from;
        while (candidate != null && !candidate.belongsTo(producer)) {
            candidate = candidate.next;
        }
        return candidate;
    }

    Entry head() {
        return head;
    }

    boolean isEmpty() {
        return head == null;
    }

    int size() {
        return size;
    }

    List<Entry> snapshot() {
        List<Entry> entries = new ArrayList<>(size);
        for (Entry e = head; e != null; e = e.next) {
            entries.add(e);
        }
        return entries;
    }
}
