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

import io.nosqlbench.serialog.render.DefaultValueRenderer;
import io.nosqlbench.serialog.render.RenderAction;
import io.nosqlbench.serialog.sinks.NoopOutputSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryQueueTest {

    private EntryQueue queue;
    private ProducerHandle a;
    private ProducerHandle b;

    @BeforeEach
    void setUp() {
        queue = new EntryQueue();
        EntryScheduler scheduler = new EntryScheduler("queue-test", DefaultValueRenderer.getInstance(),
            NoopOutputSink.getInstance(), ClosedAppendPolicy.REJECT);
        a = new ProducerHandle(scheduler, 1, "A");
        b = new ProducerHandle(scheduler, 2, "B");
    }

    private Entry entry(ProducerHandle producer, Object value) {
        Entry e = new Entry(producer, RenderAction.of(value));
        queue.append(e);
        return e;
    }

    @Test
    void appendKeepsArrivalOrder() {
        Entry first = entry(a, 1);
        Entry second = entry(b, 2);
        Entry third = entry(a, 3);

        assertEquals(List.of(first, second, third), queue.snapshot());
        assertSame(first, queue.head());
        assertEquals(3, queue.size());
    }

    @Test
    void removeReturnsSuccessorAndRelinks() {
        Entry first = entry(a, 1);
        Entry middle = entry(b, 2);
        Entry last = entry(a, 3);

        assertSame(last, queue.remove(middle));
        assertEquals(List.of(first, last), queue.snapshot());

        assertNull(queue.remove(last));
        assertEquals(List.of(first), queue.snapshot());

        assertNull(queue.remove(first));
        assertTrue(queue.isEmpty());
        assertNull(queue.head());
        assertEquals(0, queue.size());
    }

    @Test
    void positionStaysValidAcrossAppendsAndRemovals() {
        Entry first = entry(a, 1);
        Entry held = entry(b, 2);
        queue.remove(first);
        Entry later = entry(a, 3);

        assertSame(held, queue.head());
        assertSame(later, queue.remove(held));
        assertSame(later, queue.head());
    }

    @Test
    void nextOfSkipsOtherProducersWithoutRemoving() {
        Entry a1 = entry(a, 1);
        entry(b, 2);
        entry(b, 3);
        Entry a2 = entry(a, 4);

        assertSame(a1, queue.nextOf(a1, a));
        assertSame(a2, queue.nextOf(a1.next, a));
        assertNull(queue.nextOf(a2.next, a));
        assertNull(queue.nextOf(null, a));
        assertEquals(4, queue.size());
    }

    @Test
    void rejectsDoubleAppendAndForeignRemove() {
        Entry queued = entry(a, 1);
        assertThrows(IllegalArgumentException.class, () -> queue.append(queued));

        Entry loose = new Entry(b, RenderAction.of(2));
        assertThrows(IllegalArgumentException.class, () -> queue.remove(loose));
    }
}
