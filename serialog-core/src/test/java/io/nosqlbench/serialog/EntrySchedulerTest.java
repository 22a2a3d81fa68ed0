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
import io.nosqlbench.serialog.render.FlushMarker;
import io.nosqlbench.serialog.render.ValueRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the scheduler synchronously, one consumer step at a time, so that each ordering
 * decision can be checked without thread timing.
 */
class EntrySchedulerTest {

    private RecordingSink sink;
    private EntryScheduler scheduler;
    private ProducerHandle a;
    private ProducerHandle b;
    private ProducerHandle c;

    @BeforeEach
    void setUp() {
        sink = new RecordingSink();
        scheduler = newScheduler(ClosedAppendPolicy.REJECT);
    }

    private EntryScheduler newScheduler(ClosedAppendPolicy policy) {
        EntryScheduler created = new EntryScheduler("test", DefaultValueRenderer.getInstance(), sink, policy);
        a = new ProducerHandle(created, 1, "A");
        b = new ProducerHandle(created, 2, "B");
        c = new ProducerHandle(created, 3, "C");
        return created;
    }

    @Test
    void firstAppendClaimsIdleFloor() {
        assertNull(scheduler.floorHolder());

        scheduler.append(a, "a1");

        assertSame(a, scheduler.floorHolder());
        assertFalse(scheduler.isCursorExhausted());
    }

    @Test
    void otherProducersDoNotTakeHeldFloor() {
        scheduler.append(a, "a1");
        scheduler.append(b, "b1");
        scheduler.append(b, FlushMarker.FLUSH);

        assertSame(a, scheduler.floorHolder());
        assertEquals(3, scheduler.queuedEntries().size());
    }

    @Test
    void flushWritesMessageAndHandsFloorToOldestPendingEntry() {
        scheduler.append(a, "a1");
        scheduler.append(b, "b1");
        scheduler.append(a, FlushMarker.FLUSH);
        scheduler.append(b, FlushMarker.FLUSH);

        scheduler.drainActiveGroup();

        assertEquals(List.of("a1", "b1"), sink.writes());
        assertNull(scheduler.floorHolder());
        assertTrue(scheduler.queuedEntries().isEmpty());
    }

    @Test
    void consumerSkipsOtherProducersInPlace() {
        scheduler.append(a, "a1");
        scheduler.append(b, "b1");
        scheduler.append(a, "a2");
        scheduler.append(c, "c1");
        scheduler.append(a, "a3");

        scheduler.drainActiveGroup();

        assertEquals("a1a2a3", scheduler.bufferedText());
        assertTrue(sink.writes().isEmpty());
        List<Entry> left = scheduler.queuedEntries();
        assertEquals(2, left.size());
        assertSame(b, left.get(0).producer());
        assertSame(c, left.get(1).producer());
    }

    @Test
    void exhaustedCursorKeepsFloorUntilSameProducerAppends() {
        scheduler.append(a, "x");
        scheduler.drainActiveGroup();

        assertSame(a, scheduler.floorHolder());
        assertTrue(scheduler.isCursorExhausted());

        scheduler.append(b, "y");
        scheduler.append(b, FlushMarker.FLUSH);
        scheduler.drainActiveGroup();
        assertTrue(sink.writes().isEmpty(), "B must wait while A holds the floor");
        assertTrue(scheduler.isCursorExhausted());

        scheduler.append(a, FlushMarker.FLUSH);
        assertFalse(scheduler.isCursorExhausted(), "A's append extends the exhausted cursor");

        scheduler.drainActiveGroup();
        assertEquals(List.of("x", "y"), sink.writes());
        assertNull(scheduler.floorHolder());
    }

    @Test
    void appendBehindUnconsumedBacklogDoesNotMoveCursor() {
        scheduler.append(a, "a1");
        scheduler.append(a, "a2");
        scheduler.append(a, FlushMarker.END_LINE);

        scheduler.drainActiveGroup();

        assertEquals(List.of("a1a2\n"), sink.writes());
    }

    @Test
    void producerThatNeverFlushesHoldsFloorUntilClose() {
        for (int i = 0; i < 1000; i++) {
            scheduler.append(a, i % 10);
        }
        scheduler.append(b, "b1");
        scheduler.append(b, FlushMarker.FLUSH);

        scheduler.drainActiveGroup();
        assertTrue(sink.writes().isEmpty());
        assertSame(a, scheduler.floorHolder());

        scheduler.drainRemaining();

        assertEquals(1, sink.writes().size());
        String written = sink.writes().get(0);
        assertEquals(1002, written.length());
        assertTrue(written.endsWith("b1"));
    }

    @Test
    void shutdownDrainsGroupThenScansInArrivalOrder() {
        scheduler.append(a, "a1");
        scheduler.append(b, "b1");
        scheduler.append(a, "a2");
        scheduler.append(c, "c1");
        scheduler.append(b, "b2");
        scheduler.append(a, FlushMarker.FLUSH);
        scheduler.append(c, FlushMarker.END_LINE);

        scheduler.drainRemaining();

        assertEquals(List.of("a1a2b1b2c1\n"), sink.writes());
        assertTrue(scheduler.queuedEntries().isEmpty());
        assertNull(scheduler.floorHolder());
        assertEquals(7, scheduler.stats().getExecuted());
        assertEquals(0, scheduler.stats().getPending());
    }

    @Test
    void shutdownStartsFromHeadWhenCursorExhausted() {
        scheduler.append(a, "a1");
        scheduler.drainActiveGroup();
        scheduler.append(c, "c1");
        scheduler.append(b, "b1");
        scheduler.append(c, "c2");

        scheduler.drainRemaining();

        assertEquals(List.of("a1c1c2b1"), sink.writes());
    }

    @Test
    void shutdownWithNothingBufferedWritesNothing() {
        scheduler.append(a, "a1");
        scheduler.append(a, FlushMarker.FLUSH);
        scheduler.drainActiveGroup();

        scheduler.drainRemaining();

        assertEquals(List.of("a1"), sink.writes());
    }

    @Test
    void runOnceReturnsFalseAfterCloseAndDrains() throws InterruptedException {
        scheduler.append(a, "a1");
        scheduler.requestClose();

        assertFalse(scheduler.runOnce());
        assertEquals(List.of("a1"), sink.writes());
    }

    @Test
    void runOnceDrainsActiveGroupWithoutBlocking() throws InterruptedException {
        scheduler.append(a, "a1");
        scheduler.append(a, FlushMarker.FLUSH);

        assertTrue(scheduler.runOnce());
        assertEquals(List.of("a1"), sink.writes());
    }

    @Test
    void appendAfterCloseIsRejected() {
        scheduler.requestClose();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> scheduler.append(a, "late"));
        assertTrue(e.getMessage().contains("'A'"));
        assertEquals(1, scheduler.stats().getRejectedAppends());
        assertEquals(0, scheduler.stats().getAppended());
    }

    @Test
    void appendAfterCloseIsDroppedUnderDropPolicy() {
        scheduler = newScheduler(ClosedAppendPolicy.DROP);
        scheduler.requestClose();

        assertFalse(scheduler.append(a, "late"));
        assertFalse(scheduler.append(b, "later"));

        assertEquals(2, scheduler.stats().getRejectedAppends());
        assertTrue(scheduler.queuedEntries().isEmpty());
    }

    @Test
    void renderFailureLeavesPlaceholderAndContinues() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("boom");
            }
        };
        scheduler.append(a, "before ");
        scheduler.append(a, broken);
        scheduler.append(a, " after");
        scheduler.append(a, FlushMarker.FLUSH);

        scheduler.drainActiveGroup();

        assertEquals(List.of("before <render failed: IllegalStateException> after"), sink.writes());
        assertEquals(1, scheduler.stats().getRenderFailures());
    }

    @Test
    void partialOutputOfFailedRenderIsDiscarded() {
        ValueRenderer halfway = (buffer, value) -> {
            if (value instanceof Integer) {
                buffer.append("partial-");
                throw new IllegalArgumentException("unsupported");
            }
            buffer.append(String.valueOf(value));
        };
        EntryScheduler custom = new EntryScheduler("custom", halfway, sink, ClosedAppendPolicy.REJECT);
        ProducerHandle producer = new ProducerHandle(custom, 1, "P");

        custom.append(producer, "[");
        custom.append(producer, 7);
        custom.append(producer, "]");
        custom.append(producer, FlushMarker.FLUSH);
        custom.drainActiveGroup();

        assertEquals(List.of("[<render failed: IllegalArgumentException>]"), sink.writes());
        assertEquals(4, custom.stats().getExecuted());
    }

    @Test
    void fatalRenderErrorLeavesEntryQueuedForFinalDrain() {
        boolean[] failed = {false};
        ValueRenderer failingOnce = (buffer, value) -> {
            buffer.append(String.valueOf(value));
            if (!failed[0]) {
                failed[0] = true;
                throw new InternalError("simulated");
            }
        };
        EntryScheduler custom = new EntryScheduler("custom", failingOnce, sink, ClosedAppendPolicy.REJECT);
        ProducerHandle producer = new ProducerHandle(custom, 1, "P");
        custom.append(producer, "x");
        custom.append(producer, FlushMarker.END_LINE);

        assertThrows(InternalError.class, custom::drainActiveGroup);
        assertEquals(2, custom.queuedEntries().size());
        assertEquals("", custom.bufferedText());

        custom.drainRemaining();

        assertEquals(List.of("x\n"), sink.writes());
        assertEquals(0, custom.stats().getRenderFailures());
        assertEquals(0, custom.stats().getPending());
    }

    @Test
    void sinkFailureIsRecordedAndLaterWritesProceed() {
        sink.failNext(1);
        scheduler.append(a, "lost");
        scheduler.append(a, FlushMarker.FLUSH);
        scheduler.append(a, "kept");
        scheduler.append(a, FlushMarker.FLUSH);

        scheduler.drainActiveGroup();

        assertEquals(List.of("kept"), sink.writes());
        SerialLogStats stats = scheduler.stats();
        assertEquals(1, stats.getSinkFailures());
        assertEquals(1, stats.getSinkWrites());
        assertEquals(4, stats.getCharsWritten());
        assertNotNull(scheduler.getFirstSinkFailure());
        assertTrue(scheduler.getFirstSinkFailure().getMessage().contains("lost"));
    }

    @Test
    void laterSinkFailuresAreSuppressedOnTheFirst() {
        sink.failNext(3);
        for (String message : List.of("one", "two", "three")) {
            scheduler.append(a, message);
            scheduler.append(a, FlushMarker.FLUSH);
        }

        scheduler.drainActiveGroup();

        Exception first = scheduler.getFirstSinkFailure();
        assertTrue(first.getMessage().contains("one"));
        assertEquals(2, first.getSuppressed().length);
    }
}
