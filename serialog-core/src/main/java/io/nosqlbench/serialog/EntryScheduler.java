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

import io.nosqlbench.serialog.render.LineBuffer;
import io.nosqlbench.serialog.render.RenderAction;
import io.nosqlbench.serialog.render.ValueRenderer;
import io.nosqlbench.serialog.sinks.OutputSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The shared state of a {@link SerialLog} and every operation on it: the producer append
 * path, the consumer's drain of the active group, and the final drain on shutdown.
 * {@link SerialLog} owns the consumer thread and simply calls {@link #runOnce()} in a
 * loop; tests drive the same methods directly without any thread.
 *
 * <h2>Floor Ownership</h2>
 * <p>The consumer serves one producer at a time. It runs that producer's entries in
 * order, skipping over entries of other producers without removing them, until the
 * producer appends a flush marker. The accumulated text is then written to the sink as
 * one block and the floor passes to whoever owns the oldest entry left in the queue.
 * When the consumer catches up with the floor holder before a flush, it waits, still
 * holding the floor for that producer. A producer that never flushes therefore keeps
 * the floor until it does or until the log is closed.</p>
 *
 * <h2>Locking</h2>
 * <ul>
 *   <li>One {@link ReentrantLock} guards the queue, the cursor, the buffer and the
 *       closing flag</li>
 *   <li>The consumer keeps the lock for a whole run of same-producer entries, including
 *       the sink write, and releases it only while awaiting {@link #workAvailable}</li>
 *   <li>Producers hold it just long enough to link one entry and update the cursor.
 *       They never wait for the consumer to run their entries, but they do block on the
 *       lock while the consumer is draining, sink write included</li>
 *   <li>Producers only signal when the consumer would otherwise not see the new entry:
 *       the floor was idle, or the floor holder's cursor was exhausted</li>
 * </ul>
 */
final class EntryScheduler {

    private static final Logger logger = LogManager.getLogger(EntryScheduler.class);

    private final String name;
    private final ValueRenderer renderer;
    private final OutputSink sink;
    private final ClosedAppendPolicy closedAppendPolicy;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    private final EntryQueue queue = new EntryQueue();
    private final ActiveGroupCursor cursor = new ActiveGroupCursor();
    private final LineBuffer buffer = new LineBuffer();
    private boolean closing;
    private Exception firstSinkFailure;

    private final AtomicLong appended = new AtomicLong();
    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong sinkWrites = new AtomicLong();
    private final AtomicLong charsWritten = new AtomicLong();
    private final AtomicLong sinkFailures = new AtomicLong();
    private final AtomicLong renderFailures = new AtomicLong();
    private final AtomicLong rejectedAppends = new AtomicLong();

    EntryScheduler(String name, ValueRenderer renderer, OutputSink sink, ClosedAppendPolicy closedAppendPolicy) {
        this.name = Objects.requireNonNull(name, "name");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.closedAppendPolicy = Objects.requireNonNull(closedAppendPolicy, "closedAppendPolicy");
    }

    /**
     * Queues one value for {@code producer}. Does not wait for the value to be rendered,
     * but blocks on the lock while the consumer is draining.
     *
     * @param producer the producer appending the value
     * @param value the value, or a {@link io.nosqlbench.serialog.render.FlushMarker}
     * @return true if the value was queued, false if it was dropped after close
     * @throws IllegalStateException if the log is closing and the policy is
     *                               {@link ClosedAppendPolicy#REJECT}
     */
    boolean append(ProducerHandle producer, Object value) {
        RenderAction action = RenderAction.of(value);
        lock.lock();
        try {
            if (!closing) {
                Entry entry = new Entry(producer, action);
                queue.append(entry);
                appended.incrementAndGet();

                if (cursor.isIdle()) {
                    cursor.claim(producer, entry);
                    workAvailable.signal();
                } else if (cursor.isHeldBy(producer) && cursor.isExhausted()) {
                    cursor.moveTo(entry);
                    workAvailable.signal();
                }
                return true;
            }
        } finally {
            lock.unlock();
        }
        return refuseClosedAppend(producer);
    }

    private boolean refuseClosedAppend(ProducerHandle producer) {
        long refused = rejectedAppends.incrementAndGet();
        if (closedAppendPolicy == ClosedAppendPolicy.REJECT) {
            throw new IllegalStateException("SerialLog '" + name + "' is closed; producer '"
                + producer.getName() + "' cannot append");
        }
        if (refused == 1) {
            logger.warn("SerialLog '{}' is closed; dropping append from producer '{}'. " +
                "Further dropped appends are logged at debug level.", name, producer.getName());
        } else {
            logger.debug("SerialLog '{}' is closed; dropped append #{} from producer '{}'",
                name, refused, producer.getName());
        }
        return false;
    }

    /**
     * One turn of the consumer: waits until the floor holder has an entry to run or
     * close is requested, then drains the active group, or everything if closing.
     *
     * @return false once the final drain has completed and the consumer should exit
     * @throws InterruptedException if interrupted while waiting for work
     */
    boolean runOnce() throws InterruptedException {
        lock.lock();
        try {
            while (!closing && cursor.position() == null) {
                workAvailable.await();
            }
            if (closing) {
                drainRemaining();
                return false;
            }
            drainActiveGroup();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the floor holder's entries in order until it flushes and the floor moves on,
     * or until none of its entries are left and the cursor is exhausted. On a flush the
     * buffer goes to the sink and the oldest remaining entry's producer takes the floor.
     */
    void drainActiveGroup() {
        lock.lock();
        try {
            Entry current = cursor.position();
            while (current != null && current.belongsTo(cursor.producer())) {
                if (execute(current)) {
                    writeToSink(buffer.drain());
                    queue.remove(current);
                    Entry head = queue.head();
                    if (head == null) {
                        cursor.goIdle();
                        return;
                    }
                    cursor.claim(head.producer(), head);
                    current = head;
                } else {
                    Entry successor = queue.remove(current);
                    current = queue.nextOf(successor, cursor.producer());
                    cursor.moveTo(current);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs every remaining entry, one producer group at a time: all entries of the
     * current group wherever they sit in the queue, then the group owning the new head,
     * and so on. Flush markers do not write during this drain; the whole remainder goes
     * to the sink in one write at the end. Marks the scheduler closing.
     */
    void drainRemaining() {
        lock.lock();
        try {
            closing = true;
            int groups = 0;
            long remaining = queue.size();
            while (!queue.isEmpty()) {
                if (cursor.position() == null) {
                    Entry head = queue.head();
                    cursor.claim(head.producer(), head);
                }
                ProducerHandle group = cursor.producer();
                Entry current = cursor.position();
                while (current != null) {
                    if (current.belongsTo(group)) {
                        execute(current);
                        current = queue.remove(current);
                    } else {
                        current = current.next;
                    }
                }
                cursor.moveTo(null);
                groups++;
            }
            cursor.goIdle();
            if (!buffer.isEmpty()) {
                writeToSink(buffer.drain());
            }
            logger.debug("SerialLog '{}' drained {} remaining entries from {} producer groups on close",
                name, remaining, groups);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies the entry's action to the buffer. A failure while rendering, including a
     * {@link StackOverflowError} from a recursive {@code toString()}, cuts the buffer back
     * to where the value started and leaves a placeholder instead. Other
     * {@link VirtualMachineError}s are rethrown with the buffer cut back and the entry
     * still queued.
     */
    private boolean execute(Entry entry) {
        int mark = buffer.length();
        boolean flush;
        try {
            flush = entry.action().apply(buffer, renderer);
        } catch (Throwable t) {
            buffer.truncate(mark);
            if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
                throw (VirtualMachineError) t;
            }
            renderFailures.incrementAndGet();
            logger.warn("SerialLog '{}' failed to render a value from producer '{}': {}",
                name, entry.producer().getName(), t.toString(), t);
            buffer.append("<render failed: ").append(t.getClass().getSimpleName()).append('>');
            flush = entry.action().isFlush();
        }
        executed.incrementAndGet();
        return flush;
    }

    private void writeToSink(String text) {
        try {
            sink.write(text);
            sinkWrites.incrementAndGet();
            charsWritten.addAndGet(text.length());
        } catch (Exception e) {
            long failures = sinkFailures.incrementAndGet();
            logger.warn("SerialLog '{}' failed to write {} chars to sink (failure #{}): {}",
                name, text.length(), failures, e.getMessage(), e);
            if (firstSinkFailure == null) {
                firstSinkFailure = e;
            } else if (firstSinkFailure != e) {
                firstSinkFailure.addSuppressed(e);
            }
        }
    }

    /**
     * Asks the consumer to perform the final drain and exit. Idempotent.
     */
    void requestClose() {
        lock.lock();
        try {
            closing = true;
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isClosing() {
        lock.lock();
        try {
            return closing;
        } finally {
            lock.unlock();
        }
    }

    Exception getFirstSinkFailure() {
        lock.lock();
        try {
            return firstSinkFailure;
        } finally {
            lock.unlock();
        }
    }

    SerialLogStats stats() {
        long executedCount = executed.get();
        return new SerialLogStats(
            appended.get(),
            executedCount,
            sinkWrites.get(),
            charsWritten.get(),
            sinkFailures.get(),
            renderFailures.get(),
            rejectedAppends.get());
    }

    String getName() {
        return name;
    }

    OutputSink getSink() {
        return sink;
    }

    // for tests and diagnostics; takes the lock

    List<Entry> queuedEntries() {
        lock.lock();
        try {
            return queue.snapshot();
        } finally {
            lock.unlock();
        }
    }

    ProducerHandle floorHolder() {
        lock.lock();
        try {
            return cursor.producer();
        } finally {
            lock.unlock();
        }
    }

    boolean isCursorExhausted() {
        lock.lock();
        try {
            return cursor.isExhausted();
        } finally {
            lock.unlock();
        }
    }

    String bufferedText() {
        lock.lock();
        try {
            return buffer.toString();
        } finally {
            lock.unlock();
        }
    }
}
