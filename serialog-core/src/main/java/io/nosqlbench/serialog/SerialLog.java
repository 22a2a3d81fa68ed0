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
import io.nosqlbench.serialog.sinks.OutputSink;
import io.nosqlbench.serialog.sinks.PrintStreamSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An asynchronous, in-process log that lets many threads build multi-part messages
 * concurrently while guaranteeing that the characters of one message are never mixed
 * with those of another in the output.
 *
 * <p>Producers only enqueue: {@link #append(Object)} captures the value and returns
 * without waiting for it to be rendered, though it shares a lock with the consumer and
 * so waits out any sink write in progress. A single consumer thread, started by the constructor, renders the values
 * and owns every write to the {@link OutputSink}. It serves one producer at a time and
 * writes that producer's accumulated text as one block when the producer appends a
 * {@link FlushMarker}. Then it moves on to the producer with the oldest pending entry.</p>
 *
 * <h2>Usage Examples:</h2>
 *
 * <h3>Thread-bound Appends</h3>
 * <pre>{@code
 * try (SerialLog log = SerialLog.builder().withName("workers").build()) {
 *     Runnable work = () -> log.append("thread ")
 *         .append(Thread.currentThread().getName())
 *         .append(" done in ").append(elapsedMillis).append("ms")
 *         .endLine();
 *     // each line comes out whole, whatever the thread interleaving
 *     executor.invokeAll(List.of(Executors.callable(work), Executors.callable(work)));
 * }
 * }</pre>
 *
 * <h3>Explicit Producers</h3>
 * <pre>{@code
 * ProducerHandle scan = log.newProducer("scan");
 * scan.append("scanned ").append(files).append(" files").endLine();
 * }</pre>
 *
 * <h2>Producer Identity</h2>
 * <p>{@link #append(Object)}, {@link #flush()} and {@link #endLine()} use a
 * {@link ProducerHandle} bound to the calling thread, created on first use. Code whose
 * messages span several threads should use a handle from {@link #newProducer(String)}
 * instead.</p>
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li><strong>Per producer:</strong> values are rendered in append order, and a
 *       message reaches the sink as one write</li>
 *   <li><strong>Across producers:</strong> messages come out in roughly the order their
 *       first entries arrived; there is no other ordering guarantee</li>
 *   <li><strong>Starvation:</strong> the producer holding the floor keeps it until it
 *       flushes, so a producer that never flushes holds back everyone else until it
 *       does or until the log is closed</li>
 * </ul>
 *
 * <h2>Shutdown</h2>
 * <p>{@link #close()} is idempotent and blocks until the consumer has drained every
 * entry appended before the close and has terminated. During that final drain flush
 * markers no longer write individually; all remaining text is written to the sink in a
 * single write, grouped by producer. The sink is closed afterwards.</p>
 *
 * <h2>Appending After Close</h2>
 * <p>Appending to a closed log is a precondition violation. By default it throws
 * {@link IllegalStateException}; with {@link ClosedAppendPolicy#DROP} the value is
 * discarded and counted instead.</p>
 *
 * @see ProducerHandle
 * @see OutputSink
 * @see Builder
 * @since 1.0.0
 */
public final class SerialLog implements AutoCloseable {

    /**
     * System property read by {@link Builder#fromSystemProperties()} for the
     * {@link ClosedAppendPolicy}.
     */
    public static final String CLOSED_APPEND_PROPERTY = "nb.serialog.closed.append";

    /**
     * System property read by {@link Builder#fromSystemProperties()} for the
     * {@link SinkFailurePolicy}.
     */
    public static final String SINK_FAILURE_PROPERTY = "nb.serialog.sink.failure";

    private static final Logger logger = LogManager.getLogger(SerialLog.class);

    private final String name;
    private final EntryScheduler scheduler;
    private final SinkFailurePolicy sinkFailurePolicy;
    private final Thread consumerThread;
    private final AtomicLong producerIds = new AtomicLong();
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final ThreadLocal<ProducerHandle> threadProducer =
        ThreadLocal.withInitial(() -> newProducer(Thread.currentThread().getName()));

    private SerialLog(Builder builder, OutputSink sink) {
        this.name = builder.name;
        this.sinkFailurePolicy = builder.sinkFailurePolicy;
        this.scheduler = new EntryScheduler(builder.name, builder.renderer, sink, builder.closedAppendPolicy);
        this.consumerThread = new Thread(this::consume, "serialog-" + builder.name);
        this.consumerThread.setDaemon(builder.daemon);
        this.consumerThread.start();
    }

    /**
     * Creates a builder with the default settings: {@code System.out} sink, default
     * renderer, daemon consumer thread, {@link ClosedAppendPolicy#REJECT} and
     * {@link SinkFailurePolicy#LOG_AND_DROP}.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Appends a value to the calling thread's current message.
     *
     * @param value the value to render, or a {@link FlushMarker}
     * @return this log
     * @throws IllegalStateException if the log is closed and rejects appends
     */
    public SerialLog append(Object value) {
        scheduler.append(threadProducer.get(), value);
        return this;
    }

    /**
     * Ends the calling thread's current message without a line terminator.
     *
     * @return this log
     */
    public SerialLog flush() {
        return append(FlushMarker.FLUSH);
    }

    /**
     * Ends the calling thread's current message with the line terminator.
     *
     * @return this log
     */
    public SerialLog endLine() {
        return append(FlushMarker.END_LINE);
    }

    /**
     * Issues a new producer identity, independent of any thread.
     *
     * @param producerName a name used in diagnostics
     * @return a new handle appending to this log
     */
    public ProducerHandle newProducer(String producerName) {
        Objects.requireNonNull(producerName, "producerName");
        return new ProducerHandle(scheduler, producerIds.incrementAndGet(), producerName);
    }

    /**
     * @return the handle the calling thread appends through
     */
    public ProducerHandle currentProducer() {
        return threadProducer.get();
    }

    private void consume() {
        logger.debug("SerialLog '{}' consumer started", name);
        boolean interrupted = false;
        try {
            boolean running = true;
            while (running) {
                try {
                    running = scheduler.runOnce();
                } catch (InterruptedException e) {
                    interrupted = true;
                    logger.warn("SerialLog '{}' consumer was interrupted; draining and stopping", name);
                    scheduler.requestClose();
                }
            }
        } catch (RuntimeException | Error e) {
            logger.error("SerialLog '{}' consumer failed; draining queued entries and stopping", name, e);
            try {
                scheduler.drainRemaining();
            } catch (RuntimeException | Error drainFailure) {
                e.addSuppressed(drainFailure);
                logger.error("SerialLog '{}' could not drain queued entries after consumer failure",
                    name, drainFailure);
            }
            if (e instanceof VirtualMachineError) {
                throw e;
            }
        } finally {
            logger.debug("SerialLog '{}' consumer stopped: {}", name, scheduler.stats());
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Requests shutdown and blocks until the consumer has drained all queued entries and
     * terminated, then closes the sink. Safe to call more than once and from several
     * threads; every caller returns only after the consumer has terminated.
     *
     * @throws IllegalStateException if called from the consumer thread, for example from
     *                               inside a sink
     * @throws SinkWriteException under {@link SinkFailurePolicy#FAIL_ON_CLOSE} if any sink
     *                            write failed
     */
    @Override
    public void close() {
        if (Thread.currentThread() == consumerThread) {
            throw new IllegalStateException("SerialLog '" + name + "' cannot be closed from its own consumer thread");
        }
        scheduler.requestClose();
        awaitConsumer();

        if (!terminated.compareAndSet(false, true)) {
            return;
        }

        OutputSink sink = scheduler.getSink();
        Exception closeFailure = null;
        try {
            sink.close();
        } catch (Exception e) {
            logger.warn("SerialLog '{}' failed to close its sink: {}", name, e.getMessage(), e);
            closeFailure = e;
        }

        if (sinkFailurePolicy == SinkFailurePolicy.FAIL_ON_CLOSE) {
            Exception failure = scheduler.getFirstSinkFailure();
            if (failure == null) {
                failure = closeFailure;
            } else if (closeFailure != null) {
                failure.addSuppressed(closeFailure);
            }
            if (failure != null) {
                long failedWrites = scheduler.stats().getSinkFailures();
                throw new SinkWriteException("SerialLog '" + name + "' had " + failedWrites
                    + " failed sink write(s)", failure, failedWrites);
            }
        }
    }

    private void awaitConsumer() {
        boolean interrupted = false;
        while (consumerThread.isAlive()) {
            try {
                consumerThread.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return true once {@link #close()} has been requested
     */
    public boolean isClosed() {
        return scheduler.isClosing();
    }

    public String getName() {
        return name;
    }

    public SerialLogStats getStats() {
        return scheduler.stats();
    }

    /**
     * Fluent configuration for {@link SerialLog}. {@link #build()} starts the consumer
     * thread.
     *
     * <pre>{@code
     * SerialLog log = SerialLog.builder()
     *     .withName("import")
     *     .withSink(WriterSink.appendingTo(Path.of("logs/import.log")))
     *     .withRenderer(new DefaultValueRenderer("\r\n"))
     *     .withSinkFailurePolicy(SinkFailurePolicy.FAIL_ON_CLOSE)
     *     .build();
     * }</pre>
     */
    public static final class Builder {
        private String name = "serialog";
        private OutputSink sink;
        private ValueRenderer renderer = DefaultValueRenderer.getInstance();
        private boolean daemon = true;
        private ClosedAppendPolicy closedAppendPolicy = ClosedAppendPolicy.REJECT;
        private SinkFailurePolicy sinkFailurePolicy = SinkFailurePolicy.LOG_AND_DROP;

        Builder() {
        }

        /**
         * Seeds the policies from the {@value SerialLog#CLOSED_APPEND_PROPERTY} and
         * {@value SerialLog#SINK_FAILURE_PROPERTY} system properties. Unset properties keep the
         * defaults; unrecognized values keep the defaults and log a warning.
         *
         * @return this builder
         */
        public Builder fromSystemProperties() {
            String closedAppend = System.getProperty(CLOSED_APPEND_PROPERTY);
            try {
                ClosedAppendPolicy policy = ClosedAppendPolicy.fromString(closedAppend);
                if (policy != null) {
                    this.closedAppendPolicy = policy;
                }
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}={}: {}", CLOSED_APPEND_PROPERTY, closedAppend, e.getMessage());
            }

            String sinkFailure = System.getProperty(SINK_FAILURE_PROPERTY);
            try {
                SinkFailurePolicy policy = SinkFailurePolicy.fromString(sinkFailure);
                if (policy != null) {
                    this.sinkFailurePolicy = policy;
                }
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}={}: {}", SINK_FAILURE_PROPERTY, sinkFailure, e.getMessage());
            }
            return this;
        }

        /**
         * Sets the log name, used in diagnostics and in the consumer thread name
         * {@code serialog-<name>}. Default is "serialog".
         *
         * @param name the log name
         * @return this builder
         * @throws IllegalArgumentException if name is blank
         */
        public Builder withName(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        /**
         * Sets the output sink. Default is a {@link PrintStreamSink} on {@code System.out}.
         *
         * @param sink the sink
         * @return this builder
         */
        public Builder withSink(OutputSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withRenderer(ValueRenderer renderer) {
            this.renderer = Objects.requireNonNull(renderer, "renderer");
            return this;
        }

        /**
         * Whether the consumer thread is a daemon thread. Default is true. A non-daemon
         * consumer keeps the JVM alive until the log is closed.
         *
         * @param daemon the daemon flag
         * @return this builder
         */
        public Builder withDaemon(boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        public Builder withClosedAppendPolicy(ClosedAppendPolicy policy) {
            this.closedAppendPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder withSinkFailurePolicy(SinkFailurePolicy policy) {
            this.sinkFailurePolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * Creates the log and starts its consumer thread.
         *
         * @return a running log
         */
        public SerialLog build() {
            return new SerialLog(this, sink != null ? sink : new PrintStreamSink());
        }
    }
}
