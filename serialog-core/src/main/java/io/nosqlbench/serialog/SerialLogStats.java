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

/**
 * Immutable snapshot of the counters of a {@link SerialLog}. The counters are read
 * individually without stopping the consumer, so a snapshot taken while producers are
 * active is approximate; one taken after {@link SerialLog#close()} is exact.
 *
 * @since 1.0.0
 */
public final class SerialLogStats {

    private final long appended;
    private final long executed;
    private final long sinkWrites;
    private final long charsWritten;
    private final long sinkFailures;
    private final long renderFailures;
    private final long rejectedAppends;

    SerialLogStats(long appended,
                   long executed,
                   long sinkWrites,
                   long charsWritten,
                   long sinkFailures,
                   long renderFailures,
                   long rejectedAppends) {
        this.appended = appended;
        this.executed = executed;
        this.sinkWrites = sinkWrites;
        this.charsWritten = charsWritten;
        this.sinkFailures = sinkFailures;
        this.renderFailures = renderFailures;
        this.rejectedAppends = rejectedAppends;
    }

    /**
     * @return entries accepted into the queue, flush markers included
     */
    public long getAppended() {
        return appended;
    }

    /**
     * @return entries the consumer has run and removed
     */
    public long getExecuted() {
        return executed;
    }

    /**
     * Entries accepted but not yet run. Calculated as: appended - executed.
     *
     * @return pending entry count
     */
    public long getPending() {
        return appended - executed;
    }

    /**
     * @return successful writes to the output sink
     */
    public long getSinkWrites() {
        return sinkWrites;
    }

    /**
     * @return characters handed to the sink by successful writes
     */
    public long getCharsWritten() {
        return charsWritten;
    }

    public long getSinkFailures() {
        return sinkFailures;
    }

    public long getRenderFailures() {
        return renderFailures;
    }

    /**
     * @return appends refused or dropped because the log was already closing
     */
    public long getRejectedAppends() {
        return rejectedAppends;
    }

    @Override
    public String toString() {
        return "SerialLogStats{appended=" + appended
            + ", executed=" + executed
            + ", sinkWrites=" + sinkWrites
            + ", charsWritten=" + charsWritten
            + ", sinkFailures=" + sinkFailures
            + ", renderFailures=" + renderFailures
            + ", rejectedAppends=" + rejectedAppends
            + "}";
    }
}
