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

import io.nosqlbench.serialog.render.FlushMarker;

/**
 * The identity under which values are appended to a {@link SerialLog}. Entries from one
 * handle form one message stream: they are rendered in append order and reach the sink
 * only as whole messages, never spliced with another handle's output.
 *
 * <p>Handles are compared by identity. A handle is not tied to a thread, so a task that
 * moves between threads (for example across {@code CompletableFuture} stages) can keep
 * building one message through the same handle, as long as it does not append from two
 * threads at once.</p>
 *
 * <pre>{@code
 * ProducerHandle loader = log.newProducer("loader");
 * CompletableFuture.runAsync(() -> loader.append("fetched ").append(n))
 *     .thenRunAsync(() -> loader.append(" rows, stored").endLine());
 * }</pre>
 *
 * @see SerialLog#newProducer(String)
 * @since 1.0.0
 */
public final class ProducerHandle {

    private final EntryScheduler scheduler;
    private final long id;
    private final String name;

    ProducerHandle(EntryScheduler scheduler, long id, String name) {
        this.scheduler = scheduler;
        this.id = id;
        this.name = name;
    }

    /**
     * Appends one value to this producer's current message.
     *
     * @param value the value to render, or a {@link FlushMarker}
     * @return this handle
     * @throws IllegalStateException if the log is closed and rejects appends
     */
    public ProducerHandle append(Object value) {
        scheduler.append(this, value);
        return this;
    }

    /**
     * Ends the current message without a line terminator.
     *
     * @return this handle
     */
    public ProducerHandle flush() {
        return append(FlushMarker.FLUSH);
    }

    /**
     * Ends the current message with the renderer's line terminator.
     *
     * @return this handle
     */
    public ProducerHandle endLine() {
        return append(FlushMarker.END_LINE);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ProducerHandle[" + name + "#" + id + "@" + scheduler.getName() + "]";
    }
}
