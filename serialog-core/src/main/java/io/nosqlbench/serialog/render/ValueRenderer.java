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

package io.nosqlbench.serialog.render;

/**
 * Turns a single appended value into characters. The consumer thread invokes the
 * renderer once per content entry, always while holding the log's lock, so
 * implementations should be fast, must not block, and should not keep state between
 * calls.
 *
 * <h2>Implementation Example</h2>
 * <pre>{@code
 * ValueRenderer upper = new ValueRenderer() {
 *     @Override
 *     public void renderInto(LineBuffer buffer, Object value) {
 *         buffer.append(String.valueOf(value).toUpperCase(Locale.ROOT));
 *     }
 * };
 *
 * try (SerialLog log = SerialLog.builder().withRenderer(upper).build()) {
 *     log.append("hello").endLine();   // writes "HELLO\n"
 * }
 * }</pre>
 *
 * <p>An exception thrown from {@link #renderInto} does not stop the consumer. It is
 * logged, counted in {@link io.nosqlbench.serialog.SerialLogStats#getRenderFailures()},
 * and a placeholder is rendered in place of the value.</p>
 *
 * @see DefaultValueRenderer
 * @since 1.0.0
 */
public interface ValueRenderer {

    /**
     * Appends the textual form of {@code value} to {@code buffer}.
     *
     * @param buffer the accumulation buffer of the message being built
     * @param value the captured value, may be null
     */
    void renderInto(LineBuffer buffer, Object value);

    /**
     * Appends the line terminator used by {@link FlushMarker#END_LINE}.
     *
     * @param buffer the accumulation buffer of the message being built
     */
    default void renderLineEnd(LineBuffer buffer) {
        buffer.append('\n');
    }
}
