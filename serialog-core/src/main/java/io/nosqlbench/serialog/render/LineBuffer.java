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
 * Append-only text accumulator that {@link RenderAction}s write into. The accumulated
 * text is handed to the output sink as a single block by {@link #drain()}, which also
 * resets the buffer for the next message.
 *
 * <p>This class is not thread-safe. It is owned by the consumer side of a
 * {@link io.nosqlbench.serialog.SerialLog} and is only touched while the log's
 * shared lock is held.</p>
 *
 * @since 1.0.0
 */
public final class LineBuffer {

    private final StringBuilder text = new StringBuilder(256);

    public LineBuffer append(CharSequence chars) {
        text.append(chars);
        return this;
    }

    public LineBuffer append(char c) {
        text.append(c);
        return this;
    }

    public int length() {
        return text.length();
    }

    public boolean isEmpty() {
        return text.length() == 0;
    }

    /**
     * Discards everything appended after the first {@code length} characters.
     *
     * @param length the length to cut back to, at most {@link #length()}
     * @throws IllegalArgumentException if length is negative or beyond the current length
     */
    public void truncate(int length) {
        if (length < 0 || length > text.length()) {
            throw new IllegalArgumentException("Cannot truncate " + text.length() + " chars to " + length);
        }
        text.setLength(length);
    }

    /**
     * Returns everything accumulated since the previous drain and empties the buffer.
     *
     * @return the accumulated text, possibly empty
     */
    public String drain() {
        String drained = text.toString();
        text.setLength(0);
        return drained;
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
