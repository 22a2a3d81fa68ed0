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

import java.lang.reflect.Array;

/**
 * A deferred unit of rendering work, created on the producer thread and applied later
 * on the consumer thread. There are exactly three kinds:
 *
 * <ul>
 *   <li><strong>content:</strong> renders a captured value into the {@link LineBuffer}</li>
 *   <li><strong>flush:</strong> raises the flush signal without appending anything</li>
 *   <li><strong>end-line:</strong> appends the line terminator, then raises the flush signal</li>
 * </ul>
 *
 * <h2>Value Capture</h2>
 * <p>The producer may keep mutating its objects after {@code append} returns, so
 * {@link #of(Object)} snapshots what it cheaply can: a non-String {@link CharSequence}
 * (for example a reused {@link StringBuilder}) is copied to a String, and arrays are
 * shallow-copied. Any other object is rendered by reference when the consumer gets to
 * it, so callers should pass immutable values or render them first.</p>
 *
 * @see FlushMarker
 * @since 1.0.0
 */
public abstract class RenderAction {

    private static final RenderAction FLUSH = new Flush();
    private static final RenderAction END_LINE = new EndLine();

    RenderAction() {
    }

    /**
     * Creates the action for one appended value. {@link FlushMarker} constants map to
     * the flush and end-line actions; everything else becomes a content action.
     *
     * @param value the value to capture, may be null
     * @return the deferred action
     */
    public static RenderAction of(Object value) {
        if (value instanceof FlushMarker) {
            return forMarker((FlushMarker) value);
        }
        return new Content(capture(value));
    }

    public static RenderAction forMarker(FlushMarker marker) {
        switch (marker) {
            case FLUSH:
                return FLUSH;
            case END_LINE:
                return END_LINE;
            default:
                throw new IllegalArgumentException("Unknown flush marker: " + marker);
        }
    }

    /**
     * Applies this action to the buffer.
     *
     * @param buffer the accumulation buffer
     * @param renderer the renderer for content values
     * @return true if this action raised the flush signal
     */
    public abstract boolean apply(LineBuffer buffer, ValueRenderer renderer);

    /**
     * @return true for the flush and end-line actions
     */
    public abstract boolean isFlush();

    static Object capture(Object value) {
        if (value == null || value instanceof String) {
            return value;
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            System.arraycopy(value, 0, copy, 0, length);
            return copy;
        }
        return value;
    }

    private static final class Content extends RenderAction {
        private final Object value;

        Content(Object value) {
            this.value = value;
        }

        @Override
        public boolean apply(LineBuffer buffer, ValueRenderer renderer) {
            renderer.renderInto(buffer, value);
            return false;
        }

        @Override
        public boolean isFlush() {
            return false;
        }

        @Override
        public String toString() {
            return "Content[" + value + "]";
        }
    }

    private static final class Flush extends RenderAction {
        @Override
        public boolean apply(LineBuffer buffer, ValueRenderer renderer) {
            return true;
        }

        @Override
        public boolean isFlush() {
            return true;
        }

        @Override
        public String toString() {
            return "Flush";
        }
    }

    private static final class EndLine extends RenderAction {
        @Override
        public boolean apply(LineBuffer buffer, ValueRenderer renderer) {
            renderer.renderLineEnd(buffer);
            return true;
        }

        @Override
        public boolean isFlush() {
            return true;
        }

        @Override
        public String toString() {
            return "EndLine";
        }
    }
}
