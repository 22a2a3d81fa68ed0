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
 * Distinguished values that end a message. Appending either constant makes the
 * consumer hand everything the producer accumulated since its previous flush to the
 * output sink as one write, after which the floor passes to the oldest pending entry.
 *
 * <pre>{@code
 * log.append("rows=").append(rows).append(FlushMarker.END_LINE);
 * // same as
 * log.append("rows=").append(rows).endLine();
 * }</pre>
 *
 * @since 1.0.0
 */
public enum FlushMarker {
    /**
     * Flush without appending anything.
     */
    FLUSH,

    /**
     * Append the renderer's line terminator, then flush.
     */
    END_LINE
}
