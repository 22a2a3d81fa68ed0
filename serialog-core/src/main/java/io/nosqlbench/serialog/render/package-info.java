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

/**
 * Deferred rendering of appended values: the {@link io.nosqlbench.serialog.render.RenderAction}
 * variants queued by producers, the {@link io.nosqlbench.serialog.render.ValueRenderer}
 * that turns values into text, and the {@link io.nosqlbench.serialog.render.LineBuffer}
 * the text accumulates in until a flush.
 *
 * @since 1.0.0
 */
package io.nosqlbench.serialog.render;
