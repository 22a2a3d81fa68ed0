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
 * An in-process log that many threads can append to concurrently, with one background
 * consumer thread writing the output.
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li>{@link io.nosqlbench.serialog.SerialLog}: the log, owning the consumer thread</li>
 *   <li>{@link io.nosqlbench.serialog.ProducerHandle}: the identity a message is built
 *       under; one per thread by default, or issued explicitly</li>
 *   <li>{@link io.nosqlbench.serialog.render.FlushMarker}: ends a message and makes it
 *       visible in the output</li>
 *   <li>{@link io.nosqlbench.serialog.sinks.OutputSink}: where finished messages go</li>
 * </ul>
 *
 * <h2>Guarantees</h2>
 * <p>The text of one message reaches the sink in a single write and is never spliced
 * with text from another producer. Every value appended before
 * {@link io.nosqlbench.serialog.SerialLog#close()} is rendered and written before close
 * returns. Nothing is guaranteed about the relative order of messages from different
 * producers beyond arrival order of their first entries.</p>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SerialLog log = SerialLog.builder().build()) {
 *     log.append("answer=").append(42).endLine();
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
package io.nosqlbench.serialog;
