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
 * Output destinations for flushed messages.
 *
 * <ul>
 *   <li>{@link io.nosqlbench.serialog.sinks.PrintStreamSink}: console or any PrintStream</li>
 *   <li>{@link io.nosqlbench.serialog.sinks.WriterSink}: any Writer, including files</li>
 *   <li>{@link io.nosqlbench.serialog.sinks.LoggerSink}: a Log4j 2 logger</li>
 *   <li>{@link io.nosqlbench.serialog.sinks.NoopOutputSink}: discards everything</li>
 * </ul>
 *
 * @since 1.0.0
 */
package io.nosqlbench.serialog.sinks;
