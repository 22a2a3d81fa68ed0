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

package io.nosqlbench.serialog.sinks;

import io.nosqlbench.serialog.SerialLog;
import io.nosqlbench.serialog.SinkFailurePolicy;

import java.io.IOException;

/**
 * The destination of flushed messages. A {@link SerialLog} calls {@link #write(String)}
 * from its consumer thread only, once per flushed message, with everything the
 * producer accumulated since its previous flush. Implementations therefore need no
 * synchronization of their own as long as a sink instance is not shared between logs.
 *
 * <p>A write is expected to be synchronous: when it returns, the text has been fully
 * accepted. The consumer holds the log's lock during the write, so while a write is in
 * progress producers calling {@code append} block on that lock. A slow sink therefore
 * slows down the producers as well as the consumer.</p>
 *
 * <h2>Implementation Example</h2>
 * <pre>{@code
 * public class SocketSink implements OutputSink {
 *     private final Writer out;
 *
 *     public SocketSink(Socket socket) throws IOException {
 *         this.out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
 *     }
 *
 *     @Override
 *     public void write(String text) throws IOException {
 *         out.write(text);
 *         out.flush();
 *     }
 *
 *     @Override
 *     public void close() throws IOException {
 *         out.close();
 *     }
 * }
 * }</pre>
 *
 * <h2>Failures</h2>
 * <p>An {@link IOException} (or runtime exception) thrown from {@link #write(String)}
 * is handled according to the log's {@link SinkFailurePolicy}. The text of the failed
 * write is not retried.</p>
 *
 * @see PrintStreamSink
 * @see WriterSink
 * @see LoggerSink
 * @see NoopOutputSink
 * @since 1.0.0
 */
public interface OutputSink extends AutoCloseable {

    /**
     * Writes one flushed message.
     *
     * @param text the complete text of the message, never null
     * @throws IOException if the text could not be written
     */
    void write(String text) throws IOException;

    /**
     * Releases the sink. Called once by {@link SerialLog#close()} after the final
     * write. The default does nothing.
     *
     * @throws IOException if the sink could not be closed cleanly
     */
    @Override
    default void close() throws IOException {
    }
}
