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

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes flushed messages to a {@link PrintStream}, by default {@code System.out}.
 *
 * <pre>{@code
 * // console, the default
 * OutputSink console = new PrintStreamSink();
 *
 * // stderr, left open when the log closes
 * OutputSink errors = new PrintStreamSink(System.err);
 *
 * // a stream the sink owns and closes
 * OutputSink file = new PrintStreamSink(new PrintStream(new FileOutputStream("out.log")), true);
 * }</pre>
 *
 * <p>{@link PrintStream} swallows its own I/O errors, so this sink checks
 * {@link PrintStream#checkError()} after each write and reports a failure as an
 * {@link IOException}.</p>
 *
 * @since 1.0.0
 */
public class PrintStreamSink implements OutputSink {

    private final PrintStream output;
    private final boolean ownsStream;

    public PrintStreamSink() {
        this(System.out, false);
    }

    public PrintStreamSink(PrintStream output) {
        this(output, false);
    }

    /**
     * @param output the stream to write to
     * @param ownsStream whether {@link #close()} should close the stream
     */
    public PrintStreamSink(PrintStream output, boolean ownsStream) {
        this.output = Objects.requireNonNull(output, "output");
        this.ownsStream = ownsStream;
    }

    @Override
    public void write(String text) throws IOException {
        output.print(text);
        output.flush();
        if (output.checkError()) {
            throw new IOException("PrintStream reported an error while writing " + text.length() + " chars");
        }
    }

    @Override
    public void close() {
        if (ownsStream) {
            output.close();
        } else {
            output.flush();
        }
    }
}
