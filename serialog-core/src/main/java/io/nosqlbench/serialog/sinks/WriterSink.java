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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes flushed messages to a {@link Writer} and flushes it after every message. The
 * writer is closed together with the sink.
 *
 * @since 1.0.0
 */
public class WriterSink implements OutputSink {

    private final Writer writer;

    public WriterSink(Writer writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Opens {@code file} for appending as UTF-8, creating it and its parent directories
     * if needed.
     *
     * @param file the file to append to
     * @return a sink owning the opened writer
     * @throws IOException if the file cannot be opened
     */
    public static WriterSink appendingTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new WriterSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND));
    }

    @Override
    public void write(String text) throws IOException {
        writer.write(text);
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
