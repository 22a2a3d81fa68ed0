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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SinksTest {

    private static final class CapturingAppender extends AbstractAppender {
        final List<String> messages = new CopyOnWriteArrayList<>();
        final List<Level> levels = new CopyOnWriteArrayList<>();

        CapturingAppender(String name) {
            super(name, null, null, true, null);
        }

        @Override
        public void append(LogEvent event) {
            levels.add(event.getLevel());
            messages.add(event.getMessage().getFormattedMessage());
        }
    }

    @Test
    void printStreamSinkWritesAndKeepsBorrowedStreamOpen() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream stream = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        PrintStreamSink sink = new PrintStreamSink(stream);

        sink.write("one\n");
        sink.write("two\n");
        sink.close();
        stream.print("still open");
        stream.flush();

        assertEquals("one\ntwo\nstill open", bytes.toString(StandardCharsets.UTF_8));
        assertFalse(stream.checkError());
    }

    @Test
    void printStreamSinkReportsStreamErrors() {
        OutputStream failing = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("disk full");
            }
        };
        PrintStreamSink sink = new PrintStreamSink(new PrintStream(failing), true);

        assertThrows(IOException.class, () -> sink.write("lost"));
    }

    @Test
    void writerSinkAppendsToFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("nested").resolve("out.log");
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(file, "existing\n");

        try (WriterSink sink = WriterSink.appendingTo(file)) {
            sink.write("first\n");
            sink.write("second\n");
            assertEquals("existing\nfirst\n", Files.readString(file).substring(0, 15));
        }

        assertEquals("existing\nfirst\nsecond\n", Files.readString(file));
    }

    @Test
    void writerSinkCreatesMissingDirectories(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("a").resolve("b").resolve("c.log");

        try (WriterSink sink = WriterSink.appendingTo(file)) {
            sink.write("x");
        }

        assertEquals("x", Files.readString(file));
    }

    @Test
    void writerSinkFlushesEachWrite() throws IOException {
        StringWriter target = new StringWriter();
        WriterSink sink = new WriterSink(target);

        sink.write("abc");

        assertEquals("abc", target.toString());
    }

    @Test
    void loggerSinkStripsOneLineEnd() {
        assertEquals("a", LoggerSink.stripLineEnd("a\n"));
        assertEquals("a", LoggerSink.stripLineEnd("a\r\n"));
        assertEquals("a\n", LoggerSink.stripLineEnd("a\n\n"));
        assertEquals("a", LoggerSink.stripLineEnd("a"));
        assertEquals("", LoggerSink.stripLineEnd(""));
    }

    @Test
    void loggerSinkForwardsMessagesThroughSerialLog() {
        String loggerName = "serialog.sinks.test";
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration config = context.getConfiguration();
        CapturingAppender appender = new CapturingAppender("capture");
        appender.start();
        config.addAppender(appender);
        LoggerConfig loggerConfig = new LoggerConfig(loggerName, Level.DEBUG, false);
        loggerConfig.addAppender(appender, Level.DEBUG, null);
        config.addLogger(loggerName, loggerConfig);
        context.updateLoggers();

        try {
            try (SerialLog log = SerialLog.builder()
                    .withName("logger-sink")
                    .withSink(new LoggerSink(loggerName, Level.INFO))
                    .build()) {
                log.append("loaded ").append(12).append(" rows").endLine();
            }

            assertEquals(List.of("loaded 12 rows"), appender.messages);
            assertEquals(List.of(Level.INFO), appender.levels);
        } finally {
            config.removeLogger(loggerName);
            context.updateLoggers();
            appender.stop();
        }
    }

    @Test
    void loggerSinkSkipsDisabledLevels() {
        String loggerName = "serialog.sinks.quiet";
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration config = context.getConfiguration();
        CapturingAppender appender = new CapturingAppender("quiet-capture");
        appender.start();
        config.addAppender(appender);
        LoggerConfig loggerConfig = new LoggerConfig(loggerName, Level.WARN, false);
        loggerConfig.addAppender(appender, Level.ALL, null);
        config.addLogger(loggerName, loggerConfig);
        context.updateLoggers();

        try {
            new LoggerSink(loggerName, Level.DEBUG).write("hidden\n");
            new LoggerSink(loggerName, Level.ERROR).write("shown\n");

            assertEquals(List.of("shown"), appender.messages);
        } finally {
            config.removeLogger(loggerName);
            context.updateLoggers();
            appender.stop();
        }
    }

    @Test
    void noopSinkIsSingletonAndSilent() throws IOException {
        NoopOutputSink sink = NoopOutputSink.getInstance();
        assertSame(sink, NoopOutputSink.getInstance());
        sink.write("discarded");
        sink.close();
    }
}
