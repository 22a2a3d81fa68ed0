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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Forwards each flushed message to a Log4j 2 {@link Logger} as one log event, so that
 * output assembled by a {@link io.nosqlbench.serialog.SerialLog} ends up in whatever
 * appenders the application already has configured.
 *
 * <pre>{@code
 * try (SerialLog log = SerialLog.builder()
 *         .withSink(new LoggerSink("app.progress", Level.INFO))
 *         .build()) {
 *     log.append("loaded ").append(count).append(" rows").endLine();
 * }
 * }</pre>
 *
 * <p>A single trailing line terminator is removed from the message, since layouts
 * normally add their own.</p>
 *
 * @since 1.0.0
 */
public class LoggerSink implements OutputSink {

    private final Logger logger;
    private final Level level;

    public LoggerSink() {
        this(LogManager.getLogger(LoggerSink.class));
    }

    public LoggerSink(Logger logger) {
        this(logger, Level.INFO);
    }

    public LoggerSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
    }

    public LoggerSink(String loggerName) {
        this(LogManager.getLogger(loggerName));
    }

    public LoggerSink(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public void write(String text) {
        if (logger.isEnabled(level)) {
            logger.log(level, stripLineEnd(text));
        }
    }

    static String stripLineEnd(String text) {
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        if (text.endsWith("\n")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }
}
