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

package io.nosqlbench.serialog;

import io.nosqlbench.serialog.sinks.OutputSink;

import java.util.Locale;

/**
 * How a {@link SerialLog} reacts when {@link OutputSink#write(String)} fails. Under both
 * policies the consumer keeps running, the text of the failed write is discarded, and
 * the failure is logged and counted in {@link SerialLogStats#getSinkFailures()}. They
 * differ only in what {@link SerialLog#close()} does afterwards.
 *
 * @since 1.0.0
 */
public enum SinkFailurePolicy {
    /**
     * Failures are only logged and counted.
     */
    LOG_AND_DROP("log"),

    /**
     * {@link SerialLog#close()} throws {@link SinkWriteException} carrying the first
     * failure, with any later ones attached as suppressed exceptions.
     */
    FAIL_ON_CLOSE("fail");

    private final String propertyValue;

    SinkFailurePolicy(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a policy name, case-insensitive and trimmed.
     *
     * <ul>
     *   <li><strong>LOG_AND_DROP:</strong> "log", "drop", "log_and_drop", "" (empty string)</li>
     *   <li><strong>FAIL_ON_CLOSE:</strong> "fail", "fail_on_close", "propagate"</li>
     * </ul>
     *
     * @param value the string value to parse (may be null)
     * @return the corresponding policy, or null if the input is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static SinkFailurePolicy fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "log":
            case "drop":
            case "log_and_drop":
            case "":
                return LOG_AND_DROP;
            case "fail":
            case "fail_on_close":
            case "propagate":
                return FAIL_ON_CLOSE;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized sink failure policy '" + value + "'. Expected one of: log, fail.");
        }
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
