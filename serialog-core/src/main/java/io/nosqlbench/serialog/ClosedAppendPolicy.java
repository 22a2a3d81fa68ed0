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

import java.util.Locale;

/**
 * What {@link SerialLog#append(Object)} does once {@link SerialLog#close()} has been
 * requested. Appending after close is a caller error either way: the consumer has
 * already started its final drain, so the value can never be written.
 *
 * <p>The default can be chosen with the {@value SerialLog#CLOSED_APPEND_PROPERTY}
 * system property when the builder is created through
 * {@link SerialLog.Builder#fromSystemProperties()}.</p>
 *
 * @since 1.0.0
 */
public enum ClosedAppendPolicy {
    /**
     * Throw {@link IllegalStateException} from the append call.
     */
    REJECT("reject"),

    /**
     * Discard the value, count it in {@link SerialLogStats#getRejectedAppends()} and log
     * a warning for the first occurrence.
     */
    DROP("drop");

    private final String propertyValue;

    ClosedAppendPolicy(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a policy name, case-insensitive and trimmed.
     *
     * <ul>
     *   <li><strong>REJECT:</strong> "reject", "throw", "fail", "" (empty string)</li>
     *   <li><strong>DROP:</strong> "drop", "discard", "ignore"</li>
     * </ul>
     *
     * @param value the string value to parse (may be null)
     * @return the corresponding policy, or null if the input is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ClosedAppendPolicy fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "reject":
            case "throw":
            case "fail":
            case "":
                return REJECT;
            case "drop":
            case "discard":
            case "ignore":
                return DROP;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized closed-append policy '" + value + "'. Expected one of: reject, drop.");
        }
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
