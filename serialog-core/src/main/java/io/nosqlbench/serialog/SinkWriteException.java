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

/**
 * Thrown by {@link SerialLog#close()} under {@link SinkFailurePolicy#FAIL_ON_CLOSE} when
 * at least one sink write failed during the lifetime of the log. The cause is the
 * first failure; later failures are attached as suppressed exceptions.
 *
 * @since 1.0.0
 */
public class SinkWriteException extends RuntimeException {

    private final long failedWrites;

    public SinkWriteException(String message, Throwable cause, long failedWrites) {
        super(message, cause);
        this.failedWrites = failedWrites;
    }

    public long getFailedWrites() {
        return failedWrites;
    }
}
