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

/**
 * A sink that discards every message. Useful for switching output off without
 * touching the code that appends to the log, and for measuring the scheduling cost on
 * its own.
 *
 * @since 1.0.0
 */
public class NoopOutputSink implements OutputSink {

    private static final NoopOutputSink INSTANCE = new NoopOutputSink();

    private NoopOutputSink() {
    }

    public static NoopOutputSink getInstance() {
        return INSTANCE;
    }

    @Override
    public void write(String text) {
    }
}
