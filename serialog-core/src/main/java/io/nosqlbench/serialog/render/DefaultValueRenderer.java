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

package io.nosqlbench.serialog.render;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The renderer used when none is configured.
 *
 * <table>
 *   <caption>Rendering rules</caption>
 *   <tr><th>Value</th><th>Rendered as</th></tr>
 *   <tr><td>{@code null}</td><td>{@code "null"}</td></tr>
 *   <tr><td>{@link CharSequence}, {@link Character}</td><td>verbatim</td></tr>
 *   <tr><td>arrays</td><td>{@link Arrays#deepToString} / {@code Arrays.toString}</td></tr>
 *   <tr><td>{@link Throwable}</td><td>its stack trace</td></tr>
 *   <tr><td>{@link Supplier}</td><td>the supplied value, evaluated on the consumer thread</td></tr>
 *   <tr><td>anything else</td><td>{@link String#valueOf(Object)}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public class DefaultValueRenderer implements ValueRenderer {

    private static final DefaultValueRenderer INSTANCE = new DefaultValueRenderer("\n");

    private final String lineTerminator;

    public DefaultValueRenderer(String lineTerminator) {
        this.lineTerminator = Objects.requireNonNull(lineTerminator, "lineTerminator");
    }

    public static DefaultValueRenderer getInstance() {
        return INSTANCE;
    }

    public String getLineTerminator() {
        return lineTerminator;
    }

    @Override
    public void renderInto(LineBuffer buffer, Object value) {
        if (value == null) {
            buffer.append("null");
        } else if (value instanceof CharSequence) {
            buffer.append((CharSequence) value);
        } else if (value instanceof Character) {
            buffer.append((Character) value);
        } else if (value.getClass().isArray()) {
            buffer.append(renderArray(value));
        } else if (value instanceof Throwable) {
            buffer.append(renderThrowable((Throwable) value));
        } else if (value instanceof Supplier) {
            // a supplier returning itself would recurse forever
            Object supplied = ((Supplier<?>) value).get();
            renderInto(buffer, supplied == value ? String.valueOf(supplied) : supplied);
        } else {
            buffer.append(String.valueOf(value));
        }
    }

    @Override
    public void renderLineEnd(LineBuffer buffer) {
        buffer.append(lineTerminator);
    }

    private static String renderArray(Object array) {
        if (array instanceof Object[]) {
            return Arrays.deepToString((Object[]) array);
        } else if (array instanceof int[]) {
            return Arrays.toString((int[]) array);
        } else if (array instanceof long[]) {
            return Arrays.toString((long[]) array);
        } else if (array instanceof double[]) {
            return Arrays.toString((double[]) array);
        } else if (array instanceof float[]) {
            return Arrays.toString((float[]) array);
        } else if (array instanceof byte[]) {
            return Arrays.toString((byte[]) array);
        } else if (array instanceof short[]) {
            return Arrays.toString((short[]) array);
        } else if (array instanceof char[]) {
            return new String((char[]) array);
        } else if (array instanceof boolean[]) {
            return Arrays.toString((boolean[]) array);
        }
        return String.valueOf(array);
    }

    private static String renderThrowable(Throwable throwable) {
        StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            throwable.printStackTrace(writer);
        }
        return out.toString();
    }
}
