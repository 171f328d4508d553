/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.tdi.internal.lang;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats messages according to very simple substitution rules. Substitutions can be made 1, 2 or more arguments.
 *
 * <p>For example,
 * <pre>
 *     TdiStringFormatter.format(&quot;Hi {}.&quot;, &quot;there&quot;);
 * </pre>
 * will return the string "Hi there.".
 *
 * <p>The {} pair is called the <em>formatting anchor</em>. It serves to designate the location where arguments need to be substituted
 * within the message pattern. A backslash placed right before an anchor escapes it, so that "\\{}" is printed as "{}". Anchors without a
 * matching argument are left as is, extra arguments are ignored. Array arguments are printed with {@link Arrays#toString}.
 */
public final class TdiStringFormatter {
    private static final char ESCAPE_CHAR = '\\';

    private static final String ANCHOR = "{}";

    private TdiStringFormatter() {
    }

    /**
     * Substitutes each anchor of the pattern with the corresponding argument.
     *
     * @param messagePattern Message pattern, {@code null} is formatted as {@code null}.
     * @param params Arguments to substitute.
     * @return Formatted message.
     */
    public static @Nullable String format(@Nullable String messagePattern, Object @Nullable ... params) {
        if (messagePattern == null || params == null || params.length == 0) {
            return messagePattern;
        }

        StringBuilder sb = new StringBuilder(messagePattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int anchor = messagePattern.indexOf(ANCHOR, from);

            if (anchor == -1) {
                break;
            }

            if (anchor > 0 && messagePattern.charAt(anchor - 1) == ESCAPE_CHAR) {
                sb.append(messagePattern, from, anchor - 1).append(ANCHOR);

                from = anchor + ANCHOR.length();

                continue;
            }

            sb.append(messagePattern, from, anchor);

            appendParam(sb, params[paramIdx++]);

            from = anchor + ANCHOR.length();
        }

        sb.append(messagePattern, from, messagePattern.length());

        return sb.toString();
    }

    private static void appendParam(StringBuilder sb, @Nullable Object param) {
        if (param == null) {
            sb.append("null");
        } else if (!param.getClass().isArray()) {
            sb.append(param);
        } else if (param instanceof byte[]) {
            sb.append(Arrays.toString((byte[]) param));
        } else if (param instanceof int[]) {
            sb.append(Arrays.toString((int[]) param));
        } else if (param instanceof long[]) {
            sb.append(Arrays.toString((long[]) param));
        } else if (param instanceof boolean[]) {
            sb.append(Arrays.toString((boolean[]) param));
        } else if (param instanceof Object[]) {
            sb.append(Arrays.deepToString((Object[]) param));
        } else {
            sb.append(param);
        }
    }
}
