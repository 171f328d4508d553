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

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Contains constants for all system properties and environmental variables in TDI. These properties and variables can be used to affect
 * the behavior of TDI.
 */
public final class TdiSystemProperties {
    /**
     * Name of the property controlling how field values are printed by {@code toString()} and log messages. Accepted values are the
     * names of {@link org.tdi.internal.tostring.SensitiveDataLoggingPolicy} constants in any case.
     */
    public static final String TDI_SENSITIVE_DATA_LOGGING = "TDI_SENSITIVE_DATA_LOGGING";

    /**
     * Enforces singleton.
     */
    private TdiSystemProperties() {
        // No-op.
    }

    /**
     * Gets either system property or environment variable with given name and convert to enum of given class. The value is
     * matched against constant names ignoring case.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @param <E>  Enum type.
     * @return Enum value or the given default.
     */
    public static <E extends Enum<E>> E getEnum(String name, E dflt) {
        String val = getString(name);

        if (val == null) {
            return dflt;
        }

        try {
            return Enum.valueOf(dflt.getDeclaringClass(), val.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignore) {
            return dflt;
        }
    }

    /**
     * Gets either system property or environment variable with given name.
     *
     * @param name Name of the system property or environment variable.
     * @return Value of the system property or environment variable. Returns {@code null} if neither can be found for given name.
     */
    @Nullable
    private static String getString(String name) {
        assert name != null;

        String v = System.getProperty(name);

        if (v == null) {
            v = System.getenv(name);
        }

        return v;
    }
}
