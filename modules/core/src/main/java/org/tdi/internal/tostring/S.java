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

package org.tdi.internal.tostring;

import static org.tdi.internal.lang.TdiSystemProperties.TDI_SENSITIVE_DATA_LOGGING;

import java.util.Objects;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.tdi.internal.lang.TdiSystemProperties;

/**
 * Helper for {@code toString()} implementations that print values which may be sensitive.
 */
public final class S {
    /** Placeholder printed instead of a hidden value. */
    public static final String HIDDEN = "***";

    /** Supplier of the current policy, by default reads {@link TdiSystemProperties#TDI_SENSITIVE_DATA_LOGGING}. */
    private static volatile Supplier<SensitiveDataLoggingPolicy> policySupplier = S::policyFromProperties;

    private S() {
    }

    /**
     * Replaces the supplier of the sensitive data logging policy.
     *
     * @param supplier New supplier, {@code null} to restore reading the policy from system properties.
     */
    public static void setSensitiveDataLoggingPolicySupplier(@Nullable Supplier<SensitiveDataLoggingPolicy> supplier) {
        policySupplier = supplier == null ? S::policyFromProperties : supplier;
    }

    /**
     * Returns the sensitive data logging policy in effect.
     *
     * @return Policy.
     */
    public static SensitiveDataLoggingPolicy sensitiveDataLoggingPolicy() {
        return policySupplier.get();
    }

    /**
     * Renders a sensitive value according to the current policy.
     *
     * @param value Value to render.
     * @param valueHash Content hash of the value, used by {@link SensitiveDataLoggingPolicy#HASH}.
     * @return String representation.
     */
    public static String sensitive(@Nullable Object value, int valueHash) {
        switch (sensitiveDataLoggingPolicy()) {
            case PLAIN:
                return String.valueOf(value);

            case HASH:
                return value == null ? "null" : Integer.toHexString(valueHash);

            default:
                return HIDDEN;
        }
    }

    /**
     * Renders a sensitive value according to the current policy using {@link Objects#hashCode(Object)} as the hash.
     *
     * @param value Value to render.
     * @return String representation.
     */
    public static String sensitive(@Nullable Object value) {
        return sensitive(value, Objects.hashCode(value));
    }

    private static SensitiveDataLoggingPolicy policyFromProperties() {
        return TdiSystemProperties.getEnum(TDI_SENSITIVE_DATA_LOGGING, SensitiveDataLoggingPolicy.HASH);
    }
}
