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


package org.tdi.internal.logger;

/**
 * Logger facade over {@link System.Logger}. Messages are patterns with {@code {}} anchors, formatted by
 * {@link org.tdi.internal.lang.TdiStringFormatter} only when the level is enabled.
 */
public interface TdiLogger {
    /**
     * Logs at {@code INFO}.
     *
     * @param msg Message pattern.
     * @param params Anchor values.
     */
    void info(String msg, Object... params);

    /**
     * Logs at {@code DEBUG}.
     *
     * @param msg Message pattern.
     * @param params Anchor values.
     */
    void debug(String msg, Object... params);

    /**
     * Logs at {@code TRACE}.
     *
     * @param msg Message pattern.
     * @param params Anchor values.
     */
    void trace(String msg, Object... params);

    /** Checks whether {@code TRACE} messages are logged, to guard messages with costly arguments. */
    boolean isTraceEnabled();
}
