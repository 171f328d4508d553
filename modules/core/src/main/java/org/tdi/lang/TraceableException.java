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


package org.tdi.lang;

import java.util.UUID;

/**
 * Exception carrying a full error code and a trace id that ties the exception to its log records.
 */
public interface TraceableException {
    /** Returns the trace id. */
    UUID traceId();

    /** Returns the full error code: group code in the upper 16 bits, error code in the lower 16 bits. */
    int code();

    /** Returns the group part of {@link #code()}. */
    short groupCode();

    /** Returns the error part of {@link #code()}. */
    short errorCode();
}
