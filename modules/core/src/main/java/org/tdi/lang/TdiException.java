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

import static org.tdi.lang.ErrorGroup.ERR_PREFIX;
import static org.tdi.lang.ErrorGroup.errorMessage;
import static org.tdi.lang.ErrorGroup.extractErrorCode;
import static org.tdi.lang.ErrorGroups.errorGroupByCode;
import static org.tdi.lang.ErrorGroups.extractGroupCode;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of the exceptions thrown by public TDI operations. The error code identifies the failed check, see {@link ErrorGroups}.
 */
public class TdiException extends RuntimeException implements TraceableException {
    private static final long serialVersionUID = 0L;

    private final String groupName;

    private final int code;

    private final UUID traceId;

    /**
     * Creates an exception with a new trace id.
     *
     * @param code Full error code.
     * @param message Detail message.
     */
    public TdiException(int code, String message) {
        this(UUID.randomUUID(), code, message, null);
    }

    /**
     * Creates an exception.
     *
     * @param traceId Trace id.
     * @param code Full error code.
     * @param message Detail message.
     * @param cause Cause, may be {@code null}.
     */
    public TdiException(UUID traceId, int code, @Nullable String message, @Nullable Throwable cause) {
        super(message, cause);

        this.traceId = traceId;
        this.groupName = errorGroupByCode(code).name();
        this.code = code;
    }

    /** Returns the name of the error group. */
    public String groupName() {
        return groupName;
    }

    @Override
    public int code() {
        return code;
    }

    /**
     * Returns the printable form of the code, {@code TDI-<GROUP>-<code>}.
     *
     * @return Printable code.
     */
    public String codeAsString() {
        return ERR_PREFIX + '-' + groupName + '-' + Short.toUnsignedInt(errorCode());
    }

    @Override
    public short groupCode() {
        return extractGroupCode(code);
    }

    @Override
    public short errorCode() {
        return extractErrorCode(code);
    }

    @Override
    public UUID traceId() {
        return traceId;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + errorMessage(traceId, groupName, code, getLocalizedMessage());
    }
}
