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

import it.unimi.dsi.fastutil.shorts.ShortOpenHashSet;
import it.unimi.dsi.fastutil.shorts.ShortSet;
import java.util.UUID;

/**
 * Named set of error codes. A full error code keeps the group code in the upper 16 bits and the error code in the lower 16 bits.
 */
public class ErrorGroup {
    /** Prefix of the printed error code. */
    public static final String ERR_PREFIX = "TDI";

    private final String groupName;

    private final short groupCode;

    private final ShortSet codes = new ShortOpenHashSet();

    ErrorGroup(String groupName, short groupCode) {
        this.groupName = groupName;
        this.groupCode = groupCode;
    }

    /** Returns the group name. */
    public String name() {
        return groupName;
    }

    /** Returns the group code. */
    public short groupCode() {
        return groupCode;
    }

    /**
     * Registers an error code in the group.
     *
     * @param errorCode Error code, unique within the group.
     * @return Full error code.
     * @throws IllegalArgumentException If the code is already registered.
     */
    public int registerErrorCode(short errorCode) {
        if (!codes.add(errorCode)) {
            throw new IllegalArgumentException("Error code already registered [errorCode=" + errorCode + ", group=" + groupName + ']');
        }

        return (groupCode << 16) | (errorCode & 0xFFFF);
    }

    /**
     * Returns the error part of a full error code.
     *
     * @param code Full error code.
     * @return Error code.
     */
    public static short extractErrorCode(int code) {
        return (short) (code & 0xFFFF);
    }

    /**
     * Renders a message as {@code TDI-<GROUP>-<code> <message> TraceId:<first 8 chars>}.
     */
    static String errorMessage(UUID traceId, String groupName, int code, String message) {
        return ERR_PREFIX + '-' + groupName + '-' + Short.toUnsignedInt(extractErrorCode(code))
                + ((message != null && !message.isEmpty()) ? ' ' + message : "") + " TraceId:" + traceId.toString().substring(0, 8);
    }

    @Override
    public String toString() {
        return "ErrorGroup [name=" + groupName + ", groupCode=" + groupCode + ']';
    }
}
