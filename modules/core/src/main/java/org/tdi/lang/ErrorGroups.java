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

import it.unimi.dsi.fastutil.shorts.Short2ObjectMap;
import it.unimi.dsi.fastutil.shorts.Short2ObjectOpenHashMap;
import java.util.Locale;

/**
 * Error groups of TDI and the codes registered in them. A group is registered when its holder class is loaded, which happens on the
 * first access to any of its codes.
 */
@SuppressWarnings("PublicInnerClass")
public class ErrorGroups {
    /** Registered groups by group code. */
    private static final Short2ObjectMap<ErrorGroup> registeredGroups = new Short2ObjectOpenHashMap<>();

    /**
     * Registers a group.
     *
     * @param groupName Group name, stored upper-cased.
     * @param groupCode Group code.
     * @return New error group.
     * @throws IllegalArgumentException If the name is empty, or the name or the code is taken.
     */
    public static synchronized ErrorGroup registerGroup(String groupName, short groupCode) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("Group name is null or empty");
        }

        String grpName = groupName.toUpperCase(Locale.ENGLISH);

        ErrorGroup existing = registeredGroups.get(groupCode);

        if (existing == null) {
            for (ErrorGroup group : registeredGroups.values()) {
                if (group.name().equals(grpName)) {
                    existing = group;

                    break;
                }
            }
        }

        if (existing != null) {
            throw new IllegalArgumentException("Error group already registered [groupName=" + grpName + ", groupCode=" + groupCode
                    + ", registeredGroup=" + existing + ']');
        }

        ErrorGroup newGroup = new ErrorGroup(grpName, groupCode);

        registeredGroups.put(groupCode, newGroup);

        return newGroup;
    }

    /**
     * Returns the group part of a full error code.
     *
     * @param code Full error code.
     * @return Group code.
     */
    public static short extractGroupCode(int code) {
        return (short) (code >>> 16);
    }

    /**
     * Returns the group a full error code belongs to.
     *
     * @param code Full error code.
     * @return Error group.
     */
    public static synchronized ErrorGroup errorGroupByCode(int code) {
        ErrorGroup grp = registeredGroups.get(extractGroupCode(code));
        assert grp != null : "group not found, code=" + code;
        return grp;
    }

    /** Errors of table data operations. */
    public static class TableData {
        /** Table data error group. */
        public static final ErrorGroup TABLE_DATA_ERR_GROUP = registerGroup("TDATA", (short) 2);

        /** Field id is not present in the schema. */
        public static final int UNKNOWN_FIELD_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 1);

        /** Field id is valid in the schema but is not active for the record. */
        public static final int INACTIVE_FIELD_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 2);

        /** Accessor kind does not match the declared kind of the field. */
        public static final int TYPE_MISMATCH_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 3);

        /** Value does not fit into the declared bit width of the field. */
        public static final int VALUE_OUT_OF_RANGE_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 4);

        /** Byte buffer size is not equal to the byte-padded width of the field. */
        public static final int SIZE_MISMATCH_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 5);

        /** Container operation has been invoked on a non-container field. */
        public static final int NOT_A_CONTAINER_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 6);

        /** Field has never been written. */
        public static final int NOT_SET_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 7);

        /** Requested parent kind is not associated with the record. */
        public static final int NO_PARENT_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 8);

        /** Record handle has been released or moved into a parent record. */
        public static final int RECORD_RELEASED_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 9);

        /** Operation violates record ownership (releasing a borrowed view, transferring a record twice). */
        public static final int OWNERSHIP_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 10);

        /** Action id is not present in the schema. */
        public static final int UNKNOWN_ACTION_ERR = TABLE_DATA_ERR_GROUP.registerErrorCode((short) 11);
    }

    /** Schema error group. */
    public static class Schema {
        /** Schema error group. */
        public static final ErrorGroup SCHEMA_ERR_GROUP = registerGroup("SCHEMA", (short) 3);

        /** Schema definition is incorrect. */
        public static final int SCHEMA_DEFINITION_ERR = SCHEMA_ERR_GROUP.registerErrorCode((short) 1);
    }
}
