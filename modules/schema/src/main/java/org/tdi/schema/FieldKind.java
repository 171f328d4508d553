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

package org.tdi.schema;

/**
 * Kind of a table data field. The kind defines which accessor of a record may be used to read and write the field.
 */
public enum FieldKind {
    /** Unsigned integer of a declared width from 1 to 64 bits. Accessible both as {@code long} and as network order bytes. */
    UINT64(0, true),

    /** Opaque network order byte array of a declared width in bits. */
    BYTES(0, true),

    /** List of unsigned 32-bit ids. */
    INT_LIST(0, false),

    /** List of booleans. */
    BOOL_LIST(0, false),

    /** List of strings. */
    STRING_LIST(0, false),

    /** List of unsigned 64-bit values. */
    UINT64_LIST(0, false),

    /** Single precision floating point value. */
    FLOAT(Float.SIZE, false),

    /** Boolean value. */
    BOOL(1, false),

    /** String value. */
    STRING(0, false),

    /** Ordered list of nested records of a child schema. */
    CONTAINER(0, false);

    private final int fixedWidth;

    private final boolean widthDeclared;

    FieldKind(int fixedWidth, boolean widthDeclared) {
        this.fixedWidth = fixedWidth;
        this.widthDeclared = widthDeclared;
    }

    /**
     * Returns the width in bits implied by the kind itself, {@code 0} if the kind has no fixed width.
     *
     * @return Width in bits.
     */
    public int fixedWidth() {
        return fixedWidth;
    }

    /**
     * Returns {@code true} if the width of a field of this kind is declared by the field.
     *
     * @return Whether the width is declared per field.
     */
    public boolean widthDeclared() {
        return widthDeclared;
    }

    /**
     * Returns {@code true} for list kinds.
     *
     * @return Whether the kind is a list.
     */
    public boolean isList() {
        return this == INT_LIST || this == BOOL_LIST || this == STRING_LIST || this == UINT64_LIST;
    }
}
