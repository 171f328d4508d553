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

package org.tdi.table;

import static org.tdi.lang.ErrorGroups.TableData.SIZE_MISMATCH_ERR;
import static org.tdi.lang.ErrorGroups.TableData.TYPE_MISMATCH_ERR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.tdi.internal.tostring.S;
import org.tdi.internal.util.ByteUtils;
import org.tdi.lang.TableDataException;
import org.tdi.schema.FieldKind;

/**
 * Value of a single table data field tagged with its kind.
 *
 * <p>A {@link FieldKind#UINT64} value carries an unsigned {@code long}, a {@link FieldKind#BYTES} value carries network order bytes.
 * Both are accepted by an unsigned integer field; see {@link TableData#setValue(int, FieldValue)}.
 *
 * <p>Values are immutable: arrays are copied on the way in and out, lists are unmodifiable.
 */
public final class FieldValue {
    private final FieldKind kind;

    private final Object value;

    private FieldValue(FieldKind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Creates an unsigned integer value.
     *
     * @param value Unsigned value.
     * @return Field value.
     */
    public static FieldValue ofLong(long value) {
        return new FieldValue(FieldKind.UINT64, value);
    }

    /**
     * Creates a byte array value from the first {@code size} bytes of a buffer.
     *
     * @param buf Buffer.
     * @param size Number of meaningful bytes.
     * @return Field value.
     * @throws TableDataException With {@code SIZE_MISMATCH_ERR} if the buffer is shorter than {@code size} or {@code size} is negative.
     */
    public static FieldValue ofBytes(byte[] buf, int size) {
        Objects.requireNonNull(buf, "buf");

        if (size < 0 || size > buf.length) {
            throw new TableDataException(SIZE_MISMATCH_ERR, "Invalid buffer size [size=" + size + ", bufferLength=" + buf.length + ']');
        }

        return new FieldValue(FieldKind.BYTES, Arrays.copyOf(buf, size));
    }

    /**
     * Creates a byte array value.
     *
     * @param bytes Bytes.
     * @return Field value.
     */
    public static FieldValue ofBytes(byte[] bytes) {
        return ofBytes(bytes, bytes.length);
    }

    /**
     * Creates a list of unsigned 32-bit ids.
     *
     * @param value Ids.
     * @return Field value.
     */
    public static FieldValue ofIntList(List<Integer> value) {
        return new FieldValue(FieldKind.INT_LIST, List.copyOf(value));
    }

    /**
     * Creates a list of booleans.
     *
     * @param value Booleans.
     * @return Field value.
     */
    public static FieldValue ofBooleanList(List<Boolean> value) {
        return new FieldValue(FieldKind.BOOL_LIST, List.copyOf(value));
    }

    /**
     * Creates a list of strings.
     *
     * @param value Strings.
     * @return Field value.
     */
    public static FieldValue ofStringList(List<String> value) {
        return new FieldValue(FieldKind.STRING_LIST, List.copyOf(value));
    }

    /**
     * Creates a list of unsigned 64-bit values.
     *
     * @param value Values.
     * @return Field value.
     */
    public static FieldValue ofLongList(List<Long> value) {
        return new FieldValue(FieldKind.UINT64_LIST, List.copyOf(value));
    }

    /**
     * Creates a floating point value.
     *
     * @param value Value.
     * @return Field value.
     */
    public static FieldValue ofFloat(float value) {
        return new FieldValue(FieldKind.FLOAT, value);
    }

    /**
     * Creates a boolean value.
     *
     * @param value Value.
     * @return Field value.
     */
    public static FieldValue ofBoolean(boolean value) {
        return new FieldValue(FieldKind.BOOL, value);
    }

    /**
     * Creates a string value.
     *
     * @param value Value.
     * @return Field value.
     */
    public static FieldValue ofString(String value) {
        return new FieldValue(FieldKind.STRING, Objects.requireNonNull(value, "value"));
    }

    /**
     * Creates a container value. Setting it transfers the records to the parent, see {@link TableData#setContainer(int, List)}.
     * Null elements are kept: the receiving record rejects them and still consumes the other records.
     *
     * @param children Nested records.
     * @return Field value.
     */
    public static FieldValue ofContainer(List<? extends TableData> children) {
        return new FieldValue(FieldKind.CONTAINER, Collections.unmodifiableList(new ArrayList<>(children)));
    }

    /**
     * Returns the kind of the value.
     *
     * @return Kind.
     */
    public FieldKind kind() {
        return kind;
    }

    /** Returns the unsigned integer value. */
    public long longValue() {
        return (Long) valueOf(FieldKind.UINT64);
    }

    /** Returns a copy of the bytes. */
    public byte[] bytesValue() {
        return ((byte[]) valueOf(FieldKind.BYTES)).clone();
    }

    /** Returns the list of unsigned 32-bit ids. */
    @SuppressWarnings("unchecked")
    public List<Integer> intListValue() {
        return (List<Integer>) valueOf(FieldKind.INT_LIST);
    }

    /** Returns the list of booleans. */
    @SuppressWarnings("unchecked")
    public List<Boolean> booleanListValue() {
        return (List<Boolean>) valueOf(FieldKind.BOOL_LIST);
    }

    /** Returns the list of strings. */
    @SuppressWarnings("unchecked")
    public List<String> stringListValue() {
        return (List<String>) valueOf(FieldKind.STRING_LIST);
    }

    /** Returns the list of unsigned 64-bit values. */
    @SuppressWarnings("unchecked")
    public List<Long> longListValue() {
        return (List<Long>) valueOf(FieldKind.UINT64_LIST);
    }

    /** Returns the floating point value. */
    public float floatValue() {
        return (Float) valueOf(FieldKind.FLOAT);
    }

    /** Returns the boolean value. */
    public boolean booleanValue() {
        return (Boolean) valueOf(FieldKind.BOOL);
    }

    /** Returns the string value. */
    public String stringValue() {
        return (String) valueOf(FieldKind.STRING);
    }

    /** Returns the nested records. */
    @SuppressWarnings("unchecked")
    public List<TableData> containerValue() {
        return (List<TableData>) valueOf(FieldKind.CONTAINER);
    }

    private Object valueOf(FieldKind expected) {
        if (kind != expected) {
            throw new TableDataException(TYPE_MISMATCH_ERR, "Value kind mismatch [expected=" + expected + ", actual=" + kind + ']');
        }

        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldValue that = (FieldValue) o;
        if (kind != that.kind) {
            return false;
        }
        return kind == FieldKind.BYTES ? Arrays.equals((byte[]) value, (byte[]) that.value) : value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + (kind == FieldKind.BYTES ? Arrays.hashCode((byte[]) value) : value.hashCode());
    }

    @Override
    public String toString() {
        String str;

        if (kind == FieldKind.BYTES) {
            str = S.sensitive("0x" + ByteUtils.toHexString((byte[]) value), Arrays.hashCode((byte[]) value));
        } else if (kind == FieldKind.UINT64) {
            str = S.sensitive(Long.toUnsignedString((Long) value), value.hashCode());
        } else if (kind == FieldKind.CONTAINER) {
            str = value.toString();
        } else {
            str = S.sensitive(value);
        }

        return kind + ":" + str;
    }
}
