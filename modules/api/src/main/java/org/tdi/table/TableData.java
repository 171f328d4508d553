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

import java.util.Collection;
import java.util.List;
import java.util.OptionalInt;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;
import org.tdi.schema.TableDataSchema;

/**
 * Typed record of field values exchanged with a lookup table or produced by a learn event. Fields are addressed by numeric id; their
 * kinds and widths come from the {@link TableDataSchema} the record was allocated for.
 *
 * <p>A record tracks two field sets. The allocated set is fixed at allocation and defines which fields may be written. The active set
 * starts equal to the allocated set and shrinks when a member of a oneof group is written: its siblings become inactive and lose
 * their values. Reads are allowed only for active fields.
 *
 * <p>Every operation validates in the following order, and the first failing check defines the error code of the thrown
 * {@link TableDataException}:
 * <ol>
 *     <li>the handle is still usable ({@code RECORD_RELEASED_ERR});</li>
 *     <li>the field exists in the schema ({@code UNKNOWN_FIELD_ERR}, thrown as {@link FieldNotFoundException});</li>
 *     <li>the field is allocated or active ({@code INACTIVE_FIELD_ERR});</li>
 *     <li>the accessor matches the field kind ({@code TYPE_MISMATCH_ERR});</li>
 *     <li>the byte size matches the width ({@code SIZE_MISMATCH_ERR});</li>
 *     <li>the value fits the width ({@code VALUE_OUT_OF_RANGE_ERR}).</li>
 * </ol>
 * A failed operation leaves the record unchanged, with the single exception of {@link #setContainer(int, List)}, which consumes the
 * supplied records either way.
 *
 * <p>Records are not thread safe.
 */
public interface TableData extends AutoCloseable {
    /**
     * Returns the schema of the record.
     *
     * @return Schema.
     */
    TableDataSchema schema();

    /**
     * Sets a field. A {@link org.tdi.schema.FieldKind#UINT64} field accepts both unsigned integer and byte array values, a
     * {@link org.tdi.schema.FieldKind#BYTES} field accepts only byte arrays, every other field accepts values of its own kind.
     *
     * <p>Setting a member of a oneof group deactivates the other members of the group.
     *
     * @param fieldId Field id.
     * @param value Value.
     * @throws TableDataException If the value is rejected.
     */
    void setValue(int fieldId, FieldValue value);

    /**
     * Gets a field. An unsigned integer field is returned as a {@link org.tdi.schema.FieldKind#UINT64} value.
     *
     * @param fieldId Field id.
     * @return Value.
     * @throws TableDataException If the field cannot be read, with {@code NOT_SET_ERR} if it has never been written.
     */
    FieldValue getValue(int fieldId);

    /**
     * Sets an unsigned integer field.
     *
     * @param fieldId Field id.
     * @param value Unsigned value, must fit the field width.
     */
    default void setLong(int fieldId, long value) {
        setValue(fieldId, FieldValue.ofLong(value));
    }

    /**
     * Gets an unsigned integer field.
     *
     * @param fieldId Field id.
     * @return Unsigned value.
     */
    default long longValue(int fieldId) {
        return getValue(fieldId).longValue();
    }

    /**
     * Sets an unsigned integer or byte array field from network order bytes.
     *
     * @param fieldId Field id.
     * @param buf Buffer.
     * @param size Number of bytes to take from the buffer, must be the byte-padded field width.
     */
    default void setBytes(int fieldId, byte[] buf, int size) {
        setValue(fieldId, FieldValue.ofBytes(buf, size));
    }

    /**
     * Copies an unsigned integer or byte array field into a caller buffer in network order.
     *
     * @param fieldId Field id.
     * @param size Requested size, must be the byte-padded field width.
     * @param dst Destination buffer of at least {@code size} bytes.
     * @return The destination buffer.
     */
    byte[] bytesValue(int fieldId, int size, byte[] dst);

    /**
     * Gets an unsigned integer or byte array field in network order.
     *
     * @param fieldId Field id.
     * @param size Requested size, must be the byte-padded field width.
     * @return New array of {@code size} bytes.
     */
    default byte[] bytesValue(int fieldId, int size) {
        return bytesValue(fieldId, size, new byte[Math.max(size, 0)]);
    }

    default void setIntList(int fieldId, List<Integer> value) {
        setValue(fieldId, FieldValue.ofIntList(value));
    }

    default List<Integer> intListValue(int fieldId) {
        return getValue(fieldId).intListValue();
    }

    default void setBooleanList(int fieldId, List<Boolean> value) {
        setValue(fieldId, FieldValue.ofBooleanList(value));
    }

    default List<Boolean> booleanListValue(int fieldId) {
        return getValue(fieldId).booleanListValue();
    }

    default void setStringList(int fieldId, List<String> value) {
        setValue(fieldId, FieldValue.ofStringList(value));
    }

    default List<String> stringListValue(int fieldId) {
        return getValue(fieldId).stringListValue();
    }

    default void setLongList(int fieldId, List<Long> value) {
        setValue(fieldId, FieldValue.ofLongList(value));
    }

    default List<Long> longListValue(int fieldId) {
        return getValue(fieldId).longListValue();
    }

    default void setFloat(int fieldId, float value) {
        setValue(fieldId, FieldValue.ofFloat(value));
    }

    default float floatValue(int fieldId) {
        return getValue(fieldId).floatValue();
    }

    default void setBoolean(int fieldId, boolean value) {
        setValue(fieldId, FieldValue.ofBoolean(value));
    }

    default boolean booleanValue(int fieldId) {
        return getValue(fieldId).booleanValue();
    }

    default void setString(int fieldId, String value) {
        setValue(fieldId, FieldValue.ofString(value));
    }

    default String stringValue(int fieldId) {
        return getValue(fieldId).stringValue();
    }

    /**
     * Hands nested records over to a container field. Previously held records of the field are released.
     *
     * <p>The records must be caller owned handles obtained from {@link #allocateContainer(int)}. On return, successful or not, the
     * supplied handles are no longer usable: on success the parent holds their state, on failure it has been released.
     *
     * @param fieldId Container field id.
     * @param children Records to hand over.
     */
    default void setContainer(int fieldId, List<? extends TableData> children) {
        setValue(fieldId, FieldValue.ofContainer(children));
    }

    /**
     * Returns views of the nested records of a container field. The views remain owned by this record: they may be modified but not
     * closed, and become unusable once this record is released or the field is overwritten.
     *
     * @param fieldId Container field id.
     * @return Unmodifiable list of views.
     */
    default List<TableData> containerValue(int fieldId) {
        return getValue(fieldId).containerValue();
    }

    /**
     * Allocates a caller owned record for a container field with every field of the child schema.
     *
     * @param fieldId Container field id.
     * @return New record.
     * @throws TableDataException With {@code NOT_A_CONTAINER_ERR} if the field is not a container.
     */
    default TableData allocateContainer(int fieldId) {
        return allocateContainer(fieldId, schema().containerChildSchema(fieldId).fieldIds());
    }

    /**
     * Allocates a caller owned record for a container field with a subset of the fields of the child schema.
     *
     * @param fieldId Container field id.
     * @param fieldIds Ids of child schema fields.
     * @return New record.
     * @throws TableDataException With {@code NOT_A_CONTAINER_ERR} if the field is not a container, with {@code UNKNOWN_FIELD_ERR} if an
     *      id is not in the child schema.
     */
    TableData allocateContainer(int fieldId, Collection<Integer> fieldIds);

    /**
     * Checks whether a field is currently active.
     *
     * @param fieldId Field id.
     * @return {@code true} if the field is active.
     * @throws FieldNotFoundException If the field is not in the schema.
     */
    boolean isActive(int fieldId);

    /**
     * Returns the action the record has been allocated for.
     *
     * @return Action id, empty for an allocation without an action.
     */
    OptionalInt actionId();

    /**
     * Returns the table the record has been allocated by.
     *
     * @return Owning table.
     * @throws TableDataException With {@code NO_PARENT_ERR} if the record does not belong to a table.
     */
    Table parentTable();

    /**
     * Returns the learn the record has been allocated by.
     *
     * @return Owning learn.
     * @throws TableDataException With {@code NO_PARENT_ERR} if the record does not belong to a learn.
     */
    Learn parentLearn();

    /**
     * Releases the record and every nested record it holds. Does nothing for a handle that has already been released or handed over
     * to a parent.
     *
     * @throws TableDataException With {@code OWNERSHIP_ERR} for a view obtained from {@link #containerValue(int)}.
     */
    @Override
    void close();
}
