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

import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.OptionalInt;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;

/**
 * Runtime description of the fields a table data record may carry. Provides the declared kind, width, oneof membership and nested
 * schema of every field, addressed by numeric field id.
 *
 * <p>A schema is immutable and may be shared between any number of records and threads.
 */
public interface TableDataSchema {
    /**
     * Creates a builder of an in-memory schema.
     *
     * @param name Schema name.
     * @return Builder.
     */
    static TableDataSchemaBuilder builder(String name) {
        return new TableDataSchemaBuilder(name);
    }

    /**
     * Returns the schema name.
     *
     * @return Schema name.
     */
    String name();

    /**
     * Returns ids of all fields of the schema, including action scoped ones.
     *
     * @return Unmodifiable set of field ids.
     */
    IntSet fieldIds();

    /**
     * Returns ids of the fields that are not scoped to any action.
     *
     * @return Unmodifiable set of field ids.
     */
    IntSet commonFieldIds();

    /**
     * Returns ids of the fields available to an allocation for the given action: the common fields and the fields of the action.
     *
     * @param actionId Action id.
     * @return Unmodifiable set of field ids.
     * @throws TableDataException With {@code UNKNOWN_ACTION_ERR} if the action is not defined.
     */
    IntSet fieldIds(int actionId);

    /**
     * Returns ids of all actions of the schema.
     *
     * @return Unmodifiable set of action ids.
     */
    IntSet actionIds();

    /**
     * Checks whether an action is defined.
     *
     * @param actionId Action id.
     * @return {@code true} if the action exists.
     */
    boolean hasAction(int actionId);

    /**
     * Checks whether a field is defined.
     *
     * @param fieldId Field id.
     * @return {@code true} if the field exists.
     */
    boolean hasField(int fieldId);

    /**
     * Returns the entry of a field.
     *
     * @param fieldId Field id.
     * @return Field entry.
     * @throws FieldNotFoundException If the field is not defined.
     */
    FieldInfo field(int fieldId);

    /**
     * Resolves a field id by its name.
     *
     * @param name Field name.
     * @return Field id.
     * @throws FieldNotFoundException If the field is not defined.
     */
    int fieldId(String name);

    /**
     * Returns the kind of a field.
     *
     * @param fieldId Field id.
     * @return Field kind.
     * @throws FieldNotFoundException If the field is not defined.
     */
    default FieldKind fieldKind(int fieldId) {
        return field(fieldId).kind();
    }

    /**
     * Returns the width in bits of a field.
     *
     * @param fieldId Field id.
     * @return Width in bits, {@code 0} for kinds without a width.
     * @throws FieldNotFoundException If the field is not defined.
     */
    default int fieldBitWidth(int fieldId) {
        return field(fieldId).bitWidth();
    }

    /**
     * Returns the oneof group of a field.
     *
     * @param fieldId Field id.
     * @return Group id, empty if the field does not belong to a oneof group.
     * @throws FieldNotFoundException If the field is not defined.
     */
    default OptionalInt fieldOneofGroup(int fieldId) {
        Integer group = field(fieldId).oneofGroup();

        return group == null ? OptionalInt.empty() : OptionalInt.of(group);
    }

    /**
     * Returns ids of the members of a oneof group.
     *
     * @param groupId Group id.
     * @return Unmodifiable set of field ids, empty if the group is not defined.
     */
    IntSet oneofGroupMembers(int groupId);

    /**
     * Returns the schema of nested records of a container field.
     *
     * @param fieldId Field id.
     * @return Child schema.
     * @throws FieldNotFoundException If the field is not defined.
     * @throws TableDataException With {@code NOT_A_CONTAINER_ERR} if the field is not a container.
     */
    TableDataSchema containerChildSchema(int fieldId);
}
