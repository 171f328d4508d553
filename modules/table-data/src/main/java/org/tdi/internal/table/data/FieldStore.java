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

package org.tdi.internal.table.data;

import static org.tdi.lang.ErrorGroups.TableData.INACTIVE_FIELD_ERR;
import static org.tdi.lang.ErrorGroups.TableData.NOT_SET_ERR;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;
import org.tdi.schema.FieldInfo;
import org.tdi.schema.TableDataSchema;
import org.tdi.table.FieldValue;

/**
 * Values of a record by field id, together with the allocated and active field sets.
 *
 * <p>The store validates field lookups but not values: callers convert and check a value before handing it to {@link #put}. Values
 * removed from the store are returned to the caller, which is responsible for releasing nested records they hold.
 */
class FieldStore {
    private final TableDataSchema schema;

    private final IntSet allocated;

    private final IntSet active;

    /** Sorted by field id to keep {@code toString()} stable. */
    private final Int2ObjectMap<FieldValue> values = new Int2ObjectRBTreeMap<>();

    /** Store of the record holding this one in a container field. */
    @Nullable
    private FieldStore parent;

    FieldStore(TableDataSchema schema, IntSet allocated) {
        this.schema = schema;
        this.allocated = IntSets.unmodifiable(new IntOpenHashSet(allocated));
        this.active = new IntOpenHashSet(allocated);
    }

    TableDataSchema schema() {
        return schema;
    }

    IntSet allocated() {
        return allocated;
    }

    /**
     * Resolves a field that is about to be written.
     *
     * @param fieldId Field id.
     * @return Field entry.
     * @throws FieldNotFoundException If the field is not in the schema.
     * @throws TableDataException With {@code INACTIVE_FIELD_ERR} if the field is not allocated.
     */
    FieldInfo writableField(int fieldId) {
        FieldInfo field = schema.field(fieldId);

        if (!allocated.contains(fieldId)) {
            throw inactive(fieldId, "Field is not allocated");
        }

        return field;
    }

    /**
     * Resolves a field that is about to be read.
     *
     * @param fieldId Field id.
     * @return Field entry.
     * @throws FieldNotFoundException If the field is not in the schema.
     * @throws TableDataException With {@code INACTIVE_FIELD_ERR} if the field is not active.
     */
    FieldInfo readableField(int fieldId) {
        FieldInfo field = schema.field(fieldId);

        if (!active.contains(fieldId)) {
            throw inactive(fieldId, allocated.contains(fieldId)
                    ? "Field has been deactivated by a oneof sibling"
                    : "Field is not allocated");
        }

        return field;
    }

    boolean isActive(int fieldId) {
        if (!schema.hasField(fieldId)) {
            throw new FieldNotFoundException(schema.name(), fieldId);
        }

        return active.contains(fieldId);
    }

    /**
     * Stores a value and marks the field active.
     *
     * @return Replaced value, {@code null} if the field has not been set.
     */
    @Nullable
    FieldValue put(int fieldId, FieldValue value) {
        assert allocated.contains(fieldId) : fieldId;

        active.add(fieldId);

        return values.put(fieldId, value);
    }

    FieldValue get(int fieldId) {
        FieldValue value = values.get(fieldId);

        if (value == null) {
            throw new TableDataException(NOT_SET_ERR, "Field has not been set [schema=" + schema.name() + ", fieldId=" + fieldId + ']');
        }

        return value;
    }

    /**
     * Marks a field inactive and drops its value.
     *
     * @return Dropped value, {@code null} if the field has not been set.
     */
    @Nullable
    FieldValue deactivate(int fieldId) {
        active.remove(fieldId);

        return values.remove(fieldId);
    }

    /**
     * Drops every value and restores the allocated fields as active.
     *
     * @return Dropped values.
     */
    List<FieldValue> clear() {
        List<FieldValue> removed = new ArrayList<>(values.values());

        values.clear();
        active.clear();
        active.addAll(allocated);

        return removed;
    }

    Int2ObjectMap<FieldValue> values() {
        return values;
    }

    IntSet active() {
        return active;
    }

    @Nullable
    FieldStore parent() {
        return parent;
    }

    void parent(@Nullable FieldStore parent) {
        this.parent = parent;
    }

    private TableDataException inactive(int fieldId, String reason) {
        return new TableDataException(INACTIVE_FIELD_ERR, reason + " [schema=" + schema.name() + ", fieldId=" + fieldId + ']');
    }
}
