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

package org.tdi.internal.schema;

import static org.tdi.lang.ErrorGroups.TableData.NOT_A_CONTAINER_ERR;
import static org.tdi.lang.ErrorGroups.TableData.UNKNOWN_ACTION_ERR;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;
import org.tdi.schema.FieldInfo;
import org.tdi.schema.TableDataSchema;

/**
 * Immutable in-memory schema. Instances are created by {@link org.tdi.schema.TableDataSchemaBuilder}, which verifies the definition.
 */
public class TableDataSchemaImpl implements TableDataSchema {
    private final String name;

    private final Int2ObjectMap<FieldInfo> fields;

    private final Object2IntMap<String> idsByName;

    private final Int2ObjectMap<String> actions;

    private final IntSet fieldIds;

    private final IntSet commonFieldIds;

    /** Action id to the ids of the common fields and the fields of the action. */
    private final Int2ObjectMap<IntSet> actionFieldIds;

    private final Int2ObjectMap<IntSet> oneofGroups;

    /**
     * Constructor.
     *
     * @param name Schema name.
     * @param fields Field entries in definition order.
     * @param actions Action names by action id.
     */
    public TableDataSchemaImpl(String name, Int2ObjectMap<FieldInfo> fields, Int2ObjectMap<String> actions) {
        this.name = name;
        this.fields = new Int2ObjectLinkedOpenHashMap<>(fields);
        this.actions = new Int2ObjectLinkedOpenHashMap<>(actions);

        idsByName = new Object2IntOpenHashMap<>(fields.size());

        IntSet all = new IntLinkedOpenHashSet(fields.size());
        IntSet common = new IntLinkedOpenHashSet();
        Int2ObjectMap<IntSet> groups = new Int2ObjectOpenHashMap<>();

        for (FieldInfo field : fields.values()) {
            idsByName.put(field.name(), field.id());
            all.add(field.id());

            if (field.actionId() == null) {
                common.add(field.id());
            }

            if (field.oneofGroup() != null) {
                groups.computeIfAbsent(field.oneofGroup().intValue(), g -> new IntLinkedOpenHashSet()).add(field.id());
            }
        }

        Int2ObjectMap<IntSet> byAction = new Int2ObjectOpenHashMap<>(actions.size());

        for (int actionId : actions.keySet()) {
            IntSet ids = new IntLinkedOpenHashSet(common);

            for (FieldInfo field : fields.values()) {
                if (field.actionId() != null && field.actionId() == actionId) {
                    ids.add(field.id());
                }
            }

            byAction.put(actionId, IntSets.unmodifiable(ids));
        }

        Int2ObjectMap<IntSet> unmodifiableGroups = new Int2ObjectOpenHashMap<>(groups.size());

        for (Int2ObjectMap.Entry<IntSet> e : groups.int2ObjectEntrySet()) {
            unmodifiableGroups.put(e.getIntKey(), IntSets.unmodifiable(e.getValue()));
        }

        this.fieldIds = IntSets.unmodifiable(all);
        this.commonFieldIds = IntSets.unmodifiable(common);
        this.actionFieldIds = byAction;
        this.oneofGroups = unmodifiableGroups;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public IntSet fieldIds() {
        return fieldIds;
    }

    @Override
    public IntSet commonFieldIds() {
        return commonFieldIds;
    }

    @Override
    public IntSet fieldIds(int actionId) {
        IntSet ids = actionFieldIds.get(actionId);

        if (ids == null) {
            throw new TableDataException(UNKNOWN_ACTION_ERR, "Action does not exist [schema=" + name + ", actionId=" + actionId + ']');
        }

        return ids;
    }

    @Override
    public IntSet actionIds() {
        return IntSets.unmodifiable(actions.keySet());
    }

    @Override
    public boolean hasAction(int actionId) {
        return actions.containsKey(actionId);
    }

    @Override
    public boolean hasField(int fieldId) {
        return fields.containsKey(fieldId);
    }

    @Override
    public FieldInfo field(int fieldId) {
        FieldInfo field = fields.get(fieldId);

        if (field == null) {
            throw new FieldNotFoundException(name, fieldId);
        }

        return field;
    }

    @Override
    public int fieldId(String name) {
        if (!idsByName.containsKey(name)) {
            throw new FieldNotFoundException(this.name, name);
        }

        return idsByName.getInt(name);
    }

    @Override
    public IntSet oneofGroupMembers(int groupId) {
        IntSet members = oneofGroups.get(groupId);

        return members == null ? IntSets.EMPTY_SET : members;
    }

    @Override
    public TableDataSchema containerChildSchema(int fieldId) {
        FieldInfo field = field(fieldId);

        if (!field.isContainer()) {
            throw new TableDataException(NOT_A_CONTAINER_ERR, "Field is not a container [schema=" + name + ", fieldId=" + fieldId
                    + ", kind=" + field.kind() + ']');
        }

        return field.childSchema();
    }

    @Override
    public String toString() {
        return "TableDataSchema [name=" + name + ", fields=" + fields.values() + ", actions=" + actions + ']';
    }
}
