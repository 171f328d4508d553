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

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.tdi.internal.codec.FieldCodec;
import org.tdi.internal.schema.TableDataSchemaImpl;
import org.tdi.lang.SchemaDefinitionException;

/**
 * Builder of an in-memory {@link TableDataSchema}. The definition is verified as a whole by {@link #build()}.
 */
public class TableDataSchemaBuilder {
    private final String name;

    private final Int2ObjectMap<FieldInfo> fields = new Int2ObjectLinkedOpenHashMap<>();

    private final Int2ObjectMap<String> actions = new Int2ObjectLinkedOpenHashMap<>();

    TableDataSchemaBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Adds a field.
     *
     * @param field Field entry.
     * @return This builder instance.
     * @throws SchemaDefinitionException If a field with the same id is already added.
     */
    public TableDataSchemaBuilder addField(FieldInfo field) {
        if (fields.containsKey(field.id())) {
            throw new SchemaDefinitionException("Duplicate field id [schema=" + name + ", fieldId=" + field.id() + ']');
        }

        fields.put(field.id(), field);

        return this;
    }

    /**
     * Adds an action.
     *
     * @param actionId Action id.
     * @param actionName Action name.
     * @return This builder instance.
     * @throws SchemaDefinitionException If an action with the same id is already added.
     */
    public TableDataSchemaBuilder addAction(int actionId, String actionName) {
        if (actions.containsKey(actionId)) {
            throw new SchemaDefinitionException("Duplicate action id [schema=" + name + ", actionId=" + actionId + ']');
        }

        actions.put(actionId, Objects.requireNonNull(actionName, "actionName"));

        return this;
    }

    /**
     * Verifies the definition and builds the schema.
     *
     * @return Schema.
     * @throws SchemaDefinitionException If the definition is inconsistent.
     */
    public TableDataSchema build() {
        Set<String> names = new HashSet<>();
        Int2ObjectMap<FieldInfo> groupScope = new Int2ObjectOpenHashMap<>();

        for (FieldInfo field : fields.values()) {
            if (!names.add(field.name())) {
                throw error("Duplicate field name", field);
            }

            validateWidth(field);

            if (field.isContainer() != (field.childSchema() != null)) {
                throw error(field.isContainer() ? "Container field without child schema" : "Child schema on a non-container field", field);
            }

            if (field.actionId() != null && !actions.containsKey(field.actionId().intValue())) {
                throw error("Field refers to an unknown action", field);
            }

            if (field.oneofGroup() != null) {
                FieldInfo first = groupScope.putIfAbsent(field.oneofGroup().intValue(), field);

                if (first != null && !Objects.equals(first.actionId(), field.actionId())) {
                    throw error("Oneof group spans different action scopes", field);
                }
            }
        }

        return new TableDataSchemaImpl(name, fields, actions);
    }

    private void validateWidth(FieldInfo field) {
        FieldKind kind = field.kind();
        int width = field.bitWidth();

        boolean valid;

        if (kind == FieldKind.UINT64) {
            valid = width >= 1 && width <= FieldCodec.MAX_SCALAR_WIDTH;
        } else if (kind == FieldKind.BYTES) {
            valid = width >= 1;
        } else {
            valid = width == kind.fixedWidth();
        }

        if (!valid) {
            throw error("Invalid field width", field);
        }
    }

    private SchemaDefinitionException error(String reason, FieldInfo field) {
        return new SchemaDefinitionException(reason + " [schema=" + name + ", field=" + field + ']');
    }
}
