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

import static org.tdi.lang.ErrorGroups.TableData.NOT_A_CONTAINER_ERR;
import static org.tdi.lang.ErrorGroups.TableData.UNKNOWN_ACTION_ERR;

import it.unimi.dsi.fastutil.ints.IntArraySet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;
import org.tdi.schema.FieldInfo;
import org.tdi.schema.TableDataSchema;

/**
 * Schema whose container field holds records of the schema itself. Cannot be expressed with the schema builder, which requires the
 * child schema to exist first.
 */
class RecursiveSchema implements TableDataSchema {
    static final int CHILDREN = 1;

    static final int ID = 2;

    private final FieldInfo children = FieldInfo.container(CHILDREN, "children", this);

    private final FieldInfo id = FieldInfo.uint(ID, "id", 8);

    private final IntSet ids = IntSets.unmodifiable(new IntArraySet(new int[] {CHILDREN, ID}));

    @Override
    public String name() {
        return "node";
    }

    @Override
    public IntSet fieldIds() {
        return ids;
    }

    @Override
    public IntSet commonFieldIds() {
        return ids;
    }

    @Override
    public IntSet fieldIds(int actionId) {
        throw new TableDataException(UNKNOWN_ACTION_ERR, "No actions");
    }

    @Override
    public IntSet actionIds() {
        return IntSets.EMPTY_SET;
    }

    @Override
    public boolean hasAction(int actionId) {
        return false;
    }

    @Override
    public boolean hasField(int fieldId) {
        return ids.contains(fieldId);
    }

    @Override
    public FieldInfo field(int fieldId) {
        if (fieldId == CHILDREN) {
            return children;
        } else if (fieldId == ID) {
            return id;
        }

        throw new FieldNotFoundException(name(), fieldId);
    }

    @Override
    public int fieldId(String name) {
        if (children.name().equals(name)) {
            return CHILDREN;
        } else if (id.name().equals(name)) {
            return ID;
        }

        throw new FieldNotFoundException(name(), name);
    }

    @Override
    public IntSet oneofGroupMembers(int groupId) {
        return IntSets.EMPTY_SET;
    }

    @Override
    public TableDataSchema containerChildSchema(int fieldId) {
        if (!field(fieldId).isContainer()) {
            throw new TableDataException(NOT_A_CONTAINER_ERR, "Not a container: " + fieldId);
        }

        return this;
    }
}
