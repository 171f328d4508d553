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

package org.tdi.internal.table;

import static org.tdi.lang.ErrorGroups.TableData.OWNERSHIP_ERR;

import java.util.Collection;
import java.util.Objects;
import org.tdi.internal.table.data.TableDataImpl;
import org.tdi.lang.TableDataException;
import org.tdi.schema.TableDataSchema;
import org.tdi.table.Table;
import org.tdi.table.TableData;

/**
 * In-memory table that allocates records of its schema. Holds no entries.
 */
public class LocalTable implements Table {
    private final String name;

    private final TableDataSchema schema;

    /**
     * Constructor.
     *
     * @param name Table name.
     * @param schema Schema of the table data records.
     */
    public LocalTable(String name, TableDataSchema schema) {
        this.name = Objects.requireNonNull(name, "name");
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public TableDataSchema dataSchema() {
        return schema;
    }

    @Override
    public TableData dataAllocate() {
        return TableDataImpl.allocate(schema, null, null, this);
    }

    @Override
    public TableData dataAllocate(int actionId) {
        return TableDataImpl.allocate(schema, null, actionId, this);
    }

    @Override
    public TableData dataAllocate(Collection<Integer> fieldIds) {
        return TableDataImpl.allocate(schema, Objects.requireNonNull(fieldIds, "fieldIds"), null, this);
    }

    @Override
    public TableData dataAllocate(Collection<Integer> fieldIds, int actionId) {
        return TableDataImpl.allocate(schema, Objects.requireNonNull(fieldIds, "fieldIds"), actionId, this);
    }

    @Override
    public void dataReset(TableData data) {
        if (!(data instanceof TableDataImpl) || !((TableDataImpl) data).ownedBy(this)) {
            throw new TableDataException(OWNERSHIP_ERR, "Record does not belong to the table [table=" + name + ']');
        }

        ((TableDataImpl) data).reset();
    }

    @Override
    public String toString() {
        return "LocalTable [name=" + name + ", schema=" + schema.name() + ']';
    }
}
