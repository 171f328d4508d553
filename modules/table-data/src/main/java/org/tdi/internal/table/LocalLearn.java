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

import java.util.Objects;
import org.tdi.internal.table.data.TableDataImpl;
import org.tdi.schema.TableDataSchema;
import org.tdi.table.Learn;
import org.tdi.table.TableData;

/**
 * In-memory learn that allocates records of its schema.
 */
public class LocalLearn implements Learn {
    private final String name;

    private final TableDataSchema schema;

    /**
     * Constructor.
     *
     * @param name Learn name.
     * @param schema Schema of the learn records.
     */
    public LocalLearn(String name, TableDataSchema schema) {
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
    public TableData learnDataAllocate() {
        return TableDataImpl.allocate(schema, null, null, this);
    }

    @Override
    public String toString() {
        return "LocalLearn [name=" + name + ", schema=" + schema.name() + ']';
    }
}
