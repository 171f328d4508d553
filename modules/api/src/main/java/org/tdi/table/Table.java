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
import org.tdi.lang.TableDataException;
import org.tdi.schema.TableDataSchema;

/**
 * Lookup table able to allocate table data records of its schema.
 */
public interface Table {
    /**
     * Returns the table name.
     *
     * @return Table name.
     */
    String name();

    /**
     * Returns the schema of the table data records.
     *
     * @return Schema.
     */
    TableDataSchema dataSchema();

    /**
     * Allocates a record with the fields common to all actions.
     *
     * @return New caller owned record.
     */
    TableData dataAllocate();

    /**
     * Allocates a record with the common fields and the fields of an action.
     *
     * @param actionId Action id.
     * @return New caller owned record.
     * @throws TableDataException With {@code UNKNOWN_ACTION_ERR} if the action is not defined.
     */
    TableData dataAllocate(int actionId);

    /**
     * Allocates a record with a subset of the common fields.
     *
     * @param fieldIds Field ids.
     * @return New caller owned record.
     * @throws TableDataException With {@code UNKNOWN_FIELD_ERR} for an id absent from the schema, with {@code INACTIVE_FIELD_ERR}
     *      for an id scoped to an action.
     */
    TableData dataAllocate(Collection<Integer> fieldIds);

    /**
     * Allocates a record with a subset of the common fields and the fields of an action.
     *
     * @param fieldIds Field ids.
     * @param actionId Action id.
     * @return New caller owned record.
     * @throws TableDataException With {@code UNKNOWN_ACTION_ERR} if the action is not defined, with {@code UNKNOWN_FIELD_ERR} for
     *      an id absent from the schema, with {@code INACTIVE_FIELD_ERR} for an id scoped to another action.
     */
    TableData dataAllocate(Collection<Integer> fieldIds, int actionId);

    /**
     * Clears every value of a record allocated by this table and restores its allocated fields as active.
     *
     * @param data Record.
     */
    void dataReset(TableData data);
}
