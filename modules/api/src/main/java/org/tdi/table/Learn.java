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

import org.tdi.schema.TableDataSchema;

/**
 * Source of learn events. Records describing an event are allocated by the learn itself.
 */
public interface Learn {
    /**
     * Returns the learn name.
     *
     * @return Learn name.
     */
    String name();

    /**
     * Returns the schema of the learn records.
     *
     * @return Schema.
     */
    TableDataSchema dataSchema();

    /**
     * Allocates a record with every field of the schema that is not scoped to an action.
     *
     * @return New caller owned record.
     */
    TableData learnDataAllocate();
}
