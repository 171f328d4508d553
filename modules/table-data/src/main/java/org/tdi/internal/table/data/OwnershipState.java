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

/**
 * State of a table data handle.
 */
enum OwnershipState {
    /** Handle returned by an allocation, released by its holder. */
    CALLER_OWNED,

    /** Handle held by a container field of a parent record. */
    PARENT_OWNED,

    /** State has been handed over to a parent record, the handle is unusable. */
    MOVED,

    /** Handle has been released, directly or together with its parent. */
    RELEASED;

    boolean usable() {
        return this == CALLER_OWNED || this == PARENT_OWNED;
    }
}
