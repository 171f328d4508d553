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

import static org.tdi.lang.ErrorGroups.TableData.OWNERSHIP_ERR;
import static org.tdi.lang.ErrorGroups.TableData.TYPE_MISMATCH_ERR;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.tdi.internal.logger.Loggers;
import org.tdi.internal.logger.TdiLogger;
import org.tdi.lang.TableDataException;
import org.tdi.schema.FieldInfo;
import org.tdi.schema.FieldKind;
import org.tdi.schema.TableDataSchema;
import org.tdi.table.FieldValue;
import org.tdi.table.TableData;

/**
 * Allocation, hand-over and release of the records held by container fields.
 */
final class ContainerManager {
    private static final TdiLogger LOG = Loggers.forClass(ContainerManager.class);

    private ContainerManager() {
    }

    /**
     * Allocates a caller owned record for a container field of a parent. The record inherits the owner of the parent.
     *
     * @param parent Parent record.
     * @param fieldId Container field id.
     * @param fieldIds Ids of child schema fields to allocate, {@code null} for every field of the child schema.
     * @return New record.
     */
    static TableDataImpl allocate(TableDataImpl parent, int fieldId, @Nullable Collection<Integer> fieldIds) {
        TableDataSchema childSchema = parent.store().schema().containerChildSchema(fieldId);

        return TableDataImpl.allocateChild(childSchema, fieldIds, parent.owner());
    }

    /**
     * Moves caller owned records under a container field. Every record is verified before any of them is moved, so a failure leaves
     * all of them in their original state.
     *
     * @param parent Store of the receiving record.
     * @param field Container field.
     * @param children Records to move.
     * @return Parent owned handles of the moved records.
     * @throws TableDataException If any of the records cannot be moved.
     */
    static List<TableData> adopt(FieldStore parent, FieldInfo field, List<TableData> children) {
        TableDataSchema childSchema = field.childSchema();

        Set<TableDataImpl> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<TableDataImpl> verified = new ArrayList<>(children.size());

        for (TableData child : children) {
            if (child == null) {
                throw new TableDataException(TYPE_MISMATCH_ERR, "Record is null [fieldId=" + field.id() + ']');
            }

            if (!(child instanceof TableDataImpl)) {
                throw new TableDataException(TYPE_MISMATCH_ERR, "Record has not been allocated by a table [fieldId=" + field.id()
                        + ", class=" + child.getClass().getName() + ']');
            }

            TableDataImpl impl = (TableDataImpl) child;

            impl.ensureUsable();

            if (impl.ownership() != OwnershipState.CALLER_OWNED) {
                throw ownership("Record is already held by a parent record", field);
            }

            if (!seen.add(impl)) {
                throw ownership("Record is supplied more than once", field);
            }

            if (impl.store().schema() != childSchema) {
                throw new TableDataException(TYPE_MISMATCH_ERR, "Record schema does not match the container field [fieldId=" + field.id()
                        + ", expected=" + childSchema.name() + ", actual=" + impl.store().schema().name() + ']');
            }

            for (FieldStore s = parent; s != null; s = s.parent()) {
                if (s == impl.store()) {
                    throw ownership("Record cannot be nested into itself", field);
                }
            }

            verified.add(impl);
        }

        List<TableData> adopted = new ArrayList<>(verified.size());

        for (TableDataImpl impl : verified) {
            adopted.add(impl.moveTo(parent));
        }

        LOG.debug("Container field took ownership of records [schema={}, fieldId={}, count={}]",
                parent.schema().name(), field.id(), adopted.size());

        return adopted;
    }

    /**
     * Releases the records held by a removed value.
     *
     * @param value Removed value, may be {@code null} or of any kind.
     */
    static void release(@Nullable FieldValue value) {
        if (value == null || value.kind() != FieldKind.CONTAINER) {
            return;
        }

        for (TableData child : value.containerValue()) {
            ((TableDataImpl) child).release();
        }
    }

    /**
     * Releases the caller owned records supplied to a rejected container write. Records held by other parents are left intact.
     *
     * @param children Supplied records.
     */
    static void consume(List<TableData> children) {
        int released = 0;

        for (TableData child : children) {
            if (child instanceof TableDataImpl && ((TableDataImpl) child).ownership() == OwnershipState.CALLER_OWNED) {
                ((TableDataImpl) child).release();

                released++;
            }
        }

        if (released > 0) {
            LOG.debug("Released records of a rejected container write [count={}]", released);
        }
    }

    private static TableDataException ownership(String reason, FieldInfo field) {
        return new TableDataException(OWNERSHIP_ERR, reason + " [fieldId=" + field.id() + ']');
    }
}
