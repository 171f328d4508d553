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
import static org.tdi.lang.ErrorGroups.TableData.NO_PARENT_ERR;
import static org.tdi.lang.ErrorGroups.TableData.OWNERSHIP_ERR;
import static org.tdi.lang.ErrorGroups.TableData.RECORD_RELEASED_ERR;
import static org.tdi.lang.ErrorGroups.TableData.TYPE_MISMATCH_ERR;
import static org.tdi.lang.ErrorGroups.TableData.VALUE_OUT_OF_RANGE_ERR;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.lang.ref.WeakReference;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.jetbrains.annotations.Nullable;
import org.tdi.internal.codec.FieldCodec;
import org.tdi.internal.logger.Loggers;
import org.tdi.internal.logger.TdiLogger;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;
import org.tdi.schema.FieldInfo;
import org.tdi.schema.FieldKind;
import org.tdi.schema.TableDataSchema;
import org.tdi.table.FieldValue;
import org.tdi.table.Learn;
import org.tdi.table.Table;
import org.tdi.table.TableData;

/**
 * Table data record backed by a {@link FieldStore}.
 *
 * <p>An instance is a handle to the record state. Handing a record over to a container field creates a new parent owned handle to
 * the same state and leaves the supplied handle in the {@link OwnershipState#MOVED} state, so that the caller can neither modify nor
 * release what the parent now holds.
 */
public class TableDataImpl implements TableData {
    private static final TdiLogger LOG = Loggers.forClass(TableDataImpl.class);

    private final FieldStore store;

    private final OneofActivationTracker oneofs;

    /** Table or learn the record has been allocated by, directly or through a parent record. */
    @Nullable
    private final WeakReference<Object> owner;

    @Nullable
    private final Integer actionId;

    private OwnershipState ownership;

    private TableDataImpl(
            FieldStore store,
            OneofActivationTracker oneofs,
            @Nullable WeakReference<Object> owner,
            @Nullable Integer actionId,
            OwnershipState ownership
    ) {
        this.store = store;
        this.oneofs = oneofs;
        this.owner = owner;
        this.actionId = actionId;
        this.ownership = ownership;
    }

    /**
     * Allocates a record on behalf of a table or a learn.
     *
     * @param schema Schema.
     * @param fieldIds Fields to allocate, {@code null} for every field available to the allocation.
     * @param actionId Action, {@code null} for an allocation of the common fields only.
     * @param owner Owning {@link Table} or {@link Learn}.
     * @return New caller owned record.
     * @throws TableDataException With {@code UNKNOWN_ACTION_ERR} for an unknown action, with {@code UNKNOWN_FIELD_ERR} for an id
     *      absent from the schema, with {@code INACTIVE_FIELD_ERR} for an id not available to the allocation.
     */
    public static TableDataImpl allocate(
            TableDataSchema schema,
            @Nullable Collection<Integer> fieldIds,
            @Nullable Integer actionId,
            Object owner
    ) {
        IntSet available = actionId == null ? schema.commonFieldIds() : schema.fieldIds(actionId);

        return create(schema, available, fieldIds, actionId, new WeakReference<>(owner));
    }

    static TableDataImpl allocateChild(
            TableDataSchema schema,
            @Nullable Collection<Integer> fieldIds,
            @Nullable WeakReference<Object> owner
    ) {
        return create(schema, schema.fieldIds(), fieldIds, null, owner);
    }

    private static TableDataImpl create(
            TableDataSchema schema,
            IntSet available,
            @Nullable Collection<Integer> fieldIds,
            @Nullable Integer actionId,
            @Nullable WeakReference<Object> owner
    ) {
        IntSet allocated;

        if (fieldIds == null) {
            allocated = available;
        } else {
            allocated = new IntOpenHashSet(fieldIds.size());

            for (int fieldId : fieldIds) {
                if (!schema.hasField(fieldId)) {
                    throw new FieldNotFoundException(schema.name(), fieldId);
                }

                if (!available.contains(fieldId)) {
                    throw new TableDataException(INACTIVE_FIELD_ERR, "Field is not available for the allocation [schema=" + schema.name()
                            + ", fieldId=" + fieldId + ", actionId=" + actionId + ']');
                }

                allocated.add(fieldId);
            }
        }

        if (LOG.isTraceEnabled()) {
            LOG.trace("Allocated table data [schema={}, actionId={}, fields={}]", schema.name(), actionId, allocated);
        }

        return new TableDataImpl(
                new FieldStore(schema, allocated),
                new OneofActivationTracker(schema, allocated),
                owner,
                actionId,
                OwnershipState.CALLER_OWNED
        );
    }

    @Override
    public TableDataSchema schema() {
        ensureUsable();

        return store.schema();
    }

    @Override
    public void setValue(int fieldId, FieldValue value) {
        Objects.requireNonNull(value, "value");

        if (value.kind() == FieldKind.CONTAINER) {
            setContainerValue(fieldId, value.containerValue());

            return;
        }

        ensureUsable();

        FieldInfo field = store.writableField(fieldId);

        apply(field, convert(field, value));
    }

    @Override
    public void setBytes(int fieldId, byte[] buf, int size) {
        writableField(fieldId, FieldKind.BYTES);

        setValue(fieldId, FieldValue.ofBytes(buf, size));
    }

    @Override
    public void setIntList(int fieldId, List<Integer> value) {
        writableField(fieldId, FieldKind.INT_LIST);

        setValue(fieldId, FieldValue.ofIntList(value));
    }

    @Override
    public void setBooleanList(int fieldId, List<Boolean> value) {
        writableField(fieldId, FieldKind.BOOL_LIST);

        setValue(fieldId, FieldValue.ofBooleanList(value));
    }

    @Override
    public void setStringList(int fieldId, List<String> value) {
        writableField(fieldId, FieldKind.STRING_LIST);

        setValue(fieldId, FieldValue.ofStringList(value));
    }

    @Override
    public void setLongList(int fieldId, List<Long> value) {
        writableField(fieldId, FieldKind.UINT64_LIST);

        setValue(fieldId, FieldValue.ofLongList(value));
    }

    @Override
    public void setString(int fieldId, String value) {
        writableField(fieldId, FieldKind.STRING);

        setValue(fieldId, FieldValue.ofString(value));
    }

    @Override
    public FieldValue getValue(int fieldId) {
        ensureUsable();

        store.readableField(fieldId);

        return store.get(fieldId);
    }

    @Override
    public long longValue(int fieldId) {
        return read(fieldId, FieldKind.UINT64).longValue();
    }

    @Override
    public byte[] bytesValue(int fieldId, int size, byte[] dst) {
        ensureUsable();

        FieldInfo field = store.readableField(fieldId);

        if (field.kind() != FieldKind.UINT64 && field.kind() != FieldKind.BYTES) {
            throw typeMismatch(field, FieldKind.BYTES);
        }

        FieldCodec.checkSize(field.bitWidth(), size);

        FieldValue value = store.get(fieldId);

        byte[] stored = field.kind() == FieldKind.UINT64
                ? FieldCodec.encodeScalar(field.bitWidth(), value.longValue())
                : value.bytesValue();

        return FieldCodec.decodeBytes(field.bitWidth(), stored, size, dst);
    }

    @Override
    public List<Integer> intListValue(int fieldId) {
        return read(fieldId, FieldKind.INT_LIST).intListValue();
    }

    @Override
    public List<Boolean> booleanListValue(int fieldId) {
        return read(fieldId, FieldKind.BOOL_LIST).booleanListValue();
    }

    @Override
    public List<String> stringListValue(int fieldId) {
        return read(fieldId, FieldKind.STRING_LIST).stringListValue();
    }

    @Override
    public List<Long> longListValue(int fieldId) {
        return read(fieldId, FieldKind.UINT64_LIST).longListValue();
    }

    @Override
    public float floatValue(int fieldId) {
        return read(fieldId, FieldKind.FLOAT).floatValue();
    }

    @Override
    public boolean booleanValue(int fieldId) {
        return read(fieldId, FieldKind.BOOL).booleanValue();
    }

    @Override
    public String stringValue(int fieldId) {
        return read(fieldId, FieldKind.STRING).stringValue();
    }

    @Override
    public List<TableData> containerValue(int fieldId) {
        return read(fieldId, FieldKind.CONTAINER).containerValue();
    }

    @Override
    public TableData allocateContainer(int fieldId) {
        ensureUsable();

        store.writableField(fieldId);

        return ContainerManager.allocate(this, fieldId, null);
    }

    @Override
    public TableData allocateContainer(int fieldId, Collection<Integer> fieldIds) {
        Objects.requireNonNull(fieldIds, "fieldIds");

        ensureUsable();

        store.writableField(fieldId);

        return ContainerManager.allocate(this, fieldId, fieldIds);
    }

    @Override
    public boolean isActive(int fieldId) {
        ensureUsable();

        return store.isActive(fieldId);
    }

    @Override
    public OptionalInt actionId() {
        ensureUsable();

        return actionId == null ? OptionalInt.empty() : OptionalInt.of(actionId);
    }

    @Override
    public Table parentTable() {
        ensureUsable();

        Object o = owner == null ? null : owner.get();

        if (!(o instanceof Table)) {
            throw new TableDataException(NO_PARENT_ERR, "Record does not belong to a table [schema=" + store.schema().name() + ']');
        }

        return (Table) o;
    }

    @Override
    public Learn parentLearn() {
        ensureUsable();

        Object o = owner == null ? null : owner.get();

        if (!(o instanceof Learn)) {
            throw new TableDataException(NO_PARENT_ERR, "Record does not belong to a learn [schema=" + store.schema().name() + ']');
        }

        return (Learn) o;
    }

    /**
     * Returns the member of a oneof group chosen by the last write.
     *
     * @param groupId Oneof group id.
     * @return Member id, empty if no member of the group has been written.
     */
    public OptionalInt activeOneofMember(int groupId) {
        ensureUsable();

        return oneofs.activeMember(groupId);
    }

    /**
     * Checks whether the record has been allocated by the given table or learn.
     *
     * @param candidate Table or learn.
     * @return {@code true} if the record belongs to the candidate.
     */
    public boolean ownedBy(Object candidate) {
        return owner != null && owner.get() == candidate;
    }

    /**
     * Drops every value, releasing nested records, and restores the allocated fields as active.
     */
    public void reset() {
        ensureUsable();

        for (FieldValue removed : store.clear()) {
            ContainerManager.release(removed);
        }

        oneofs.reset();
    }

    @Override
    public void close() {
        if (!ownership.usable()) {
            return;
        }

        if (ownership == OwnershipState.PARENT_OWNED) {
            throw new TableDataException(OWNERSHIP_ERR, "Record is held by a parent record and cannot be released directly [schema="
                    + store.schema().name() + ']');
        }

        release();
    }

    /**
     * Releases the record together with every nested record. Does nothing for an unusable handle.
     */
    void release() {
        if (!ownership.usable()) {
            return;
        }

        ownership = OwnershipState.RELEASED;

        for (FieldValue removed : store.clear()) {
            ContainerManager.release(removed);
        }

        LOG.debug("Table data released [schema={}]", store.schema().name());
    }

    /**
     * Hands the record state over to a parent.
     *
     * @param parent Store of the parent record.
     * @return Parent owned handle.
     */
    TableDataImpl moveTo(FieldStore parent) {
        assert ownership == OwnershipState.CALLER_OWNED : ownership;

        ownership = OwnershipState.MOVED;

        store.parent(parent);

        return new TableDataImpl(store, oneofs, owner, actionId, OwnershipState.PARENT_OWNED);
    }

    void ensureUsable() {
        if (!ownership.usable()) {
            throw new TableDataException(RECORD_RELEASED_ERR, (ownership == OwnershipState.MOVED
                    ? "Record has been handed over to a parent record"
                    : "Record has been released") + " [schema=" + store.schema().name() + ']');
        }
    }

    OwnershipState ownership() {
        return ownership;
    }

    FieldStore store() {
        return store;
    }

    @Nullable
    WeakReference<Object> owner() {
        return owner;
    }

    private void setContainerValue(int fieldId, List<TableData> children) {
        try {
            ensureUsable();

            FieldInfo field = store.writableField(fieldId);

            if (!field.isContainer()) {
                throw typeMismatch(field, FieldKind.CONTAINER);
            }

            apply(field, FieldValue.ofContainer(ContainerManager.adopt(store, field, children)));
        } catch (RuntimeException e) {
            ContainerManager.consume(children);

            throw e;
        }
    }

    /**
     * Resolves a field for a typed setter before the value is built, so that a bad argument never hides a missing or inactive field.
     */
    private FieldInfo writableField(int fieldId, FieldKind accessorKind) {
        ensureUsable();

        FieldInfo field = store.writableField(fieldId);

        boolean compatible = field.kind() == accessorKind || (accessorKind == FieldKind.BYTES && field.kind() == FieldKind.UINT64);

        if (!compatible) {
            throw typeMismatch(field, accessorKind);
        }

        return field;
    }

    private FieldValue read(int fieldId, FieldKind accessorKind) {
        ensureUsable();

        FieldInfo field = store.readableField(fieldId);

        if (field.kind() != accessorKind) {
            throw typeMismatch(field, accessorKind);
        }

        return store.get(fieldId);
    }

    /**
     * Checks a value against the declared field kind and width and converts it to the stored representation.
     */
    private static FieldValue convert(FieldInfo field, FieldValue value) {
        switch (field.kind()) {
            case UINT64:
                if (value.kind() == FieldKind.UINT64) {
                    if (!FieldCodec.fits(field.bitWidth(), value.longValue())) {
                        throw new TableDataException(VALUE_OUT_OF_RANGE_ERR, "Value does not fit into the field width [fieldId="
                                + field.id() + ", width=" + field.bitWidth() + ", value=" + Long.toUnsignedString(value.longValue()) + ']');
                    }

                    return value;
                }

                if (value.kind() == FieldKind.BYTES) {
                    return FieldValue.ofLong(FieldCodec.decodeScalar(field.bitWidth(), value.bytesValue()));
                }

                throw typeMismatch(field, value.kind());

            case BYTES:
                if (value.kind() == FieldKind.BYTES) {
                    byte[] bytes = value.bytesValue();

                    return FieldValue.ofBytes(FieldCodec.encodeBytes(field.bitWidth(), bytes, bytes.length));
                }

                throw typeMismatch(field, value.kind());

            default:
                if (value.kind() != field.kind()) {
                    throw typeMismatch(field, value.kind());
                }

                return value;
        }
    }

    /**
     * Stores a converted value, deactivating the oneof siblings of the field first.
     */
    private void apply(FieldInfo field, FieldValue value) {
        int fieldId = field.id();

        for (int sibling : oneofs.siblings(fieldId)) {
            if (store.active().contains(sibling)) {
                ContainerManager.release(store.deactivate(sibling));

                LOG.debug("Oneof member deactivated [schema={}, group={}, fieldId={}, activatedFieldId={}]",
                        store.schema().name(), field.oneofGroup(), sibling, fieldId);
            }
        }

        ContainerManager.release(store.put(fieldId, value));

        oneofs.onSet(fieldId);
    }

    private static TableDataException typeMismatch(FieldInfo field, FieldKind accessorKind) {
        return new TableDataException(TYPE_MISMATCH_ERR, "Accessor does not match the field kind [fieldId=" + field.id()
                + ", fieldKind=" + field.kind() + ", accessorKind=" + accessorKind + ']');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TableDataImpl that = (TableDataImpl) o;
        return store.schema() == that.store.schema() && Objects.equals(actionId, that.actionId)
                && store.active().equals(that.store.active()) && store.values().equals(that.store.values());
    }

    @Override
    public int hashCode() {
        return Objects.hash(store.schema().name(), actionId, store.active(), store.values());
    }

    @Override
    public String toString() {
        return "TableData [schema=" + store.schema().name() + (actionId == null ? "" : ", actionId=" + actionId)
                + ", state=" + ownership + ", values=" + store.values() + ']';
    }
}
