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

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Schema entry describing a single table data field.
 *
 * <p>Instances are immutable. Consistency of an entry against the rest of the schema is verified by {@link TableDataSchemaBuilder}.
 */
public final class FieldInfo {
    private final int id;

    private final String name;

    private final FieldKind kind;

    private final int bitWidth;

    @Nullable
    private final Integer oneofGroup;

    @Nullable
    private final Integer actionId;

    @Nullable
    private final TableDataSchema childSchema;

    private FieldInfo(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.kind = builder.kind;
        this.bitWidth = builder.bitWidth;
        this.oneofGroup = builder.oneofGroup;
        this.actionId = builder.actionId;
        this.childSchema = builder.childSchema;
    }

    /**
     * Creates a builder of a field entry.
     *
     * @param id Field id.
     * @param name Field name.
     * @param kind Field kind.
     * @return Builder.
     */
    public static Builder builder(int id, String name, FieldKind kind) {
        return new Builder(id, name, kind);
    }

    /**
     * Creates an unsigned integer field entry.
     *
     * @param id Field id.
     * @param name Field name.
     * @param bitWidth Width in bits, from 1 to 64.
     * @return Field entry.
     */
    public static FieldInfo uint(int id, String name, int bitWidth) {
        return builder(id, name, FieldKind.UINT64).bitWidth(bitWidth).build();
    }

    /**
     * Creates a byte array field entry.
     *
     * @param id Field id.
     * @param name Field name.
     * @param bitWidth Width in bits.
     * @return Field entry.
     */
    public static FieldInfo bytes(int id, String name, int bitWidth) {
        return builder(id, name, FieldKind.BYTES).bitWidth(bitWidth).build();
    }

    /**
     * Creates a container field entry.
     *
     * @param id Field id.
     * @param name Field name.
     * @param childSchema Schema of the nested records.
     * @return Field entry.
     */
    public static FieldInfo container(int id, String name, TableDataSchema childSchema) {
        return builder(id, name, FieldKind.CONTAINER).childSchema(childSchema).build();
    }

    /**
     * Creates a field entry of a kind without a declared width.
     *
     * @param id Field id.
     * @param name Field name.
     * @param kind Field kind.
     * @return Field entry.
     */
    public static FieldInfo of(int id, String name, FieldKind kind) {
        return builder(id, name, kind).build();
    }

    /** Returns the field id. */
    public int id() {
        return id;
    }

    /** Returns the field name. */
    public String name() {
        return name;
    }

    /** Returns the field kind. */
    public FieldKind kind() {
        return kind;
    }

    /** Returns the width in bits, {@code 0} for kinds without a width. */
    public int bitWidth() {
        return bitWidth;
    }

    /** Returns the oneof group the field belongs to, {@code null} if none. */
    @Nullable
    public Integer oneofGroup() {
        return oneofGroup;
    }

    /** Returns the action the field is scoped to, {@code null} for fields common to all allocations. */
    @Nullable
    public Integer actionId() {
        return actionId;
    }

    /** Returns the schema of nested records for a container field, {@code null} otherwise. */
    @Nullable
    public TableDataSchema childSchema() {
        return childSchema;
    }

    /** Returns {@code true} for container fields. */
    public boolean isContainer() {
        return kind == FieldKind.CONTAINER;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldInfo that = (FieldInfo) o;
        return id == that.id && bitWidth == that.bitWidth && kind == that.kind && name.equals(that.name)
                && Objects.equals(oneofGroup, that.oneofGroup) && Objects.equals(actionId, that.actionId)
                && childSchema == that.childSchema;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, kind, bitWidth, oneofGroup, actionId);
    }

    @Override
    public String toString() {
        return "FieldInfo [id=" + id + ", name=" + name + ", kind=" + kind + ", bitWidth=" + bitWidth
                + (oneofGroup == null ? "" : ", oneofGroup=" + oneofGroup)
                + (actionId == null ? "" : ", actionId=" + actionId)
                + (childSchema == null ? "" : ", childSchema=" + childSchema.name()) + ']';
    }

    /**
     * Builder.
     */
    public static class Builder {
        private final int id;

        private final String name;

        private final FieldKind kind;

        private int bitWidth;

        @Nullable
        private Integer oneofGroup;

        @Nullable
        private Integer actionId;

        @Nullable
        private TableDataSchema childSchema;

        private Builder(int id, String name, FieldKind kind) {
            this.id = id;
            this.name = Objects.requireNonNull(name, "name");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.bitWidth = kind.fixedWidth();
        }

        /**
         * Sets the width in bits.
         *
         * @param bitWidth Width in bits.
         * @return This builder instance.
         */
        public Builder bitWidth(int bitWidth) {
            this.bitWidth = bitWidth;

            return this;
        }

        /**
         * Makes the field a member of a oneof group.
         *
         * @param oneofGroup Group id.
         * @return This builder instance.
         */
        public Builder oneofGroup(int oneofGroup) {
            this.oneofGroup = oneofGroup;

            return this;
        }

        /**
         * Scopes the field to an action.
         *
         * @param actionId Action id.
         * @return This builder instance.
         */
        public Builder actionId(int actionId) {
            this.actionId = actionId;

            return this;
        }

        /**
         * Sets the schema of nested records.
         *
         * @param childSchema Child schema.
         * @return This builder instance.
         */
        public Builder childSchema(TableDataSchema childSchema) {
            this.childSchema = childSchema;

            return this;
        }

        /**
         * Builds the field entry.
         *
         * @return Field entry.
         */
        public FieldInfo build() {
            return new FieldInfo(this);
        }
    }
}
