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

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.OptionalInt;
import org.tdi.schema.TableDataSchema;

/**
 * Tracks which member of every oneof group has been chosen for a record.
 *
 * <p>Only allocated members take part: a group with a single allocated member never deactivates anything, and members excluded from
 * the allocation are rejected by the field store before they reach the tracker.
 */
class OneofActivationTracker {
    /** Group id by allocated member id. */
    private final Int2IntMap groupByField = new Int2IntOpenHashMap();

    /** Allocated members by group id. */
    private final Int2ObjectMap<IntList> membersByGroup = new Int2ObjectOpenHashMap<>();

    /** Member chosen by the last write, by group id. */
    private final Int2IntMap chosen = new Int2IntOpenHashMap();

    OneofActivationTracker(TableDataSchema schema, Iterable<Integer> allocated) {
        for (int fieldId : allocated) {
            OptionalInt group = schema.fieldOneofGroup(fieldId);

            if (group.isPresent()) {
                groupByField.put(fieldId, group.getAsInt());
                membersByGroup.computeIfAbsent(group.getAsInt(), g -> new IntArrayList()).add(fieldId);
            }
        }
    }

    /**
     * Returns the group of an allocated field.
     *
     * @param fieldId Field id.
     * @return Group id, empty if the field is not a oneof member.
     */
    OptionalInt groupOf(int fieldId) {
        return groupByField.containsKey(fieldId) ? OptionalInt.of(groupByField.get(fieldId)) : OptionalInt.empty();
    }

    /**
     * Returns the allocated members of the group of a field, other than the field itself. The caller deactivates them before the
     * write is applied; call {@link #onSet(int)} once it is.
     *
     * @param fieldId Field about to be written.
     * @return Sibling ids, empty for fields outside oneof groups.
     */
    IntList siblings(int fieldId) {
        if (!groupByField.containsKey(fieldId)) {
            return IntLists.emptyList();
        }

        int group = groupByField.get(fieldId);
        IntList res = new IntArrayList();

        for (int member : membersByGroup.get(group)) {
            if (member != fieldId) {
                res.add(member);
            }
        }

        return res;
    }

    /**
     * Records a write of a field.
     *
     * @param fieldId Written field.
     */
    void onSet(int fieldId) {
        if (groupByField.containsKey(fieldId)) {
            chosen.put(groupByField.get(fieldId), fieldId);
        }
    }

    /**
     * Returns the member chosen by the last write into a group.
     *
     * @param groupId Group id.
     * @return Member id, empty if no member has been written.
     */
    OptionalInt activeMember(int groupId) {
        return chosen.containsKey(groupId) ? OptionalInt.of(chosen.get(groupId)) : OptionalInt.empty();
    }

    /** Forgets every choice. */
    void reset() {
        chosen.clear();
    }
}
