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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.tdi.internal.table.data.TestSchemas.ECMP_GROUP;
import static org.tdi.internal.table.data.TestSchemas.FORWARD;
import static org.tdi.internal.table.data.TestSchemas.MODE_A;
import static org.tdi.internal.table.data.TestSchemas.MODE_B;
import static org.tdi.internal.table.data.TestSchemas.MODE_C;
import static org.tdi.internal.table.data.TestSchemas.MODE_GROUP;
import static org.tdi.internal.table.data.TestSchemas.MODE_MEMBERS;
import static org.tdi.internal.table.data.TestSchemas.NEXTHOP_GROUP;
import static org.tdi.internal.table.data.TestSchemas.VRF;

import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class OneofActivationTrackerTest {
    @Test
    void siblingsOfFullAllocation() {
        var tracker = new OneofActivationTracker(FORWARD, FORWARD.fieldIds());

        assertThat(tracker.siblings(MODE_A), containsInAnyOrder(MODE_B, MODE_C, MODE_MEMBERS));
        assertThat(tracker.siblings(VRF), is(empty()));
        assertEquals(OptionalInt.of(MODE_GROUP), tracker.groupOf(MODE_B));
        assertEquals(OptionalInt.empty(), tracker.groupOf(VRF));
    }

    @Test
    void onlyAllocatedMembersAreSiblings() {
        var tracker = new OneofActivationTracker(FORWARD, List.of(MODE_A, MODE_C, ECMP_GROUP));

        assertThat(tracker.siblings(MODE_A), containsInAnyOrder(MODE_C));
        assertThat(tracker.siblings(ECMP_GROUP), is(empty()));
    }

    @Test
    void remembersLastChoice() {
        var tracker = new OneofActivationTracker(FORWARD, FORWARD.fieldIds());

        assertEquals(OptionalInt.empty(), tracker.activeMember(MODE_GROUP));

        tracker.onSet(MODE_A);
        tracker.onSet(MODE_B);
        tracker.onSet(VRF);

        assertEquals(OptionalInt.of(MODE_B), tracker.activeMember(MODE_GROUP));
        assertEquals(OptionalInt.empty(), tracker.activeMember(NEXTHOP_GROUP));

        tracker.reset();

        assertEquals(OptionalInt.empty(), tracker.activeMember(MODE_GROUP));
    }
}
