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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.tdi.internal.table.data.TestSchemas.DESCRIPTION;
import static org.tdi.internal.table.data.TestSchemas.FORWARD;
import static org.tdi.internal.table.data.TestSchemas.NEXTHOP;
import static org.tdi.internal.table.data.TestSchemas.PORT;
import static org.tdi.internal.table.data.TestSchemas.VRF;
import static org.tdi.internal.testframework.TdiTestUtils.assertThrowsWithCode;
import static org.tdi.lang.ErrorGroups.TableData.INACTIVE_FIELD_ERR;
import static org.tdi.lang.ErrorGroups.TableData.NOT_SET_ERR;
import static org.tdi.lang.ErrorGroups.TableData.UNKNOWN_FIELD_ERR;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.junit.jupiter.api.Test;
import org.tdi.lang.FieldNotFoundException;
import org.tdi.lang.TableDataException;
import org.tdi.table.FieldValue;

class FieldStoreTest {
    private final FieldStore store = new FieldStore(FORWARD, new IntOpenHashSet(new int[] {VRF, PORT}));

    @Test
    void lookups() {
        assertEquals(VRF, store.writableField(VRF).id());
        assertEquals(PORT, store.readableField(PORT).id());

        assertThrowsWithCode(FieldNotFoundException.class, UNKNOWN_FIELD_ERR, () -> store.writableField(999));
        assertThrowsWithCode(FieldNotFoundException.class, UNKNOWN_FIELD_ERR, () -> store.isActive(999));
        assertThrowsWithCode(TableDataException.class, INACTIVE_FIELD_ERR, () -> store.writableField(DESCRIPTION), "not allocated");
        assertThrowsWithCode(TableDataException.class, INACTIVE_FIELD_ERR, () -> store.readableField(NEXTHOP));
    }

    @Test
    void putGetAndDeactivate() {
        assertThrowsWithCode(TableDataException.class, NOT_SET_ERR, () -> store.get(VRF));

        assertThat(store.put(VRF, FieldValue.ofLong(1)), is(nullValue()));
        assertEquals(FieldValue.ofLong(1), store.put(VRF, FieldValue.ofLong(2)));

        assertEquals(FieldValue.ofLong(2), store.deactivate(VRF));
        assertFalse(store.isActive(VRF));
        assertThrowsWithCode(TableDataException.class, INACTIVE_FIELD_ERR, () -> store.readableField(VRF), "deactivated");

        store.writableField(VRF);
        store.put(VRF, FieldValue.ofLong(3));

        assertTrue(store.isActive(VRF));
    }

    @Test
    void clearRestoresAllocatedSet() {
        store.put(PORT, FieldValue.ofLong(4));
        store.deactivate(VRF);

        assertThat(store.clear(), contains(FieldValue.ofLong(4)));
        assertTrue(store.isActive(VRF));
        assertTrue(store.values().isEmpty());
    }
}
