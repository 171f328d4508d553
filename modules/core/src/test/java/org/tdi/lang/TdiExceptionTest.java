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

package org.tdi.lang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.tdi.lang.ErrorGroups.TableData;

/**
 * Tests for {@link TdiException} and its subclasses.
 */
class TdiExceptionTest {
    @Test
    void exposesCodeParts() {
        var ex = new TdiException(TableData.SIZE_MISMATCH_ERR, "Invalid size");

        assertThat(ex.groupName(), is("TDATA"));
        assertThat(ex.codeAsString(), is("TDI-TDATA-5"));
        assertEquals(TableData.SIZE_MISMATCH_ERR, ex.code());
        assertEquals(5, ex.errorCode());
        assertEquals(2, ex.groupCode());
        assertThat(ex.getMessage(), is("Invalid size"));
    }

    @Test
    void keepsCauseAndTraceId() {
        UUID traceId = UUID.randomUUID();
        var cause = new IllegalStateException("Broken");
        var ex = new TdiException(traceId, TableData.OWNERSHIP_ERR, "Wrapped", cause);

        assertThat(ex.getCause(), is(cause));
        assertEquals(traceId, ex.traceId());
    }

    @Test
    void subclassesKeepTheirCodes() {
        assertThat(new FieldNotFoundException("route", 42).codeAsString(), is("TDI-TDATA-1"));
        assertThat(new SchemaDefinitionException("Duplicate field id").codeAsString(), is("TDI-SCHEMA-1"));
    }

    @Test
    void toStringContainsCodeAndTraceId() {
        UUID traceId = UUID.fromString("8f1d1b7c-0000-0000-0000-000000000000");
        var ex = new TdiException(traceId, TableData.NOT_SET_ERR, "Field 3 has not been set", null);

        assertThat(ex.toString(), equalTo(TdiException.class.getName() + ": TDI-TDATA-7 Field 3 has not been set TraceId:8f1d1b7c"));
    }
}
