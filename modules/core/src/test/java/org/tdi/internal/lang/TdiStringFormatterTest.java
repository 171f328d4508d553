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

package org.tdi.internal.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class TdiStringFormatterTest {
    @Test
    void substitutesAnchors() {
        assertEquals("Hi there.", TdiStringFormatter.format("Hi {}.", "there"));
        assertEquals("a=1, b=null", TdiStringFormatter.format("a={}, b={}", 1, null));
    }

    @Test
    void keepsAnchorsWithoutArguments() {
        assertEquals("x=1, y={}", TdiStringFormatter.format("x={}, y={}", 1));
        assertEquals("no anchors", TdiStringFormatter.format("no anchors", 1, 2));
    }

    @Test
    void escapedAnchorIsPrintedLiterally() {
        assertEquals("{} is 5", TdiStringFormatter.format("\\{} is {}", 5));
    }

    @Test
    void printsArrays() {
        assertEquals("ids=[1, 2, 3]", TdiStringFormatter.format("ids={}", (Object) new int[] {1, 2, 3}));
        assertEquals("bytes=[13, -19]", TdiStringFormatter.format("bytes={}", (Object) new byte[] {0x0D, (byte) 0xED}));
        assertEquals("names=[a, [b]]", TdiStringFormatter.format("names={}", (Object) new Object[] {"a", new String[] {"b"}}));
    }

    @Test
    void nullPattern() {
        assertNull(TdiStringFormatter.format(null, 1));
    }
}
