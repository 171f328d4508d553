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

package org.tdi.internal.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.tdi.internal.testframework.TdiTestUtils.assertThrowsWithCode;
import static org.tdi.lang.ErrorGroups.TableData.SIZE_MISMATCH_ERR;
import static org.tdi.lang.ErrorGroups.TableData.VALUE_OUT_OF_RANGE_ERR;

import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.tdi.internal.testframework.BaseTdiAbstractTest;
import org.tdi.lang.TableDataException;

/**
 * Tests for {@link FieldCodec}.
 */
class FieldCodecTest extends BaseTdiAbstractTest {
    private static IntStream scalarWidths() {
        return IntStream.rangeClosed(1, 64);
    }

    @ParameterizedTest
    @MethodSource("scalarWidths")
    void scalarRoundTripAtBoundaries(int width) {
        long max = FieldCodec.maxValue(width);

        for (long v : new long[] {0, 1 & max, max >>> 1, max}) {
            byte[] bytes = FieldCodec.encodeScalar(width, v);

            assertEquals(FieldCodec.byteSize(width), bytes.length);
            assertEquals(v, FieldCodec.decodeScalar(width, bytes));
        }
    }

    @ParameterizedTest
    @MethodSource("scalarWidths")
    void scalarRoundTripRandom(int width) {
        Random rnd = new Random(width);

        for (int i = 0; i < 32; i++) {
            long v = rnd.nextLong() & FieldCodec.maxValue(width);

            assertEquals(v, FieldCodec.decodeScalar(width, FieldCodec.encodeScalar(width, v)));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 7, 8, 9, 28, 32, 48, 63})
    void rejectsValueJustAboveWidth(int width) {
        assertThrowsWithCode(TableDataException.class, VALUE_OUT_OF_RANGE_ERR, () -> FieldCodec.encodeScalar(width, 1L << width));
    }

    @Test
    void encodesNetworkOrderWithPadding() {
        assertArrayEquals(new byte[] {(byte) 200}, FieldCodec.encodeScalar(8, 200));
        assertArrayEquals(new byte[] {0x01, 0x00}, FieldCodec.encodeScalar(9, 256));
        assertArrayEquals(new byte[] {0x0D, (byte) 0xED, (byte) 0xBE, (byte) 0xEF}, FieldCodec.encodeScalar(28, 0x0DEDBEEFL));
        assertArrayEquals(new byte[] {-1, -1, -1, -1, -1, -1, -1, -1}, FieldCodec.encodeScalar(64, -1L));
    }

    @Test
    void rejectsOverflowForEightBitField() {
        assertThrowsWithCode(TableDataException.class, VALUE_OUT_OF_RANGE_ERR, () -> FieldCodec.encodeScalar(8, 256), "width=8");
    }

    @Test
    void rejectsSetPaddingBits() {
        assertThrowsWithCode(TableDataException.class, VALUE_OUT_OF_RANGE_ERR,
                () -> FieldCodec.decodeScalar(28, new byte[] {0x1D, 0, 0, 0}));
        assertThrowsWithCode(TableDataException.class, VALUE_OUT_OF_RANGE_ERR,
                () -> FieldCodec.encodeBytes(9, new byte[] {0x02, 0}, 2));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 7, 8, 9, 28, 64, 65})
    void rejectsWrongByteSize(int width) {
        int size = FieldCodec.byteSize(width);
        byte[] buf = new byte[size + 1];

        assertThrowsWithCode(TableDataException.class, SIZE_MISMATCH_ERR, () -> FieldCodec.encodeBytes(width, buf, size + 1));
        assertThrowsWithCode(TableDataException.class, SIZE_MISMATCH_ERR, () -> FieldCodec.encodeBytes(width, buf, size - 1));

        byte[] stored = FieldCodec.encodeBytes(width, buf, size);

        assertThrowsWithCode(TableDataException.class, SIZE_MISMATCH_ERR, () -> FieldCodec.decodeBytes(width, stored, size + 1, buf));
        assertThrowsWithCode(TableDataException.class, SIZE_MISMATCH_ERR, () -> FieldCodec.decodeBytes(width, stored, 0, buf));
    }

    @Test
    void rejectsWrongScalarArrayLength() {
        assertThrowsWithCode(TableDataException.class, SIZE_MISMATCH_ERR, () -> FieldCodec.decodeScalar(28, new byte[3]));
    }

    @Test
    void copiesBytesOfWideField() {
        byte[] value = new byte[17];
        value[0] = 0x01;
        value[16] = 0x7F;

        byte[] stored = FieldCodec.encodeBytes(129, value, 17);

        value[16] = 0;

        byte[] dst = new byte[17];

        assertSame(dst, FieldCodec.decodeBytes(129, stored, 17, dst));
        assertEquals(0x7F, dst[16]);
        assertEquals(0x01, dst[0]);
    }

    @Test
    void rejectsShortBuffer() {
        assertThrowsWithCode(TableDataException.class, SIZE_MISMATCH_ERR, () -> FieldCodec.encodeBytes(28, new byte[2], 4));
    }

    @Test
    void rejectsInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> FieldCodec.encodeScalar(0, 0));
        assertThrows(IllegalArgumentException.class, () -> FieldCodec.encodeScalar(65, 0));
        assertThrows(IllegalArgumentException.class, () -> FieldCodec.byteSize(-1));
    }
}
