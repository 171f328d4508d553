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

import static org.tdi.lang.ErrorGroups.TableData.SIZE_MISMATCH_ERR;
import static org.tdi.lang.ErrorGroups.TableData.VALUE_OUT_OF_RANGE_ERR;

import java.util.Arrays;
import org.tdi.internal.util.ByteUtils;
import org.tdi.lang.TableDataException;

/**
 * Packs unsigned field values of arbitrary bit width into network order byte arrays and back.
 *
 * <p>A value of width {@code w} occupies {@code ceil(w / 8)} bytes, most significant byte first. The unused high-order bits of the
 * first byte are padding and must be zero.
 */
public final class FieldCodec {
    /** Widest field representable by a {@code long}. */
    public static final int MAX_SCALAR_WIDTH = Long.SIZE;

    private FieldCodec() {
    }

    /**
     * Returns the number of bytes a field of the given width occupies.
     *
     * @param widthBits Field width in bits.
     * @return Byte-padded size.
     */
    public static int byteSize(int widthBits) {
        checkWidth(widthBits);

        return (widthBits + Byte.SIZE - 1) / Byte.SIZE;
    }

    /**
     * Returns the largest unsigned value of the given width. For a 64-bit width the result is {@code -1L}, that is {@code 2^64 - 1}
     * interpreted as unsigned.
     *
     * @param widthBits Field width in bits, from 1 to 64.
     * @return Largest value.
     */
    public static long maxValue(int widthBits) {
        checkScalarWidth(widthBits);

        return widthBits == MAX_SCALAR_WIDTH ? -1L : (1L << widthBits) - 1;
    }

    /**
     * Checks that an unsigned value fits into the given width.
     *
     * @param widthBits Field width in bits, from 1 to 64.
     * @param value Unsigned value.
     * @return {@code true} if the value fits.
     */
    public static boolean fits(int widthBits, long value) {
        checkScalarWidth(widthBits);

        return widthBits == MAX_SCALAR_WIDTH || (value >>> widthBits) == 0;
    }

    /**
     * Encodes an unsigned value into a network order byte array of {@link #byteSize(int)} bytes.
     *
     * @param widthBits Field width in bits, from 1 to 64.
     * @param value Unsigned value.
     * @return Encoded bytes.
     * @throws TableDataException With {@code VALUE_OUT_OF_RANGE_ERR} if the value needs more than {@code widthBits} bits.
     */
    public static byte[] encodeScalar(int widthBits, long value) {
        if (!fits(widthBits, value)) {
            throw new TableDataException(VALUE_OUT_OF_RANGE_ERR, "Value does not fit into the field width [width=" + widthBits
                    + ", value=" + Long.toUnsignedString(value) + ']');
        }

        int size = byteSize(widthBits);

        return ByteUtils.putLongToBytes(value, new byte[size], 0, size);
    }

    /**
     * Decodes an unsigned value from a network order byte array.
     *
     * @param widthBits Field width in bits, from 1 to 64.
     * @param bytes Encoded bytes, exactly {@link #byteSize(int)} long.
     * @return Unsigned value.
     * @throws TableDataException With {@code SIZE_MISMATCH_ERR} for a wrong array length, with {@code VALUE_OUT_OF_RANGE_ERR} if padding
     *      bits are set.
     */
    public static long decodeScalar(int widthBits, byte[] bytes) {
        checkScalarWidth(widthBits);
        checkSize(widthBits, bytes.length);
        checkPadding(widthBits, bytes);

        return ByteUtils.bytesToLong(bytes, 0, bytes.length);
    }

    /**
     * Validates and copies a caller buffer holding a value of the given width.
     *
     * @param widthBits Field width in bits, any positive value.
     * @param buf Caller buffer, at least {@code size} bytes long.
     * @param size Number of meaningful bytes in {@code buf}.
     * @return Copy of the first {@code size} bytes.
     * @throws TableDataException With {@code SIZE_MISMATCH_ERR} if {@code size} is not the byte-padded width or exceeds the buffer, with
     *      {@code VALUE_OUT_OF_RANGE_ERR} if padding bits are set.
     */
    public static byte[] encodeBytes(int widthBits, byte[] buf, int size) {
        checkSize(widthBits, size);

        if (buf.length < size) {
            throw new TableDataException(SIZE_MISMATCH_ERR, "Buffer is shorter than the declared size [size=" + size
                    + ", bufferLength=" + buf.length + ']');
        }

        byte[] res = Arrays.copyOf(buf, size);

        checkPadding(widthBits, res);

        return res;
    }

    /**
     * Copies a stored value of the given width into a caller buffer.
     *
     * @param widthBits Field width in bits, any positive value.
     * @param stored Stored bytes, {@link #byteSize(int)} long.
     * @param size Requested size.
     * @param dst Destination buffer, at least {@code size} bytes long.
     * @return The destination buffer.
     * @throws TableDataException With {@code SIZE_MISMATCH_ERR} if {@code size} is not the byte-padded width or exceeds the buffer.
     */
    public static byte[] decodeBytes(int widthBits, byte[] stored, int size, byte[] dst) {
        checkSize(widthBits, size);

        if (dst.length < size) {
            throw new TableDataException(SIZE_MISMATCH_ERR, "Destination buffer is too short [size=" + size
                    + ", bufferLength=" + dst.length + ']');
        }

        assert stored.length == size : "Stored value has unexpected length: " + stored.length;

        System.arraycopy(stored, 0, dst, 0, size);

        return dst;
    }

    /**
     * Checks that a buffer size is the byte-padded size of a field width.
     *
     * @param widthBits Field width in bits, any positive value.
     * @param size Buffer size.
     * @throws TableDataException With {@code SIZE_MISMATCH_ERR} if the size does not match.
     */
    public static void checkSize(int widthBits, int size) {
        int expected = byteSize(widthBits);

        if (size != expected) {
            throw new TableDataException(SIZE_MISMATCH_ERR, "Size does not match the field width [width=" + widthBits
                    + ", expectedSize=" + expected + ", size=" + size + ']');
        }
    }

    private static void checkPadding(int widthBits, byte[] bytes) {
        int padBits = bytes.length * Byte.SIZE - widthBits;

        if (padBits > 0 && ((bytes[0] & 0xFF) >>> (Byte.SIZE - padBits)) != 0) {
            throw new TableDataException(VALUE_OUT_OF_RANGE_ERR, "Value does not fit into the field width [width=" + widthBits
                    + ", value=0x" + ByteUtils.toHexString(bytes) + ']');
        }
    }

    private static void checkWidth(int widthBits) {
        if (widthBits < 1) {
            throw new IllegalArgumentException("Field width must be positive: " + widthBits);
        }
    }

    private static void checkScalarWidth(int widthBits) {
        if (widthBits < 1 || widthBits > MAX_SCALAR_WIDTH) {
            throw new IllegalArgumentException("Scalar field width must be in range [1, 64]: " + widthBits);
        }
    }
}
