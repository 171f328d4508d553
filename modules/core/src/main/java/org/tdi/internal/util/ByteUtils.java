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

package org.tdi.internal.util;

/**
 * Utility class provides various method for manipulating with bytes.
 */
public class ByteUtils {
    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    /**
     * Constructs {@code long} from byte array in Big Endian order.
     *
     * @param bytes Array of bytes.
     * @param off Offset in {@code bytes} array.
     * @param len Number of bytes to read, at most {@link Long#BYTES}.
     * @return Long value.
     */
    public static long bytesToLong(byte[] bytes, int off, int len) {
        assert bytes != null;
        assert len <= Long.BYTES : len;

        long res = 0;

        for (int i = 0; i < len; i++) {
            res = (res << 8) | (0xffL & bytes[off + i]);
        }

        return res;
    }

    /**
     * Writes the {@code len} least significant bytes of a {@code long} to the byte array in Big Endian order.
     *
     * @param l Long value.
     * @param bytes Destination array.
     * @param off Offset in {@code bytes} array.
     * @param len Number of bytes to write, at most {@link Long#BYTES}.
     * @return The destination array.
     */
    public static byte[] putLongToBytes(long l, byte[] bytes, int off, int len) {
        assert bytes != null;
        assert len <= Long.BYTES : len;
        assert bytes.length >= off + len;

        for (int i = off + len - 1; i >= off; i--) {
            bytes[i] = (byte) l;
            l >>>= 8;
        }

        return bytes;
    }

    /**
     * Converts a byte array into a lowercase hex string without separators.
     *
     * @param bytes Bytes.
     * @return Hex string, e.g. {@code 0dedbeef}.
     */
    public static String toHexString(byte[] bytes) {
        char[] res = new char[bytes.length * 2];

        for (int i = 0; i < bytes.length; i++) {
            res[2 * i] = HEX_DIGITS[(bytes[i] >> 4) & 0xF];
            res[2 * i + 1] = HEX_DIGITS[bytes[i] & 0xF];
        }

        return new String(res);
    }
}
