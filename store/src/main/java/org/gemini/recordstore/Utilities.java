/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package org.gemini.recordstore;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

public class Utilities {
    private Utilities() {}

    /** stuff val into array[startPos], array[startPos+1], ..., array[startPos+7] */
    public static void longToByteArray(long val, byte[] array, int startPos) {
        array[startPos    ] = (byte) ((val >> 56) & 0xFFL);
        array[startPos + 1] = (byte) ((val >> 48) & 0xFFL);
        array[startPos + 2] = (byte) ((val >> 40) & 0xFFL);
        array[startPos + 3] = (byte) ((val >> 32) & 0xFFL);
        array[startPos + 4] = (byte) ((val >> 24) & 0xFFL);
        array[startPos + 5] = (byte) ((val >> 16) & 0xFFL);
        array[startPos + 6] = (byte) ((val >> 8)  & 0xFFL);
        array[startPos + 7] = (byte)  (val        & 0xFFL);
    }

    /** return the long represented by array[startPos], array[startPos+1], ..., array[startPos+7] */
    public static long byteArrayToLong(byte[] array, int startPos) {
        return
                (((long) array[startPos    ] & 0xFFL) << 56) |
                (((long) array[startPos + 1] & 0xFFL) << 48) |
                (((long) array[startPos + 2] & 0xFFL) << 40) |
                (((long) array[startPos + 3] & 0xFFL) << 32) |
                (((long) array[startPos + 4] & 0xFFL) << 24) |
                (((long) array[startPos + 5] & 0xFFL) << 16) |
                (((long) array[startPos + 6] & 0xFFL) << 8) |
                ((long)  array[startPos + 7] & 0xFFL);
    }

    /**
     * Like longToByteArray, but flips the sign bit so that unsigned byte-wise comparison of the output orders
     * negative values (pre-1970 timestamps) before positive ones.
     */
    public static void orderedLongToByteArray(long val, byte[] array, int startPos) {
        longToByteArray(val ^ Long.MIN_VALUE, array, startPos);
    }

    public static long orderedByteArrayToLong(byte[] array, int startPos) {
        return byteArrayToLong(array, startPos) ^ Long.MIN_VALUE;
    }

    public static void uuidToByteArray(UUID uuid, byte[] array, int startPos) {
        longToByteArray(uuid.getMostSignificantBits(), array, startPos);
        longToByteArray(uuid.getLeastSignificantBits(), array, startPos + 8);
    }

    public static UUID byteArrayToUUID(byte[] array, int startPos) {
        return new UUID(byteArrayToLong(array, startPos), byteArrayToLong(array, startPos + 8));
    }

    /** Timestamps are stored with microsecond precision */
    public static long toEpochMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
    }

    public static Instant fromEpochMicros(long micros) {
        return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
    }

    public static Instant truncateToMicros(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    /** true if key starts with prefix */
    public static boolean hasPrefix(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; ++i) {
            if (key[i] != prefix[i]) return false;
        }
        return true;
    }
}
