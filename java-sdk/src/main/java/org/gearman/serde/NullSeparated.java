/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.gearman.serde;

import org.apache.commons.lang3.ArrayUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the NUL-separated argument lists carried in packet payloads.
 *
 * <p>The last argument of a payload is opaque and is never split, so it may contain NUL
 * bytes of its own.
 */
public final class NullSeparated {

    public static final byte SEPARATOR = 0;

    private NullSeparated() {}

    public static byte[] join(byte[]... fields) {
        byte[] result = ArrayUtils.EMPTY_BYTE_ARRAY;
        for (int i = 0; i < fields.length; i++) {
            if (i > 0) {
                result = ArrayUtils.add(result, SEPARATOR);
            }
            result = ArrayUtils.addAll(result, fields[i]);
        }
        return result;
    }

    public static byte[] join(String first, byte[] rest) {
        return join(bytes(first), rest);
    }

    public static byte[] join(String... fields) {
        byte[][] encoded = new byte[fields.length][];
        for (int i = 0; i < fields.length; i++) {
            encoded[i] = bytes(fields[i]);
        }
        return join(encoded);
    }

    /**
     * Splits a payload into at most {@code maxFields} arguments.
     *
     * <p>The returned list is shorter than {@code maxFields} when the payload holds fewer
     * separators; callers decide whether that is an error.
     *
     * @param payload the packet payload
     * @param maxFields the number of arguments the packet type defines
     * @return the arguments in order
     */
    public static List<byte[]> split(byte[] payload, int maxFields) {
        List<byte[]> fields = new ArrayList<>(maxFields);
        int start = 0;
        while (fields.size() < maxFields - 1) {
            int separator = ArrayUtils.indexOf(payload, SEPARATOR, start);
            if (separator == ArrayUtils.INDEX_NOT_FOUND) {
                break;
            }
            fields.add(ArrayUtils.subarray(payload, start, separator));
            start = separator + 1;
        }
        fields.add(ArrayUtils.subarray(payload, start, payload.length));
        return fields;
    }

    public static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static String string(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
