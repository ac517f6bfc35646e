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

import java.util.Optional;

/**
 * The two 4-byte markers that open every Gearman packet.
 */
public enum Magic {
    /** {@code \0REQ}, sent by clients and workers. */
    REQUEST(0x00524551),
    /** {@code \0RES}, sent by the job server. */
    RESPONSE(0x00524553);

    private final int value;

    Magic(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Returns the marker matching the raw header value, or empty when the value is not a
     * Gearman marker.
     *
     * @param value the first four header bytes read as a big-endian int
     * @return the matching marker
     */
    public static Optional<Magic> fromValue(int value) {
        for (Magic magic : values()) {
            if (magic.value == value) {
                return Optional.of(magic);
            }
        }
        return Optional.empty();
    }
}
