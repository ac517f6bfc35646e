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

package org.gearman.job;

import org.gearman.exception.GearmanMalformedJobException;
import org.gearman.serde.NullSeparated;

import java.util.List;

/**
 * Status of a job as reported by a {@code STATUS_RES} packet.
 */
public record JobStatus(String handle, boolean known, boolean running, long numerator, long denominator) {

    /**
     * Parses a payload of the form {@code handle\0known\0running\0numerator\0denominator}.
     *
     * @param payload the packet payload
     * @return the status
     */
    public static JobStatus parse(byte[] payload) {
        List<byte[]> fields = NullSeparated.split(payload, 5);
        if (fields.size() < 5) {
            throw new GearmanMalformedJobException("Status response must hold 5 fields, found " + fields.size());
        }
        try {
            return new JobStatus(
                    NullSeparated.string(fields.get(0)),
                    "1".equals(NullSeparated.string(fields.get(1))),
                    "1".equals(NullSeparated.string(fields.get(2))),
                    Long.parseLong(NullSeparated.string(fields.get(3))),
                    Long.parseLong(NullSeparated.string(fields.get(4))));
        } catch (NumberFormatException e) {
            throw new GearmanMalformedJobException("Status response carries a non-numeric progress: " + e.getMessage());
        }
    }
}
