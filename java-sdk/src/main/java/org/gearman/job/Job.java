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
 * A job handed to this worker by a {@code JOB_ASSIGN} packet.
 *
 * <p>Instances are immutable and only obtained through {@link #parse(byte[])}.
 */
public final class Job {

    private final String handle;
    private final String function;
    private final byte[] data;

    private Job(String handle, String function, byte[] data) {
        this.handle = handle;
        this.function = function;
        this.data = data;
    }

    /**
     * Parses a {@code JOB_ASSIGN} payload of the form {@code handle\0function\0data}.
     *
     * <p>Only the first two NUL bytes separate fields; the data keeps any NUL bytes it holds.
     *
     * @param payload the packet payload
     * @return the parsed job
     * @throws GearmanMalformedJobException if the payload has fewer than two separators
     */
    public static Job parse(byte[] payload) {
        List<byte[]> fields = NullSeparated.split(payload, 3);
        if (fields.size() < 3) {
            throw new GearmanMalformedJobException("Job assignment must hold handle, function and data separated by NUL,"
                    + " found " + (fields.size() - 1) + " separator(s)");
        }
        return new Job(NullSeparated.string(fields.get(0)), NullSeparated.string(fields.get(1)), fields.get(2));
    }

    public String getHandle() {
        return handle;
    }

    public String getFunction() {
        return function;
    }

    public byte[] getData() {
        return data.clone();
    }

    public String getDataAsString() {
        return NullSeparated.string(data);
    }

    public int getDataLength() {
        return data.length;
    }

    @Override
    public String toString() {
        return "Job{handle=" + handle + ", function=" + function + ", " + data.length + " bytes of data}";
    }
}
