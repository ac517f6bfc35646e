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

import org.apache.commons.lang3.ArrayUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * State of a submitted job while it runs on some worker.
 *
 * <p>Work data and warnings arrive in chunks through {@code WORK_DATA} and
 * {@code WORK_WARNING} packets. Chunks are only ever appended; the getters return the
 * concatenation of everything received so far. The {@link #result()} future completes
 * when the job reaches a terminal packet.
 *
 * <p>Not thread-safe: updated from the connection's event loop only.
 */
public final class JobHandle {

    private final String handle;
    private final List<byte[]> workData = new ArrayList<>();
    private final List<byte[]> workWarning = new ArrayList<>();
    private final CompletableFuture<byte[]> result = new CompletableFuture<>();
    private long numerator;
    private long denominator;
    private String exceptionText;

    public JobHandle(String handle) {
        this.handle = handle;
    }

    public String getHandle() {
        return handle;
    }

    public void appendWorkData(byte[] chunk) {
        workData.add(chunk.clone());
    }

    public void appendWorkWarning(byte[] chunk) {
        workWarning.add(chunk.clone());
    }

    public byte[] getWorkData() {
        return concat(workData);
    }

    public byte[] getWorkWarning() {
        return concat(workWarning);
    }

    public void updateStatus(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }

    public void recordException(String text) {
        this.exceptionText = text;
    }

    public Optional<String> getExceptionText() {
        return Optional.ofNullable(exceptionText);
    }

    /**
     * Returns the future completed with the {@code WORK_COMPLETE} data, or exceptionally
     * when the job fails or the connection is lost.
     *
     * @return the job's result
     */
    public CompletableFuture<byte[]> result() {
        return result;
    }

    private static byte[] concat(List<byte[]> chunks) {
        byte[] joined = ArrayUtils.EMPTY_BYTE_ARRAY;
        for (byte[] chunk : chunks) {
            joined = ArrayUtils.addAll(joined, chunk);
        }
        return joined;
    }

    @Override
    public String toString() {
        return "JobHandle{handle=" + handle + ", status=" + numerator + "/" + denominator + ", done=" + result.isDone()
                + "}";
    }
}
