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

package org.gearman.client;

import org.apache.commons.lang3.StringUtils;
import org.gearman.exception.GearmanConnectionLostException;
import org.gearman.exception.GearmanJobFailedException;
import org.gearman.job.JobHandle;
import org.gearman.job.JobStatus;
import org.gearman.serde.CommandCode;
import org.gearman.serde.Frame;
import org.gearman.serde.NullSeparated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Submits jobs to the job server and tracks their progress.
 *
 * <p>Progress packets for foreground jobs arrive unsolicited and are routed by job handle
 * to the matching {@link JobHandle}.
 *
 * <p>Replies are matched to requests by arrival order only. A progress packet for a running
 * foreground job that arrives while {@link #submit}, {@link #submitBackground} or
 * {@link #getStatus} is waiting is taken as that request's reply: the request fails with
 * {@link org.gearman.exception.GearmanProtocolException} and the running job's result never
 * completes. Do not issue requests on a connection while its foreground jobs are running;
 * use a separate connection for status polling.
 */
public class GearmanClient {
    private static final Logger log = LoggerFactory.getLogger(GearmanClient.class);

    private final GearmanConnection connection;
    private final Map<String, JobHandle> runningJobs = new HashMap<>();
    private final UnsolicitedHandler workUpdates = new UnsolicitedHandler() {
        @Override
        public void onFrame(Frame frame) {
            handleWorkUpdate(frame);
        }

        @Override
        public void connectionLost(Throwable reason) {
            failRunningJobs(reason);
        }
    };

    public GearmanClient(GearmanConnection connection) {
        this.connection = connection;
        connection.registerUnsolicited(workUpdates);
    }

    public CompletableFuture<JobHandle> submit(String function, byte[] data) {
        return submit(function, StringUtils.EMPTY, data, JobPriority.NORMAL);
    }

    /**
     * Submits a job and waits for the server to accept it.
     *
     * @param function the registered function name
     * @param unique the unique id used by the server to coalesce identical jobs, may be empty
     * @param data the job argument
     * @param priority the queue priority
     * @return a future completed with the job handle once {@code JOB_CREATED} arrives; the
     *     handle's {@link JobHandle#result()} completes when the job finishes
     * @see GearmanClient reply ordering with running foreground jobs
     */
    public CompletableFuture<JobHandle> submit(String function, String unique, byte[] data, JobPriority priority) {
        log.debug("Submitting {} job for function {}", priority, function);
        return connection
                .send(priority.submitCommand(false), submitPayload(function, unique, data))
                .thenApply(reply -> {
                    JobHandle job = new JobHandle(jobCreated(reply));
                    runningJobs.put(job.getHandle(), job);
                    return job;
                });
    }

    public CompletableFuture<String> submitBackground(String function, byte[] data) {
        return submitBackground(function, StringUtils.EMPTY, data, JobPriority.NORMAL);
    }

    /**
     * Submits a job the client will not follow.
     *
     * @param function the registered function name
     * @param unique the unique id, may be empty
     * @param data the job argument
     * @param priority the queue priority
     * @return a future completed with the job handle assigned by the server
     * @see GearmanClient reply ordering with running foreground jobs
     */
    public CompletableFuture<String> submitBackground(
            String function, String unique, byte[] data, JobPriority priority) {
        log.debug("Submitting background {} job for function {}", priority, function);
        return connection
                .send(priority.submitCommand(true), submitPayload(function, unique, data))
                .thenApply(GearmanClient::jobCreated);
    }

    /**
     * Asks the server for the status of a job.
     *
     * @param handle the job handle
     * @return the reported status; fails with a protocol error if a progress packet of a
     *     running foreground job arrives first
     */
    public CompletableFuture<JobStatus> getStatus(String handle) {
        return connection
                .send(CommandCode.GET_STATUS, NullSeparated.bytes(handle))
                .thenApply(reply -> JobStatus.parse(
                        Replies.expect(reply, CommandCode.STATUS_RES).payload()));
    }

    public int runningJobCount() {
        return runningJobs.size();
    }

    private static byte[] submitPayload(String function, String unique, byte[] data) {
        return NullSeparated.join(NullSeparated.bytes(function), NullSeparated.bytes(unique), data);
    }

    private static String jobCreated(Frame reply) {
        return Replies.expect(reply, CommandCode.JOB_CREATED).payloadAsString();
    }

    private void handleWorkUpdate(Frame frame) {
        Optional<CommandCode> commandCode = frame.commandCode();
        if (commandCode.isEmpty()) {
            return;
        }
        switch (commandCode.get()) {
            case WORK_DATA -> withJob(frame, 2, (job, fields) -> job.appendWorkData(fields.get(1)));
            case WORK_WARNING -> withJob(frame, 2, (job, fields) -> job.appendWorkWarning(fields.get(1)));
            case WORK_STATUS -> withJob(frame, 3, (job, fields) -> job.updateStatus(
                    parseLong(fields.get(1)), parseLong(fields.get(2))));
            case WORK_COMPLETE -> withJob(frame, 2, (job, fields) -> {
                runningJobs.remove(job.getHandle());
                job.result().complete(fields.get(1));
            });
            case WORK_EXCEPTION -> withJob(frame, 2, (job, fields) -> {
                String text = NullSeparated.string(fields.get(1));
                job.recordException(text);
                runningJobs.remove(job.getHandle());
                job.result().completeExceptionally(new GearmanJobFailedException(job.getHandle(), Optional.of(text)));
            });
            case WORK_FAIL -> withJob(frame, 2, (job, fields) -> {
                runningJobs.remove(job.getHandle());
                job.result()
                        .completeExceptionally(new GearmanJobFailedException(job.getHandle(), job.getExceptionText()));
            });
            default -> {}
        }
    }

    private void withJob(Frame frame, int fieldCount, WorkUpdate update) {
        List<byte[]> fields = new ArrayList<>(NullSeparated.split(frame.payload(), fieldCount));
        while (fields.size() < fieldCount) {
            fields.add(new byte[0]);
        }
        String handle = NullSeparated.string(fields.get(0));
        JobHandle job = runningJobs.get(handle);
        if (job == null) {
            log.warn("Dropping {} for unknown job handle {}", frame, handle);
            return;
        }
        update.apply(job, fields);
    }

    private static long parseLong(byte[] value) {
        String text = NullSeparated.string(value);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric progress value '{}'", text);
            return 0;
        }
    }

    private void failRunningJobs(Throwable reason) {
        for (JobHandle job : runningJobs.values()) {
            job.result().completeExceptionally(new GearmanConnectionLostException(reason));
        }
        runningJobs.clear();
    }

    @FunctionalInterface
    private interface WorkUpdate {
        void apply(JobHandle job, List<byte[]> fields);
    }
}
