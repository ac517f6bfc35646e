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

package org.gearman.worker;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.StringUtils;
import org.gearman.client.GearmanConnection;
import org.gearman.client.Replies;
import org.gearman.client.UnsolicitedHandler;
import org.gearman.exception.GearmanConnectionLostException;
import org.gearman.exception.GearmanException;
import org.gearman.job.Job;
import org.gearman.serde.CommandCode;
import org.gearman.serde.Frame;
import org.gearman.serde.NullSeparated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Pulls jobs from the job server and runs them.
 *
 * <p>A worker grabs a job; when the server has none it declares {@code PRE_SLEEP} and waits
 * for the server's {@code NOOP} before grabbing again. At most one sleep is outstanding:
 * concurrent callers share the same wake-up.
 *
 * <p>Like its {@link GearmanConnection}, a worker must be used from a single thread.
 */
public class GearmanWorker {
    private static final Logger log = LoggerFactory.getLogger(GearmanWorker.class);

    private final GearmanConnection connection;
    private final Map<String, JobFunction> functions = new HashMap<>();
    private CompletableFuture<Void> pendingWake;

    public GearmanWorker(GearmanConnection connection) {
        this.connection = connection;
    }

    /**
     * Registers the code run for jobs of the given function and announces it with
     * {@code CAN_DO}. Registering a name again replaces the previous function.
     *
     * @param name the function name
     * @param function the code to run
     */
    public void registerFunction(String name, JobFunction function) {
        functions.put(name, function);
        connection.sendRaw(CommandCode.CAN_DO, NullSeparated.bytes(name));
        log.debug("Registered function {}", name);
    }

    public void unregisterFunction(String name) {
        functions.remove(name);
        connection.sendRaw(CommandCode.CANT_DO, NullSeparated.bytes(name));
    }

    public void resetAbilities() {
        functions.clear();
        connection.sendRaw(CommandCode.RESET_ABILITIES, ArrayUtils.EMPTY_BYTE_ARRAY);
    }

    public void setClientId(String clientId) {
        connection.sendRaw(CommandCode.SET_CLIENT_ID, NullSeparated.bytes(clientId));
    }

    public Set<String> registeredFunctions() {
        return Set.copyOf(functions.keySet());
    }

    public boolean isSleeping() {
        return pendingWake != null;
    }

    /**
     * Declares sleep and completes when the server sends {@code NOOP}.
     *
     * <p>If a sleep is already outstanding no new {@code PRE_SLEEP} is sent and the returned
     * future completes with the existing one.
     *
     * @return a future completed on wake-up, or exceptionally if the connection is lost
     */
    public CompletableFuture<Void> sleepUntilWoken() {
        if (pendingWake != null) {
            return pendingWake.copy();
        }
        CompletableFuture<Void> wake = new CompletableFuture<>();
        UnsolicitedHandler wakeHandler = new UnsolicitedHandler() {
            @Override
            public void onFrame(Frame frame) {
                if (frame.is(CommandCode.NOOP)) {
                    finishSleep(this, wake);
                    log.debug("Woken up by the server");
                    wake.complete(null);
                }
            }

            @Override
            public void connectionLost(Throwable reason) {
                finishSleep(this, wake);
                wake.completeExceptionally(new GearmanConnectionLostException(reason));
            }
        };

        connection.registerUnsolicited(wakeHandler);
        try {
            connection.preSleep();
        } catch (GearmanException e) {
            connection.unregisterUnsolicited(wakeHandler);
            return CompletableFuture.failedFuture(e);
        }
        pendingWake = wake;
        log.debug("Sleeping until the server has work");
        return wake.copy();
    }

    private void finishSleep(UnsolicitedHandler wakeHandler, CompletableFuture<Void> wake) {
        connection.unregisterUnsolicited(wakeHandler);
        if (pendingWake == wake) {
            pendingWake = null;
        }
    }

    /**
     * Obtains the next job, sleeping as long as the server has none.
     *
     * <p>When a sleep is already outstanding, the grab waits for that wake-up first.
     *
     * @return a future completed with the assigned job
     */
    public CompletableFuture<Job> getJob() {
        if (pendingWake != null) {
            return sleepUntilWoken().thenCompose(woken -> grabJob());
        }
        return grabJob();
    }

    private CompletableFuture<Job> grabJob() {
        log.debug("Grabbing a job");
        return connection
                .send(CommandCode.GRAB_JOB, ArrayUtils.EMPTY_BYTE_ARRAY)
                .thenCompose(reply -> {
                    Replies.expect(reply, CommandCode.NO_JOB, CommandCode.JOB_ASSIGN);
                    if (reply.is(CommandCode.NO_JOB)) {
                        return sleepUntilWoken().thenCompose(woken -> grabJob());
                    }
                    Job job = Job.parse(reply.payload());
                    log.debug("Assigned {}", job);
                    return CompletableFuture.completedFuture(job);
                });
    }

    /**
     * Obtains one job, runs it and reports the outcome.
     *
     * @return a future completed once the outcome has been sent
     */
    public CompletableFuture<Void> doJob() {
        return getJob().thenCompose(this::finishJob);
    }

    /**
     * Runs the function registered for the job and reports the outcome.
     *
     * <p>A failing function, or a job for a function this worker does not know, is reported
     * as {@code WORK_EXCEPTION} followed by {@code WORK_FAIL}; the failure does not
     * complete the returned future exceptionally. Only protocol errors do.
     *
     * @param job the job to run
     * @return a future completed once the outcome has been sent
     */
    public CompletableFuture<Void> finishJob(Job job) {
        try {
            JobFunction function = functions.get(job.getFunction());
            if (function == null) {
                log.warn("No function registered for {}", job);
                reportFailure(job, "No function registered under name " + job.getFunction());
                return CompletableFuture.completedFuture(null);
            }

            byte[] result;
            try {
                result = function.execute(job.getData());
            } catch (Exception e) {
                log.warn("Function {} failed for job {}", job.getFunction(), job.getHandle(), e);
                reportFailure(job, describe(e));
                return CompletableFuture.completedFuture(null);
            }
            sendJobResponse(CommandCode.WORK_COMPLETE, job, ArrayUtils.nullToEmpty(result));
            log.debug("Completed job {}", job.getHandle());
            return CompletableFuture.completedFuture(null);
        } catch (GearmanException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void reportFailure(Job job, String description) {
        sendJobResponse(CommandCode.WORK_EXCEPTION, job, NullSeparated.bytes(description));
        sendJobResponse(CommandCode.WORK_FAIL, job, ArrayUtils.EMPTY_BYTE_ARRAY);
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + "(" + StringUtils.defaultString(e.getMessage()) + ")";
    }

    /**
     * Sends {@code handle\0data} under the given packet type.
     *
     * @param kind the packet type, such as {@code WORK_COMPLETE} or {@code WORK_DATA}
     * @param job the job being reported on
     * @param data the packet data after the handle
     */
    public void sendJobResponse(CommandCode kind, Job job, byte[] data) {
        connection.sendRaw(kind, NullSeparated.join(job.getHandle(), data));
    }

    public void sendWorkData(Job job, byte[] chunk) {
        sendJobResponse(CommandCode.WORK_DATA, job, chunk);
    }

    public void sendWorkWarning(Job job, byte[] chunk) {
        sendJobResponse(CommandCode.WORK_WARNING, job, chunk);
    }

    public void sendWorkStatus(Job job, long numerator, long denominator) {
        sendJobResponse(
                CommandCode.WORK_STATUS,
                job,
                NullSeparated.join(String.valueOf(numerator), String.valueOf(denominator)));
    }
}
