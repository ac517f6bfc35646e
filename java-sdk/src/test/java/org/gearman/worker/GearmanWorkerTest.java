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

import org.gearman.client.GearmanConnection;
import org.gearman.client.RecordingTransport;
import org.gearman.exception.GearmanConnectionLostException;
import org.gearman.exception.GearmanMalformedJobException;
import org.gearman.exception.GearmanNotConnectedException;
import org.gearman.exception.GearmanServerException;
import org.gearman.job.Job;
import org.gearman.serde.CommandCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class GearmanWorkerTest {

    private RecordingTransport transport;
    private GearmanConnection connection;
    private GearmanWorker worker;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        connection = new GearmanConnection(transport);
        worker = new GearmanWorker(connection);
    }

    private void receive(CommandCode command, String payload) {
        connection.onDataReceived(RecordingTransport.response(command, payload));
    }

    private static Job job(String payload) {
        return Job.parse(payload.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] upper(byte[] data) {
        return new String(data, StandardCharsets.UTF_8).toUpperCase().getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    class Abilities {

        @Test
        void shouldAnnounceRegisteredFunction() {
            // when
            worker.registerFunction("awesomeness", data -> data);

            // then
            transport.assertWritten(CommandCode.CAN_DO, "awesomeness");
            assertThat(worker.registeredFunctions()).containsExactly("awesomeness");
        }

        @Test
        void shouldReplaceFunctionRegisteredUnderSameName() {
            // given
            worker.registerFunction("blah", data -> "first".getBytes(StandardCharsets.UTF_8));
            worker.registerFunction("blah", data -> "second".getBytes(StandardCharsets.UTF_8));
            transport.assertWritten(CommandCode.CAN_DO, "blah");
            transport.assertWritten(CommandCode.CAN_DO, "blah");

            // when
            worker.finishJob(job("test\0blah\0junk"));

            // then
            transport.assertWritten(CommandCode.WORK_COMPLETE, "test\0second");
        }

        @Test
        void shouldWithdrawFunction() {
            // given
            worker.registerFunction("blah", data -> data);
            transport.assertWritten(CommandCode.CAN_DO, "blah");

            // when
            worker.unregisterFunction("blah");

            // then
            transport.assertWritten(CommandCode.CANT_DO, "blah");
            assertThat(worker.registeredFunctions()).isEmpty();
        }

        @Test
        void shouldResetAbilities() {
            // given
            worker.registerFunction("a", data -> data);
            worker.registerFunction("b", data -> data);

            // when
            worker.resetAbilities();

            // then
            transport.assertWritten(CommandCode.CAN_DO, "a");
            transport.assertWritten(CommandCode.CAN_DO, "b");
            transport.assertWritten(CommandCode.RESET_ABILITIES, "");
            assertThat(worker.registeredFunctions()).isEmpty();
        }

        @Test
        void shouldSendClientId() {
            // when
            worker.setClientId("worker-7");

            // then
            transport.assertWritten(CommandCode.SET_CLIENT_ID, "worker-7");
        }
    }

    @Nested
    class Sleeping {

        @Test
        void shouldCoalesceConcurrentSleeps() {
            // given
            List<CompletableFuture<Void>> sleeps = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                sleeps.add(worker.sleepUntilWoken());
            }

            // then
            transport.assertWritten(CommandCode.PRE_SLEEP, "");
            transport.assertNothingWritten();
            assertThat(worker.isSleeping()).isTrue();
            assertThat(connection.unsolicitedHandlerCount()).isEqualTo(1);

            // when
            receive(CommandCode.NOOP, "");

            // then
            assertThat(sleeps).allSatisfy(sleep -> assertThat(sleep).isCompleted());
            assertThat(worker.isSleeping()).isFalse();
            assertThat(connection.unsolicitedHandlerCount()).isZero();
        }

        @Test
        void shouldIgnoreUnsolicitedPacketsOtherThanNoop() {
            // given
            CompletableFuture<Void> sleep = worker.sleepUntilWoken();

            // when
            receive(CommandCode.WORK_COMPLETE, "H:1\0");

            // then
            assertThat(sleep).isNotDone();
            assertThat(worker.isSleeping()).isTrue();
        }

        @Test
        void shouldDeclareSleepAgainAfterWakeUp() {
            // given
            worker.sleepUntilWoken();
            receive(CommandCode.NOOP, "");

            // when
            worker.sleepUntilWoken();

            // then
            transport.assertWritten(CommandCode.PRE_SLEEP, "");
            transport.assertWritten(CommandCode.PRE_SLEEP, "");
        }

        @Test
        void shouldFailSleepWhenConnectionIsLost() {
            // given
            CompletableFuture<Void> sleep = worker.sleepUntilWoken();

            // when
            connection.onConnectionLost(new IOException("closed"));

            // then
            assertThat(sleep)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanConnectionLostException.class);
            assertThat(worker.isSleeping()).isFalse();
        }

        @Test
        void shouldFailSleepWhenNotConnected() {
            // given
            connection.onConnectionLost(new IOException("closed"));

            // when
            CompletableFuture<Void> sleep = worker.sleepUntilWoken();

            // then
            assertThat(sleep)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanNotConnectedException.class);
            assertThat(worker.isSleeping()).isFalse();
            assertThat(connection.unsolicitedHandlerCount()).isZero();
        }
    }

    @Nested
    class GrabbingJobs {

        @Test
        void shouldReturnAssignedJob() {
            // given
            CompletableFuture<Job> future = worker.getJob();
            transport.assertWritten(CommandCode.GRAB_JOB, "");

            // when
            receive(CommandCode.JOB_ASSIGN, "footdle\0funk\0args and stuff");

            // then
            Job job = future.join();
            assertThat(job.getHandle()).isEqualTo("footdle");
            assertThat(job.getFunction()).isEqualTo("funk");
            assertThat(job.getDataAsString()).isEqualTo("args and stuff");
        }

        @Test
        void shouldSleepAndRetryWhenNoJobIsAvailable() {
            // given
            CompletableFuture<Job> future = worker.getJob();

            // when
            receive(CommandCode.NO_JOB, "");

            // then
            assertThat(future).isNotDone();
            assertThat(worker.isSleeping()).isTrue();

            // when
            receive(CommandCode.NOOP, "");
            receive(CommandCode.JOB_ASSIGN, "footdle\0funk\0args and stuff");

            // then
            assertThat(future.join().getHandle()).isEqualTo("footdle");
            transport.assertWritten(CommandCode.GRAB_JOB, "");
            transport.assertWritten(CommandCode.PRE_SLEEP, "");
            transport.assertWritten(CommandCode.GRAB_JOB, "");
            transport.assertNothingWritten();
        }

        @Test
        void shouldJoinPendingSleepInsteadOfGrabbing() {
            // given
            CompletableFuture<Void> sleep = worker.sleepUntilWoken();

            // when
            CompletableFuture<Job> future = worker.getJob();

            // then
            transport.assertWritten(CommandCode.PRE_SLEEP, "");
            transport.assertNothingWritten();

            // when
            receive(CommandCode.NOOP, "");

            // then
            assertThat(sleep).isCompleted();
            transport.assertWritten(CommandCode.GRAB_JOB, "");

            // when
            receive(CommandCode.JOB_ASSIGN, "footdle\0funk\0args and stuff");

            // then
            assertThat(future.join().getFunction()).isEqualTo("funk");
        }

        @Test
        void shouldFailOnMalformedAssignmentAndKeepConnectionUsable() {
            // given
            CompletableFuture<Job> future = worker.getJob();

            // when
            receive(CommandCode.JOB_ASSIGN, "no separators");

            // then
            assertThat(future)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanMalformedJobException.class);
            assertThat(connection.isConnected()).isTrue();
            assertThat(connection.pendingRequestCount()).isZero();
        }

        @Test
        void shouldFailWhenServerAnswersWithError() {
            // given
            CompletableFuture<Job> future = worker.getJob();

            // when
            receive(CommandCode.ERROR, "ERR_UNKNOWN\0something broke");

            // then
            assertThat(future)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanServerException.class)
                    .withMessageContaining("something broke");
        }

        @Test
        void shouldFailWhenConnectionIsLostWhileSleeping() {
            // given
            CompletableFuture<Job> future = worker.getJob();
            receive(CommandCode.NO_JOB, "");

            // when
            connection.onConnectionLost(new IOException("closed"));

            // then
            assertThat(future)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanConnectionLostException.class);
        }
    }

    @Nested
    class Reporting {

        @Test
        void shouldSendJobResponseAfterHandle() {
            // when
            worker.sendJobResponse(
                    CommandCode.WORK_COMPLETE,
                    job("test\0blah\0junk"),
                    "the value".getBytes(StandardCharsets.UTF_8));

            // then
            transport.assertWritten(CommandCode.WORK_COMPLETE, "test\0the value");
        }

        @Test
        void shouldCompleteWithFunctionResult() {
            // given
            worker.registerFunction("blah", GearmanWorkerTest::upper);
            transport.assertWritten(CommandCode.CAN_DO, "blah");

            // when
            CompletableFuture<Void> finished = worker.finishJob(job("test\0blah\0junk"));

            // then
            assertThat(finished).isCompleted();
            transport.assertWritten(CommandCode.WORK_COMPLETE, "test\0JUNK");
        }

        @Test
        void shouldCompleteWithHandleOnlyWhenFunctionReturnsNull() {
            // given
            worker.registerFunction("blah", data -> null);
            transport.assertWritten(CommandCode.CAN_DO, "blah");

            // when
            worker.finishJob(job("test\0blah\0junk"));

            // then
            transport.assertWritten(CommandCode.WORK_COMPLETE, "test\0");
        }

        @Test
        void shouldReportExceptionThenFailureWhenFunctionThrows() {
            // given
            worker.registerFunction("blah", data -> {
                throw new Exception("failed");
            });
            transport.assertWritten(CommandCode.CAN_DO, "blah");

            // when
            CompletableFuture<Void> finished = worker.finishJob(job("test\0blah\0junk"));

            // then
            assertThat(finished).isCompleted();
            transport.assertWritten(CommandCode.WORK_EXCEPTION, "test\0Exception(failed)");
            transport.assertWritten(CommandCode.WORK_FAIL, "test\0");
            transport.assertNothingWritten();
        }

        @Test
        void shouldReportFailureForUnknownFunction() {
            // when
            CompletableFuture<Void> finished = worker.finishJob(job("test\0missing\0junk"));

            // then
            assertThat(finished).isCompleted();
            transport.assertWritten(CommandCode.WORK_EXCEPTION, "test\0No function registered under name missing");
            transport.assertWritten(CommandCode.WORK_FAIL, "test\0");
        }

        @Test
        void shouldFailWhenReportingOnLostConnection() {
            // given
            worker.registerFunction("blah", GearmanWorkerTest::upper);
            connection.onConnectionLost(new IOException("closed"));

            // when
            CompletableFuture<Void> finished = worker.finishJob(job("test\0blah\0junk"));

            // then
            assertThat(finished)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanNotConnectedException.class);
        }

        @Test
        void shouldSendProgressPackets() {
            // given
            Job job = job("H:7\0blah\0junk");

            // when
            worker.sendWorkData(job, "partial".getBytes(StandardCharsets.UTF_8));
            worker.sendWorkWarning(job, "careful".getBytes(StandardCharsets.UTF_8));
            worker.sendWorkStatus(job, 3, 10);

            // then
            transport.assertWritten(CommandCode.WORK_DATA, "H:7\0partial");
            transport.assertWritten(CommandCode.WORK_WARNING, "H:7\0careful");
            transport.assertWritten(CommandCode.WORK_STATUS, "H:7\0" + "3\0" + "10");
        }
    }

    @Test
    void shouldGrabRunAndCompleteJob() {
        // given
        worker.registerFunction("blah", GearmanWorkerTest::upper);
        transport.assertWritten(CommandCode.CAN_DO, "blah");

        // when
        CompletableFuture<Void> done = worker.doJob();
        receive(CommandCode.JOB_ASSIGN, "footdle\0blah\0args and stuff");

        // then
        assertThat(done).isCompleted();
        transport.assertWritten(CommandCode.GRAB_JOB, "");
        transport.assertWritten(CommandCode.WORK_COMPLETE, "footdle\0ARGS AND STUFF");
        transport.assertNothingWritten();
    }
}
