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

import org.gearman.exception.GearmanConnectionLostException;
import org.gearman.exception.GearmanJobFailedException;
import org.gearman.exception.GearmanProtocolException;
import org.gearman.exception.GearmanServerException;
import org.gearman.job.JobHandle;
import org.gearman.job.JobStatus;
import org.gearman.serde.CommandCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class GearmanClientTest {

    private RecordingTransport transport;
    private GearmanConnection connection;
    private GearmanClient client;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        connection = new GearmanConnection(transport);
        client = new GearmanClient(connection);
    }

    private void receive(CommandCode command, String payload) {
        connection.onDataReceived(RecordingTransport.response(command, payload));
    }

    private JobHandle submitted(String handle) {
        CompletableFuture<JobHandle> future = client.submit("reverse", "abc".getBytes(StandardCharsets.UTF_8));
        receive(CommandCode.JOB_CREATED, handle);
        return future.join();
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Nested
    class Submitting {

        @Test
        void shouldSendFunctionUniqueAndData() {
            // when
            client.submit("reverse", "id-1", "abc".getBytes(StandardCharsets.UTF_8), JobPriority.HIGH);

            // then
            transport.assertWritten(CommandCode.SUBMIT_JOB_HIGH, "reverse\0id-1\0abc");
        }

        @Test
        void shouldResolveHandleFromJobCreated() {
            // when
            JobHandle job = submitted("H:lap:1");

            // then
            transport.assertWritten(CommandCode.SUBMIT_JOB, "reverse\0\0abc");
            assertThat(job.getHandle()).isEqualTo("H:lap:1");
            assertThat(job.result()).isNotDone();
            assertThat(client.runningJobCount()).isEqualTo(1);
        }

        @Test
        void shouldSubmitBackgroundJobs() {
            // given
            CompletableFuture<String> handle =
                    client.submitBackground("reverse", "", "abc".getBytes(StandardCharsets.UTF_8), JobPriority.LOW);

            // when
            receive(CommandCode.JOB_CREATED, "H:lap:2");

            // then
            transport.assertWritten(CommandCode.SUBMIT_JOB_LOW_BG, "reverse\0\0abc");
            assertThat(handle).isCompletedWithValue("H:lap:2");
            assertThat(client.runningJobCount()).isZero();
        }

        @Test
        void shouldFailOnServerError() {
            // given
            CompletableFuture<JobHandle> future = client.submit("reverse", "abc".getBytes(StandardCharsets.UTF_8));

            // when
            receive(CommandCode.ERROR, "ERR_QUEUE_FULL\0queue is full");

            // then
            assertThat(future)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanServerException.class)
                    .withMessageContaining("Server error [code=ERR_QUEUE_FULL]: queue is full");
        }

        @Test
        void shouldFailOnUnexpectedReply() {
            // given
            CompletableFuture<JobHandle> future = client.submit("reverse", "abc".getBytes(StandardCharsets.UTF_8));

            // when
            receive(CommandCode.NO_JOB, "");

            // then
            assertThat(future)
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanProtocolException.class);
        }
    }

    @Nested
    class Progress {

        @Test
        void shouldAccumulateDataWarningsAndStatus() {
            // given
            JobHandle job = submitted("H:1");

            // when
            receive(CommandCode.WORK_DATA, "H:1\0cb");
            receive(CommandCode.WORK_WARNING, "H:1\0slow");
            receive(CommandCode.WORK_DATA, "H:1\0a");
            receive(CommandCode.WORK_STATUS, "H:1\0" + "1\0" + "2");

            // then
            assertThat(text(job.getWorkData())).isEqualTo("cba");
            assertThat(text(job.getWorkWarning())).isEqualTo("slow");
            assertThat(job.getNumerator()).isEqualTo(1);
            assertThat(job.getDenominator()).isEqualTo(2);
            assertThat(job.result()).isNotDone();
        }

        @Test
        void shouldCompleteResultAndForgetJob() {
            // given
            JobHandle job = submitted("H:1");

            // when
            receive(CommandCode.WORK_COMPLETE, "H:1\0cba");

            // then
            assertThat(text(job.result().join())).isEqualTo("cba");
            assertThat(client.runningJobCount()).isZero();
        }

        @Test
        void shouldFailResultOnWorkFail() {
            // given
            JobHandle job = submitted("H:1");

            // when
            receive(CommandCode.WORK_FAIL, "H:1");

            // then
            assertThat(job.result())
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanJobFailedException.class);
            assertThat(client.runningJobCount()).isZero();
        }

        @Test
        void shouldFailResultWithExceptionText() {
            // given
            JobHandle job = submitted("H:1");

            // when
            receive(CommandCode.WORK_EXCEPTION, "H:1\0Exception(failed)");
            receive(CommandCode.WORK_FAIL, "H:1\0");

            // then
            assertThat(job.getExceptionText()).contains("Exception(failed)");
            assertThat(job.result())
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanJobFailedException.class)
                    .withMessageContaining("Job H:1 failed: Exception(failed)");
        }

        @Test
        void shouldRouteUpdatesByHandle() {
            // given
            JobHandle first = submitted("H:1");
            JobHandle second = submitted("H:2");

            // when
            receive(CommandCode.WORK_COMPLETE, "H:2\0two");
            receive(CommandCode.WORK_DATA, "H:1\0one");

            // then
            assertThat(text(second.result().join())).isEqualTo("two");
            assertThat(text(first.getWorkData())).isEqualTo("one");
            assertThat(first.result()).isNotDone();
        }

        @Test
        void shouldIgnoreUpdatesForUnknownHandles() {
            // given
            JobHandle job = submitted("H:1");

            // when
            receive(CommandCode.WORK_COMPLETE, "H:404\0nothing");

            // then
            assertThat(job.result()).isNotDone();
            assertThat(client.runningJobCount()).isEqualTo(1);
        }

        @Test
        void shouldFailRunningJobsWhenConnectionIsLost() {
            // given
            JobHandle job = submitted("H:1");

            // when
            connection.onConnectionLost(new IOException("closed"));

            // then
            assertThat(job.result())
                    .failsWithin(Duration.ZERO)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(GearmanConnectionLostException.class);
            assertThat(client.runningJobCount()).isZero();
        }
    }

    @Test
    void shouldQueryJobStatus() {
        // given
        CompletableFuture<JobStatus> status = client.getStatus("H:1");

        // when
        receive(CommandCode.STATUS_RES, "H:1\0" + "1\0" + "1\0" + "5\0" + "10");

        // then
        transport.assertWritten(CommandCode.GET_STATUS, "H:1");
        assertThat(status).isCompletedWithValue(new JobStatus("H:1", true, true, 5, 10));
    }

    @Test
    void shouldTakeProgressPacketAsReplyWhileRequestIsOutstanding() {
        // given
        JobHandle job = submitted("H:1");
        CompletableFuture<JobStatus> status = client.getStatus("H:1");

        // when
        receive(CommandCode.WORK_COMPLETE, "H:1\0done");

        // then
        assertThat(status)
                .failsWithin(Duration.ZERO)
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(GearmanProtocolException.class);
        assertThat(job.result()).isNotDone();
        assertThat(client.runningJobCount()).isEqualTo(1);
    }
}
