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

package org.gearman.examples;

import org.gearman.client.JobPriority;
import org.gearman.client.tcp.GearmanTcpClient;
import org.gearman.job.JobHandle;
import org.gearman.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits a foreground job to the {@code upper} function and waits for the result, then
 * submits a background job and polls its status once.
 */
public final class SubmitJobExample {

    private static final Logger log = LoggerFactory.getLogger(SubmitJobExample.class);

    private SubmitJobExample() {}

    public static void main(String[] args) throws ExecutionException, InterruptedException, TimeoutException {
        String host = args.length > 0 ? args[0] : "localhost";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 4730;
        String text = args.length > 2 ? args[2] : "hello gearman";

        GearmanTcpClient client = GearmanTcpClient.builder()
                .host(host)
                .port(port)
                .buildAndConnect()
                .get(5, TimeUnit.SECONDS);

        try {
            log.info("Connected to {}:{}, round trip check...", host, port);
            client.echo().get(5, TimeUnit.SECONDS);

            byte[] data = text.getBytes(StandardCharsets.UTF_8);
            JobHandle job = client.submit(UppercaseWorker.FUNCTION_NAME, data).get(5, TimeUnit.SECONDS);
            log.info("Job created: {}", job.getHandle());

            byte[] result = job.result().get(30, TimeUnit.SECONDS);
            log.info("Result: {}", new String(result, StandardCharsets.UTF_8));
            if (job.getWorkWarning().length > 0) {
                log.warn("Worker warnings: {}", new String(job.getWorkWarning(), StandardCharsets.UTF_8));
            }

            String background = client.onEventLoop(() -> client.client()
                            .submitBackground(
                                    UppercaseWorker.FUNCTION_NAME,
                                    UUID.randomUUID().toString(),
                                    data,
                                    JobPriority.LOW))
                    .get(5, TimeUnit.SECONDS);
            JobStatus status = client.onEventLoop(() -> client.client().getStatus(background))
                    .get(5, TimeUnit.SECONDS);
            log.info("Background job {} known={} running={}", background, status.known(), status.running());
        } finally {
            client.close().get(5, TimeUnit.SECONDS);
        }
    }
}
