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

import org.gearman.client.tcp.GearmanTcpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Worker that registers the {@code upper} function and serves jobs until interrupted.
 *
 * <p>Usage: {@code UppercaseWorker [host] [port] [maxJobs]}. With no job limit the worker runs forever.
 */
public final class UppercaseWorker {

    static final String FUNCTION_NAME = "upper";
    private static final Logger log = LoggerFactory.getLogger(UppercaseWorker.class);

    private UppercaseWorker() {}

    public static void main(String[] args) throws ExecutionException, InterruptedException, TimeoutException {
        String host = args.length > 0 ? args[0] : "localhost";
        int port = args.length > 1 ? Integer.parseInt(args[1]) : 4730;
        long maxJobs = args.length > 2 ? Long.parseLong(args[2]) : Long.MAX_VALUE;

        log.info("Connecting worker to {}:{}...", host, port);
        GearmanTcpClient client = GearmanTcpClient.builder()
                .host(host)
                .port(port)
                .clientId("uppercase-worker")
                .buildAndConnect()
                .get(5, TimeUnit.SECONDS);

        try {
            client.registerFunction(FUNCTION_NAME, UppercaseWorker::uppercase).get(5, TimeUnit.SECONDS);
            log.info("Registered function '{}', waiting for jobs", FUNCTION_NAME);

            for (long served = 0; served < maxJobs; served++) {
                // Blocks while the worker sleeps between NO_JOB and NOOP.
                client.doJob().get();
                log.info("Finished job #{}", served + 1);
            }
        } finally {
            client.close().get(5, TimeUnit.SECONDS);
        }
    }

    static byte[] uppercase(byte[] data) {
        String text = new String(data, StandardCharsets.UTF_8);
        if (text.isEmpty()) {
            throw new IllegalArgumentException("nothing to uppercase");
        }
        return text.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
    }
}
