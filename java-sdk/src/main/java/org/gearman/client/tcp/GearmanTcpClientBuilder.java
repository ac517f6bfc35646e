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

package org.gearman.client.tcp;

import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Builder for creating configured GearmanTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * var client = GearmanTcpClient.builder()
 *     .host("localhost")
 *     .port(4730)
 *     .build();
 * client.connect().join();
 * client.registerFunction("upper", data -> new String(data, UTF_8).toUpperCase().getBytes(UTF_8)).join();
 *
 * // Connect in one step
 * var client = GearmanTcpClient.builder()
 *     .host("gearman.example.com")
 *     .enableTls()
 *     .buildAndConnect()
 *     .join();
 * }</pre>
 *
 * @see GearmanTcpClient#builder()
 */
public final class GearmanTcpClientBuilder {
    public static final int DEFAULT_PORT = 4730;

    private String host = "localhost";
    private Integer port = DEFAULT_PORT;
    private boolean enableTls = false;
    private File tlsCertificate;
    private Duration connectionTimeout;
    private String clientId;

    GearmanTcpClientBuilder() {}

    /**
     * Sets the host address of the job server.
     *
     * @param host the host address
     * @return this builder
     */
    public GearmanTcpClientBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the port of the job server.
     *
     * @param port the port number
     * @return this builder
     */
    public GearmanTcpClientBuilder port(Integer port) {
        this.port = port;
        return this;
    }

    public GearmanTcpClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the id announced with {@code SET_CLIENT_ID}; the SDK name and version are used
     * when unset.
     *
     * @param clientId the client id
     * @return this builder
     */
    public GearmanTcpClientBuilder clientId(String clientId) {
        this.clientId = clientId;
        return this;
    }

    public GearmanTcpClientBuilder tls(boolean enableTls) {
        this.enableTls = enableTls;
        return this;
    }

    public GearmanTcpClientBuilder enableTls() {
        this.enableTls = true;
        return this;
    }

    /**
     * Sets a custom trusted certificate (PEM file) to validate the server certificate.
     *
     * @param certificate the PEM file containing the certificate or CA chain
     * @return this builder
     */
    public GearmanTcpClientBuilder tlsTrustedCertificate(File certificate) {
        this.tlsCertificate = certificate;
        return this;
    }

    /**
     * Sets a custom trusted certificate (PEM file path) to validate the server certificate.
     *
     * @param certificatePath the PEM file path containing the certificate or CA chain
     * @return this builder
     */
    public GearmanTcpClientBuilder tlsTrustedCertificate(String certificatePath) {
        this.tlsCertificate = StringUtils.isBlank(certificatePath) ? null : new File(certificatePath);
        return this;
    }

    /**
     * Builds the client. Call {@link GearmanTcpClient#connect()} before use.
     *
     * @return a new GearmanTcpClient instance
     * @throws IllegalArgumentException if the host or port is invalid
     */
    public GearmanTcpClient build() {
        if (StringUtils.isBlank(host)) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        if (port == null || port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        if (connectionTimeout != null && (connectionTimeout.isNegative() || connectionTimeout.isZero())) {
            throw new IllegalArgumentException("Connection timeout must be positive");
        }
        return new GearmanTcpClient(
                host,
                port,
                enableTls,
                Optional.ofNullable(tlsCertificate),
                Optional.ofNullable(connectionTimeout),
                Optional.ofNullable(StringUtils.trimToNull(clientId)));
    }

    /**
     * Builds the client and connects it.
     *
     * @return a future completed with the connected client
     */
    public CompletableFuture<GearmanTcpClient> buildAndConnect() {
        GearmanTcpClient client = build();
        return client.connect().thenApply(connected -> client);
    }
}
