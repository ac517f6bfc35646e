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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.gearman.GearmanVersion;
import org.gearman.client.GearmanClient;
import org.gearman.client.GearmanConnection;
import org.gearman.exception.GearmanNotConnectedException;
import org.gearman.job.JobHandle;
import org.gearman.serde.Frame;
import org.gearman.worker.GearmanWorker;
import org.gearman.worker.JobFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.File;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * TCP client for a Gearman job server using Netty.
 *
 * <p>One channel carries one {@link GearmanConnection}, shared by a {@link GearmanWorker}
 * and a {@link GearmanClient}. The convenience methods of this class run on the channel's
 * event loop, so they may be called from any thread.
 */
public class GearmanTcpClient {
    private static final Logger log = LoggerFactory.getLogger(GearmanTcpClient.class);

    private final String host;
    private final int port;
    private final boolean enableTls;
    private final Optional<String> clientId;
    private final SslContext sslContext;
    private final EventLoopGroup eventLoopGroup;
    private final Bootstrap bootstrap;
    private Channel channel;
    private GearmanConnection connection;
    private GearmanWorker worker;
    private GearmanClient client;

    GearmanTcpClient(
            String host,
            int port,
            boolean enableTls,
            Optional<File> tlsCertificate,
            Optional<Duration> connectionTimeout,
            Optional<String> clientId) {
        this.host = host;
        this.port = port;
        this.enableTls = enableTls;
        this.clientId = clientId;
        this.eventLoopGroup = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();
        if (enableTls) {
            try {
                SslContextBuilder builder = SslContextBuilder.forClient();
                tlsCertificate.ifPresent(builder::trustManager);
                this.sslContext = builder.build();
            } catch (SSLException e) {
                throw new IllegalStateException("Failed to build SSL context for GearmanTcpClient", e);
            }
        } else {
            this.sslContext = null;
        }
        configureBootstrap(connectionTimeout);
    }

    public static GearmanTcpClientBuilder builder() {
        return new GearmanTcpClientBuilder();
    }

    private void configureBootstrap(Optional<Duration> connectionTimeout) {
        bootstrap
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        if (enableTls) {
                            pipeline.addLast("ssl", sslContext.newHandler(ch.alloc(), host, port));
                        }

                        connection = new GearmanConnection(new NettyTransport(ch));
                        worker = new GearmanWorker(connection);
                        client = new GearmanClient(connection);
                        pipeline.addLast("gearmanHandler", new GearmanChannelHandler(connection));
                    }
                });
        connectionTimeout.ifPresent(timeout ->
                bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis()));
    }

    /**
     * Connects to the job server asynchronously and announces the client id.
     *
     * @return a future completed once the channel is active
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        log.info("Connecting to job server {}:{} with {}", host, port, GearmanVersion.getInstance());

        bootstrap.connect(host, port).addListener((ChannelFutureListener) channelFuture -> {
            if (channelFuture.isSuccess()) {
                channel = channelFuture.channel();
                future.complete(null);
            } else {
                future.completeExceptionally(channelFuture.cause());
            }
        });

        return future.thenCompose(connected -> onEventLoop(() -> {
            worker.setClientId(clientId.orElse(GearmanVersion.getInstance().getDefaultClientId()));
            return CompletableFuture.completedFuture(null);
        }));
    }

    /**
     * Runs an action on the channel's event loop and flattens its result.
     *
     * @param action the action, which may use {@link #connection()}, {@link #worker()} or
     *     {@link #client()} directly
     * @param <T> the result type
     * @return the action's result
     */
    public <T> CompletableFuture<T> onEventLoop(Supplier<CompletableFuture<T>> action) {
        if (channel == null) {
            return CompletableFuture.failedFuture(
                    new GearmanNotConnectedException("Client not connected. Call connect() first."));
        }
        return CompletableFuture.supplyAsync(action, channel.eventLoop()).thenCompose(Function.identity());
    }

    public CompletableFuture<Void> registerFunction(String name, JobFunction function) {
        return onEventLoop(() -> {
            worker().registerFunction(name, function);
            return CompletableFuture.completedFuture(null);
        });
    }

    public CompletableFuture<Void> doJob() {
        return onEventLoop(() -> worker().doJob());
    }

    public CompletableFuture<JobHandle> submit(String function, byte[] data) {
        return onEventLoop(() -> client().submit(function, data));
    }

    public CompletableFuture<String> submitBackground(String function, byte[] data) {
        return onEventLoop(() -> client().submitBackground(function, data));
    }

    public CompletableFuture<Frame> echo() {
        return onEventLoop(() -> connection().echo());
    }

    public GearmanConnection connection() {
        ensureConnected();
        return connection;
    }

    public GearmanWorker worker() {
        ensureConnected();
        return worker;
    }

    public GearmanClient client() {
        ensureConnected();
        return client;
    }

    private void ensureConnected() {
        if (channel == null) {
            throw new GearmanNotConnectedException("Client not connected. Call connect() first.");
        }
    }

    /**
     * Closes the connection and releases resources.
     */
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> future = new CompletableFuture<>();

        if (channel != null && channel.isActive()) {
            channel.close().addListener((ChannelFutureListener) channelFuture -> {
                eventLoopGroup.shutdownGracefully();
                if (channelFuture.isSuccess()) {
                    future.complete(null);
                } else {
                    future.completeExceptionally(channelFuture.cause());
                }
            });
        } else {
            eventLoopGroup.shutdownGracefully();
            future.complete(null);
        }

        return future;
    }
}
