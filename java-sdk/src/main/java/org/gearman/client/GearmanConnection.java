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

import io.netty.buffer.ByteBuf;
import org.gearman.exception.GearmanConnectionLostException;
import org.gearman.exception.GearmanFramingException;
import org.gearman.exception.GearmanNotConnectedException;
import org.gearman.serde.CommandCode;
import org.gearman.serde.Frame;
import org.gearman.serde.FrameCodec;
import org.gearman.serde.NullSeparated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Protocol engine for one connection to a job server.
 *
 * <p>Gearman replies carry no request id: the server answers requests in the order they
 * were sent, so every packet that arrives while requests are pending completes the oldest
 * one. Any other packet is handed to all registered {@link UnsolicitedHandler}s.
 *
 * <p>The connection is driven from a single thread. Callers, {@link #onDataReceived} and
 * {@link #onConnectionLost} must not run concurrently for the same instance.
 */
public class GearmanConnection {
    private static final Logger log = LoggerFactory.getLogger(GearmanConnection.class);

    static final byte[] DEFAULT_ECHO_PAYLOAD = NullSeparated.bytes("hello");

    private final GearmanTransport transport;
    private final FrameCodec codec = new FrameCodec();
    private final Deque<CompletableFuture<Frame>> pendingRequests = new ArrayDeque<>();
    private final List<UnsolicitedHandler> unsolicitedHandlers = new ArrayList<>();
    private boolean connected = true;

    public GearmanConnection(GearmanTransport transport) {
        this.transport = transport;
    }

    /**
     * Sends a packet that expects no reply.
     *
     * @param command the packet type
     * @param payload the packet body
     * @throws GearmanNotConnectedException if the connection has been lost
     */
    public void sendRaw(CommandCode command, byte[] payload) {
        if (!connected) {
            throw new GearmanNotConnectedException();
        }
        log.debug("Sending {} with {} bytes", command, payload.length);
        transport.write(FrameCodec.encode(command, payload));
    }

    /**
     * Sends a request and returns the reply that answers it.
     *
     * <p>Any number of requests may be outstanding; replies are matched in send order.
     *
     * @param command the packet type
     * @param payload the packet body
     * @return a future completed with the reply packet, or exceptionally with
     *     {@link GearmanConnectionLostException} if the connection goes away first
     */
    public CompletableFuture<Frame> send(CommandCode command, byte[] payload) {
        if (!connected) {
            return CompletableFuture.failedFuture(new GearmanNotConnectedException());
        }
        CompletableFuture<Frame> reply = new CompletableFuture<>();
        pendingRequests.addLast(reply);
        sendRaw(command, payload);
        return reply;
    }

    /**
     * Adds a handler for unsolicited packets. Registering the same handler instance twice
     * has no effect.
     *
     * @param handler the handler
     */
    public void registerUnsolicited(UnsolicitedHandler handler) {
        for (UnsolicitedHandler registered : unsolicitedHandlers) {
            if (registered == handler) {
                return;
            }
        }
        unsolicitedHandlers.add(handler);
    }

    public void unregisterUnsolicited(UnsolicitedHandler handler) {
        unsolicitedHandlers.removeIf(registered -> registered == handler);
    }

    /**
     * Feeds bytes read from the transport and dispatches every complete packet.
     *
     * <p>A framing error closes the transport and fails all pending requests.
     *
     * @param data the bytes that arrived; the caller keeps ownership of the buffer
     */
    public void onDataReceived(ByteBuf data) {
        if (!connected) {
            log.debug("Ignoring {} bytes received after connection loss", data.readableBytes());
            return;
        }
        List<Frame> frames;
        try {
            frames = codec.feed(data);
        } catch (GearmanFramingException e) {
            log.error("Closing connection: {}", e.getMessage());
            transport.close();
            onConnectionLost(e);
            return;
        }
        for (Frame frame : frames) {
            dispatch(frame);
        }
    }

    private void dispatch(Frame frame) {
        CompletableFuture<Frame> pending = pendingRequests.pollFirst();
        if (pending != null) {
            log.debug("Received reply {}", frame);
            pending.complete(frame);
            return;
        }
        log.debug("Received unsolicited {}", frame);
        // handlers may unregister themselves while being invoked
        for (UnsolicitedHandler handler : List.copyOf(unsolicitedHandlers)) {
            try {
                handler.onFrame(frame);
            } catch (RuntimeException e) {
                log.warn("Unsolicited handler {} failed on {}", handler, frame, e);
            }
        }
    }

    /**
     * Marks the connection lost and fails every pending request in send order.
     *
     * @param reason what the transport reported
     */
    public void onConnectionLost(Throwable reason) {
        if (!connected) {
            return;
        }
        connected = false;
        log.debug("Connection lost with {} pending request(s)", pendingRequests.size());
        CompletableFuture<Frame> pending;
        while ((pending = pendingRequests.pollFirst()) != null) {
            pending.completeExceptionally(new GearmanConnectionLostException(reason));
        }
        for (UnsolicitedHandler handler : List.copyOf(unsolicitedHandlers)) {
            try {
                handler.connectionLost(reason);
            } catch (RuntimeException e) {
                log.warn("Unsolicited handler {} failed on connection loss", handler, e);
            }
        }
    }

    /**
     * Tells the server this worker is about to sleep. The server answers with an
     * unsolicited {@code NOOP} once a job may be available.
     */
    public void preSleep() {
        sendRaw(CommandCode.PRE_SLEEP, new byte[0]);
    }

    public CompletableFuture<Frame> echo() {
        return echo(DEFAULT_ECHO_PAYLOAD);
    }

    /**
     * Sends {@code ECHO_REQ} and returns the server's {@code ECHO_RES}.
     *
     * @param payload the bytes the server should echo back
     * @return the echoed packet
     */
    public CompletableFuture<Frame> echo(byte[] payload) {
        return send(CommandCode.ECHO_REQ, payload);
    }

    public boolean isConnected() {
        return connected;
    }

    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    public int unsolicitedHandlerCount() {
        return unsolicitedHandlers.size();
    }

    public FrameCodec.ParseState parseState() {
        return codec.parseState();
    }
}
