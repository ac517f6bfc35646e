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

package org.gearman.serde;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.gearman.exception.GearmanFramingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Encoder and incremental decoder for Gearman packets.
 *
 * <p>Packet format: {@code [magic:4][command:4 BE][length:4 BE][payload:length]}.
 *
 * <p>An instance holds the bytes of at most one partially received packet between calls
 * to {@link #feed(ByteBuf)}. It is not thread-safe.
 */
public final class FrameCodec {
    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

    public static final int HEADER_SIZE = 12; // magic (4) + command (4) + length (4)

    /**
     * Where the decoder is within the current packet.
     */
    public enum ParseState {
        AWAITING_HEADER,
        AWAITING_BODY
    }

    private final ByteBuf receiveBuffer = Unpooled.buffer();
    private ParseState parseState = ParseState.AWAITING_HEADER;
    private Magic currentMagic;
    private int currentCommand;
    private int currentLength;
    private boolean corrupted;

    public static ByteBuf encode(CommandCode command, byte[] payload) {
        return encode(Magic.REQUEST, command.getValue(), payload);
    }

    public static ByteBuf encode(int command, byte[] payload) {
        return encode(Magic.REQUEST, command, payload);
    }

    /**
     * Encodes a complete packet.
     *
     * @param magic the packet marker
     * @param command the raw command code
     * @param payload the packet body, may be empty
     * @return a new buffer holding header and payload
     */
    public static ByteBuf encode(Magic magic, int command, byte[] payload) {
        ByteBuf frame = Unpooled.buffer(HEADER_SIZE + payload.length);
        frame.writeInt(magic.getValue());
        frame.writeInt(command);
        frame.writeInt(payload.length);
        frame.writeBytes(payload);
        return frame;
    }

    /**
     * Appends newly received bytes and decodes every packet that is now complete.
     *
     * <p>The readable bytes of {@code in} are consumed; releasing {@code in} stays with the
     * caller. Trailing bytes of an incomplete packet are kept for the next call.
     *
     * @param in the bytes that just arrived
     * @return the decoded packets in arrival order, possibly empty
     * @throws GearmanFramingException if a header carries an unknown magic marker, after
     *     which this codec rejects all further input
     */
    public List<Frame> feed(ByteBuf in) {
        if (corrupted) {
            throw new GearmanFramingException("Stream is out of sync after a framing error");
        }
        receiveBuffer.writeBytes(in);

        List<Frame> frames = new ArrayList<>();
        while (true) {
            if (parseState == ParseState.AWAITING_HEADER) {
                if (receiveBuffer.readableBytes() < HEADER_SIZE) {
                    break;
                }
                readHeader();
                parseState = ParseState.AWAITING_BODY;
            }

            if (receiveBuffer.readableBytes() < currentLength) {
                break;
            }
            byte[] payload = new byte[currentLength];
            receiveBuffer.readBytes(payload);
            Frame frame = new Frame(currentMagic, currentCommand, payload);
            log.trace("Decoded {}", frame);
            frames.add(frame);
            parseState = ParseState.AWAITING_HEADER;
        }
        receiveBuffer.discardReadBytes();
        return frames;
    }

    private void readHeader() {
        int rawMagic = receiveBuffer.readInt();
        Optional<Magic> magic = Magic.fromValue(rawMagic);
        if (magic.isEmpty()) {
            fail(String.format("Unrecognized packet magic 0x%08x", rawMagic));
        }
        currentMagic = magic.get();
        currentCommand = receiveBuffer.readInt();
        long length = receiveBuffer.readUnsignedInt();
        if (length > Integer.MAX_VALUE - HEADER_SIZE) {
            fail("Packet length " + length + " exceeds the supported maximum");
        }
        currentLength = (int) length;
        log.trace("Read header magic={}, command={}, length={}", currentMagic, currentCommand, currentLength);
    }

    private void fail(String message) {
        corrupted = true;
        receiveBuffer.clear();
        throw new GearmanFramingException(message);
    }

    public ParseState parseState() {
        return parseState;
    }

    /**
     * Returns the number of received bytes that do not yet form a complete packet.
     *
     * @return buffered byte count
     */
    public int bufferedBytes() {
        return receiveBuffer.readableBytes();
    }
}
