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

/**
 * Duplex byte channel underneath a {@link GearmanConnection}.
 *
 * <p>Inbound bytes and closure are pushed into the connection by whoever owns the
 * transport, through {@link GearmanConnection#onDataReceived} and
 * {@link GearmanConnection#onConnectionLost}.
 */
public interface GearmanTransport {

    /**
     * Writes an encoded packet. Ownership of the buffer passes to the transport.
     *
     * @param frame the encoded packet
     */
    void write(ByteBuf frame);

    /**
     * Closes the underlying channel.
     */
    void close();
}
