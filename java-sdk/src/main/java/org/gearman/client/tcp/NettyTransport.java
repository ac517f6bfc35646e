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

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import org.gearman.client.GearmanTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GearmanTransport} writing to a Netty channel.
 */
public class NettyTransport implements GearmanTransport {
    private static final Logger log = LoggerFactory.getLogger(NettyTransport.class);

    private final Channel channel;

    public NettyTransport(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void write(ByteBuf frame) {
        if (log.isTraceEnabled()) {
            log.trace("Writing {} bytes to {}", frame.readableBytes(), channel.remoteAddress());
        }
        channel.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.error("Failed to send frame: {}", future.cause().getMessage());
                future.channel().close();
            }
        });
    }

    @Override
    public void close() {
        channel.close();
    }
}
