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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * A single decoded Gearman packet.
 *
 * <p>The command is kept as the raw wire value so packets with codes unknown to this SDK
 * can still be dispatched.
 */
public record Frame(Magic magic, int command, byte[] payload) {

    public Frame {
        payload = payload == null ? new byte[0] : payload;
    }

    public Frame(Magic magic, CommandCode command, byte[] payload) {
        this(magic, command.getValue(), payload);
    }

    public int length() {
        return payload.length;
    }

    public Optional<CommandCode> commandCode() {
        return CommandCode.fromValue(command);
    }

    public boolean is(CommandCode commandCode) {
        return command == commandCode.getValue();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Frame frame = (Frame) o;
        return command == frame.command && magic == frame.magic && Arrays.equals(payload, frame.payload);
    }

    @Override
    public int hashCode() {
        int result = magic.hashCode();
        result = 31 * result + command;
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        String name = commandCode().map(Enum::name).orElse("UNKNOWN");
        return "Frame{magic=" + magic + ", command=" + name + "(" + command + "), length=" + payload.length + "}";
    }
}
