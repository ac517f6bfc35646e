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

import org.gearman.exception.GearmanProtocolException;
import org.gearman.exception.GearmanServerException;
import org.gearman.serde.CommandCode;
import org.gearman.serde.Frame;
import org.gearman.serde.NullSeparated;

import java.util.List;

/**
 * Checks on reply packets shared by the client and the worker.
 */
public final class Replies {

    private Replies() {}

    /**
     * Returns the reply if it has one of the expected types.
     *
     * @param reply the reply packet
     * @param expected the acceptable packet types
     * @return the same reply
     * @throws GearmanServerException if the server answered with {@code ERROR}
     * @throws GearmanProtocolException for any other unexpected packet type
     */
    public static Frame expect(Frame reply, CommandCode... expected) {
        for (CommandCode commandCode : expected) {
            if (reply.is(commandCode)) {
                return reply;
            }
        }
        if (reply.is(CommandCode.ERROR)) {
            throw toServerException(reply);
        }
        throw new GearmanProtocolException("Unexpected reply " + reply);
    }

    static GearmanServerException toServerException(Frame error) {
        List<byte[]> fields = NullSeparated.split(error.payload(), 2);
        String errorText = fields.size() > 1 ? NullSeparated.string(fields.get(1)) : "";
        return new GearmanServerException(NullSeparated.string(fields.get(0)), errorText);
    }
}
