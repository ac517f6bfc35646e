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

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Packet types of the Gearman binary protocol.
 */
public enum CommandCode {
    CAN_DO(1),
    CANT_DO(2),
    RESET_ABILITIES(3),
    PRE_SLEEP(4),
    NOOP(6),
    SUBMIT_JOB(7),
    JOB_CREATED(8),
    GRAB_JOB(9),
    NO_JOB(10),
    JOB_ASSIGN(11),
    WORK_STATUS(12),
    WORK_COMPLETE(13),
    WORK_FAIL(14),
    GET_STATUS(15),
    ECHO_REQ(16),
    ECHO_RES(17),
    SUBMIT_JOB_BG(18),
    ERROR(19),
    STATUS_RES(20),
    SUBMIT_JOB_HIGH(21),
    SET_CLIENT_ID(22),
    CAN_DO_TIMEOUT(23),
    ALL_YOURS(24),
    WORK_EXCEPTION(25),
    OPTION_REQ(26),
    OPTION_RES(27),
    WORK_DATA(28),
    WORK_WARNING(29),
    GRAB_JOB_UNIQ(30),
    JOB_ASSIGN_UNIQ(31),
    SUBMIT_JOB_HIGH_BG(32),
    SUBMIT_JOB_LOW(33),
    SUBMIT_JOB_LOW_BG(34);

    private static final Map<Integer, CommandCode> CODE_MAP = new HashMap<>();

    static {
        for (CommandCode commandCode : values()) {
            CODE_MAP.put(commandCode.value, commandCode);
        }
    }

    private final int value;

    CommandCode(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Returns the command for the given wire value.
     *
     * @param value the command field of a packet header
     * @return the command, or empty for codes this SDK does not know
     */
    public static Optional<CommandCode> fromValue(int value) {
        return Optional.ofNullable(CODE_MAP.get(value));
    }
}
