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

import org.gearman.serde.CommandCode;

/**
 * Queue priority of a submitted job, with the packet types used to submit it.
 */
public enum JobPriority {
    LOW(CommandCode.SUBMIT_JOB_LOW, CommandCode.SUBMIT_JOB_LOW_BG),
    NORMAL(CommandCode.SUBMIT_JOB, CommandCode.SUBMIT_JOB_BG),
    HIGH(CommandCode.SUBMIT_JOB_HIGH, CommandCode.SUBMIT_JOB_HIGH_BG);

    private final CommandCode foreground;
    private final CommandCode background;

    JobPriority(CommandCode foreground, CommandCode background) {
        this.foreground = foreground;
        this.background = background;
    }

    public CommandCode submitCommand(boolean inBackground) {
        return inBackground ? background : foreground;
    }
}
