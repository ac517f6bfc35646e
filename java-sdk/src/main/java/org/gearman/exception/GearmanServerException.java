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

package org.gearman.exception;

import org.apache.commons.lang3.StringUtils;

/**
 * Exception thrown when the job server answers a request with an {@code ERROR} packet.
 *
 * <p>The packet carries a short error code and a human-readable text, both of which are
 * exposed here.
 */
public class GearmanServerException extends GearmanException {

    private final String errorCode;
    private final String errorText;

    /**
     * Constructs a new GearmanServerException.
     *
     * @param errorCode the error code sent by the server
     * @param errorText the error text sent by the server
     */
    public GearmanServerException(String errorCode, String errorText) {
        super(buildMessage(errorCode, errorText));
        this.errorCode = errorCode;
        this.errorText = errorText;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorText() {
        return errorText;
    }

    private static String buildMessage(String errorCode, String errorText) {
        StringBuilder sb = new StringBuilder("Server error [code=").append(errorCode).append("]");
        if (StringUtils.isNotEmpty(errorText)) {
            sb.append(": ").append(errorText);
        }
        return sb.toString();
    }
}
