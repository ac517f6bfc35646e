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

/**
 * Base exception class for all Gearman SDK exceptions.
 *
 * <p>All exceptions thrown by the SDK, or used to complete a future exceptionally,
 * extend this class, so callers can handle every Gearman failure with a single catch.
 */
public abstract class GearmanException extends RuntimeException {

    /**
     * Constructs a new GearmanException with the specified message.
     *
     * @param message the detail message
     */
    protected GearmanException(String message) {
        super(message);
    }

    /**
     * Constructs a new GearmanException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    protected GearmanException(String message, Throwable cause) {
        super(message, cause);
    }
}
