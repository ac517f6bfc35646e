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

import java.util.Optional;

/**
 * Exception used to complete a submitted job's result when the worker reported
 * {@code WORK_FAIL} or {@code WORK_EXCEPTION}.
 */
public class GearmanJobFailedException extends GearmanException {

    private final String jobHandle;
    private final Optional<String> exceptionText;

    public GearmanJobFailedException(String jobHandle, Optional<String> exceptionText) {
        super("Job " + jobHandle + " failed" + exceptionText.map(text -> ": " + text).orElse(""));
        this.jobHandle = jobHandle;
        this.exceptionText = exceptionText;
    }

    public String getJobHandle() {
        return jobHandle;
    }

    /**
     * Returns the text the worker attached with {@code WORK_EXCEPTION}, if any.
     *
     * @return the exception text
     */
    public Optional<String> getExceptionText() {
        return exceptionText;
    }
}
