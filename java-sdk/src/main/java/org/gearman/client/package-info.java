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

/**
 * Transport-independent Gearman protocol engine and job-submitting client.
 *
 * <h2>Protocol Details</h2>
 * <p>Every packet is {@code [magic:4][command:4 BE][length:4 BE][payload:N]}. Replies carry
 * no request id and are matched to requests in FIFO order; packets arriving with no request
 * pending go to the registered {@link org.gearman.client.UnsolicitedHandler}s.
 */
package org.gearman.client;
