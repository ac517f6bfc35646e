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
 * Netty-based TCP transport for the Gearman protocol engine.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link org.gearman.client.tcp.GearmanTcpClient} - connects to a job server and
 *       exposes the worker and client sharing the connection</li>
 *   <li>{@link org.gearman.client.tcp.GearmanTcpClientBuilder} - fluent builder for
 *       configuring and constructing the client</li>
 *   <li>{@link org.gearman.client.tcp.GearmanChannelHandler} - feeds channel events into the
 *       {@link org.gearman.client.GearmanConnection}</li>
 * </ul>
 *
 * <p>All protocol state is touched from the channel's event loop only.
 */
package org.gearman.client.tcp;
