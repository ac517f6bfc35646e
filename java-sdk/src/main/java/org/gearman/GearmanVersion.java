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

package org.gearman;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Build information of this SDK, used to announce the client to job servers.
 */
public final class GearmanVersion {

    private static final Logger log = LoggerFactory.getLogger(GearmanVersion.class);
    private static final String RESOURCE = "/gearman-version.properties";
    private static final String CLIENT_ID_PREFIX = "gearman-java-sdk/";
    private static final String UNKNOWN = "unknown";

    private static final GearmanVersion INSTANCE = load();

    private final String version;
    private final String buildTime;

    private GearmanVersion(String version, String buildTime) {
        this.version = version;
        this.buildTime = buildTime;
    }

    private static GearmanVersion load() {
        Properties props = new Properties();
        try (InputStream in = GearmanVersion.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("{} not on the classpath", RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Cannot read {}", RESOURCE, e);
        }
        return new GearmanVersion(property(props, "version"), property(props, "buildTime"));
    }

    // unfiltered placeholders count as missing
    private static String property(Properties props, String key) {
        String value = StringUtils.trimToEmpty(props.getProperty(key));
        return value.isEmpty() || value.startsWith("${") ? UNKNOWN : value;
    }

    public static GearmanVersion getInstance() {
        return INSTANCE;
    }

    public String getVersion() {
        return version;
    }

    public String getBuildTime() {
        return buildTime;
    }

    /**
     * Client id sent with {@code SET_CLIENT_ID} when the builder sets none.
     *
     * @return {@code gearman-java-sdk/<version>}
     */
    public String getDefaultClientId() {
        return CLIENT_ID_PREFIX + version;
    }

    @Override
    public String toString() {
        return UNKNOWN.equals(buildTime)
                ? "Gearman Java SDK " + version
                : "Gearman Java SDK " + version + " (built: " + buildTime + ")";
    }
}
