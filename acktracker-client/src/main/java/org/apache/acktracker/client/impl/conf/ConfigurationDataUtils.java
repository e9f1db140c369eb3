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
package org.apache.acktracker.client.impl.conf;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;

/**
 * Utils for loading configuration data.
 */
public final class ConfigurationDataUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigurationDataUtils() {}

    /**
     * Overlays {@code config} on top of {@code existingData} and returns the result as a new instance
     * of {@code dataCls}. {@code existingData} is left untouched.
     */
    public static <T> T loadData(Map<String, Object> config, T existingData, Class<T> dataCls) {
        try {
            Map<String, Object> newConfig = new HashMap<>(
                    MAPPER.convertValue(existingData, new TypeReference<Map<String, Object>>() {}));
            newConfig.putAll(config);
            return MAPPER.convertValue(newConfig, dataCls);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to load config into existing configuration data", e);
        }
    }
}
