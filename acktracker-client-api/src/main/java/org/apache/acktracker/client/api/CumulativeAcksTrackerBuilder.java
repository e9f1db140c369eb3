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
package org.apache.acktracker.client.api;

import java.util.Map;

/**
 * Builder used to configure and create {@link CumulativeAcksTracker} instances.
 */
public interface CumulativeAcksTrackerBuilder extends Cloneable {

    /**
     * Load the configuration from the provided map. Keys are the field names of the configuration
     * data; values not present in the map keep their current value.
     */
    CumulativeAcksTrackerBuilder loadConf(Map<String, Object> config);

    /**
     * Expected number of in-flight messages. Only used to size the record, never enforced.
     */
    CumulativeAcksTrackerBuilder receiverQueueSize(int receiverQueueSize);

    /**
     * Number of requests that may wait for the tracker. {@code 0} hands every request over directly.
     */
    CumulativeAcksTrackerBuilder requestQueueSize(int requestQueueSize);

    /**
     * Make operations issued after close throw instead of blocking.
     */
    CumulativeAcksTrackerBuilder failFastAfterClose(boolean failFastAfterClose);

    CumulativeAcksTrackerBuilder threadName(String threadName);

    CumulativeAcksTrackerBuilder clone();

    CumulativeAcksTracker create();
}
