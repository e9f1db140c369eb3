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

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CumulativeAcksTrackerConfigurationData implements Serializable, Cloneable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_RECEIVER_QUEUE_SIZE = 1000;

    /**
     * Expected size of the in-flight window. Used as the initial capacity of the record.
     */
    private int receiverQueueSize = DEFAULT_RECEIVER_QUEUE_SIZE;

    /**
     * Number of requests buffered in front of the worker. 0 means a direct hand-off.
     */
    private int requestQueueSize = 0;

    private boolean failFastAfterClose = false;

    private String threadName = "pulsar-cumulative-acks-tracker";

    @Override
    public CumulativeAcksTrackerConfigurationData clone() {
        try {
            return (CumulativeAcksTrackerConfigurationData) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new RuntimeException("Failed to clone CumulativeAcksTrackerConfigurationData", e);
        }
    }
}
