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
package org.apache.acktracker.client.impl;

import static com.google.common.base.Preconditions.checkArgument;
import java.util.Map;
import lombok.Getter;
import org.apache.acktracker.client.api.CumulativeAcksTracker;
import org.apache.acktracker.client.api.CumulativeAcksTrackerBuilder;
import org.apache.acktracker.client.impl.conf.ConfigurationDataUtils;
import org.apache.acktracker.client.impl.conf.CumulativeAcksTrackerConfigurationData;
import org.apache.commons.lang3.StringUtils;

@Getter
public class CumulativeAcksTrackerBuilderImpl implements CumulativeAcksTrackerBuilder {

    private CumulativeAcksTrackerConfigurationData conf;

    public CumulativeAcksTrackerBuilderImpl() {
        this(new CumulativeAcksTrackerConfigurationData());
    }

    CumulativeAcksTrackerBuilderImpl(CumulativeAcksTrackerConfigurationData conf) {
        this.conf = conf;
    }

    @Override
    public CumulativeAcksTrackerBuilder loadConf(Map<String, Object> config) {
        this.conf = ConfigurationDataUtils.loadData(config, conf, CumulativeAcksTrackerConfigurationData.class);
        return this;
    }

    @Override
    public CumulativeAcksTrackerBuilder receiverQueueSize(int receiverQueueSize) {
        checkArgument(receiverQueueSize >= 0, "receiverQueueSize needs to be >= 0");
        conf.setReceiverQueueSize(receiverQueueSize);
        return this;
    }

    @Override
    public CumulativeAcksTrackerBuilder requestQueueSize(int requestQueueSize) {
        checkArgument(requestQueueSize >= 0, "requestQueueSize needs to be >= 0");
        conf.setRequestQueueSize(requestQueueSize);
        return this;
    }

    @Override
    public CumulativeAcksTrackerBuilder failFastAfterClose(boolean failFastAfterClose) {
        conf.setFailFastAfterClose(failFastAfterClose);
        return this;
    }

    @Override
    public CumulativeAcksTrackerBuilder threadName(String threadName) {
        checkArgument(StringUtils.isNotBlank(threadName), "threadName cannot be blank");
        conf.setThreadName(threadName);
        return this;
    }

    @Override
    public CumulativeAcksTrackerBuilder clone() {
        return new CumulativeAcksTrackerBuilderImpl(conf.clone());
    }

    @Override
    public CumulativeAcksTracker create() {
        checkArgument(StringUtils.isNotBlank(conf.getThreadName()), "threadName cannot be blank");
        return new CumulativeAcksTrackerImpl(conf);
    }
}
