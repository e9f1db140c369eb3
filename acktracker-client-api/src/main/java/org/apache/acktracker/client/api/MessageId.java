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

/**
 * Opaque identifier of a consumed message.
 *
 * <p>The tracker never creates or mutates message ids. It only stores them and compares them through
 * {@link Object#equals(Object)}, so implementations must provide value equality.
 */
public interface MessageId {

    /**
     * Whether this id, by itself, stands for a fully consumed unit and may therefore be used as the
     * boundary of a cumulative acknowledgment.
     *
     * <p>This is {@code false} for a message that is part of a larger batch which has not yet been
     * fully consumed.
     */
    boolean canAckCumulative();
}
