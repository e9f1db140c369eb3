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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the ordered record of received but not yet acknowledged messages of a subscription and
 * resolves which of them may serve as the boundary of a cumulative acknowledgment.
 *
 * <p>All operations are handled one at a time, in the order they are handed to the tracker. The
 * mutating operations return as soon as the tracker has accepted the request; the queries wait until
 * every request accepted before them has been applied.
 *
 * <p>Callers must stop issuing operations once {@link #close()} was called. Unless the tracker was
 * configured to fail fast, an operation issued after close blocks indefinitely.
 */
public interface CumulativeAcksTracker extends AutoCloseable {

    /**
     * Appends the given message ids, in order, to the tail of the record.
     */
    void messagesReceived(List<? extends MessageId> messageIds) throws AckTrackerException;

    /**
     * Removes the first tracked entry equal to {@code messageId}. Unknown ids are ignored.
     */
    void ackSent(MessageId messageId) throws AckTrackerException;

    /**
     * Removes the first tracked entry equal to {@code messageId} together with every entry before it.
     * Unknown ids are ignored.
     */
    void cumulativeAckSent(MessageId messageId) throws AckTrackerException;

    /**
     * Resolves the greatest tracked message id that may be cumulatively acknowledged at or before
     * {@code messageId}.
     *
     * <p>The result is empty when {@code messageId} is not tracked, or when it cannot be acknowledged
     * cumulatively and nothing was received before it.
     */
    Optional<MessageId> getCumulativeMessageId(MessageId messageId) throws AckTrackerException;

    /**
     * Same as {@link #getCumulativeMessageId(MessageId)}, giving up after the given time.
     *
     * @throws AckTrackerException.TimeoutException if no reply was produced in time
     */
    Optional<MessageId> getCumulativeMessageId(MessageId messageId, long timeout, TimeUnit unit)
            throws AckTrackerException;

    /**
     * Asynchronous version of {@link #getCumulativeMessageId(MessageId)}. The call still blocks until
     * the tracker has accepted the query.
     */
    CompletableFuture<Optional<MessageId>> getCumulativeMessageIdAsync(MessageId messageId)
            throws AckTrackerException;

    /**
     * Returns a copy of the tracked message ids, in record order.
     */
    List<MessageId> getTrackedMessageIds() throws AckTrackerException;

    /**
     * Stops the tracker. Calling it more than once has no effect.
     */
    @Override
    void close();
}
