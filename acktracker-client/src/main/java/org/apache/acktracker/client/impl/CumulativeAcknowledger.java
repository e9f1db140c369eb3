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

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.acktracker.client.api.AckTrackerException;
import org.apache.acktracker.client.api.CumulativeAcksTracker;
import org.apache.acktracker.client.api.MessageId;

/**
 * Acknowledges the messages of one subscription, collapsing cumulative acknowledgments to a boundary
 * resolved by a {@link CumulativeAcksTracker}.
 */
@Slf4j
public class CumulativeAcknowledger implements AutoCloseable {

    private final String subscription;
    private final CumulativeAcksTracker tracker;
    private final AckSender ackSender;

    public CumulativeAcknowledger(String subscription, CumulativeAcksTracker tracker, AckSender ackSender) {
        this.subscription = subscription;
        this.tracker = tracker;
        this.ackSender = ackSender;
    }

    public void messagesReceived(List<? extends MessageId> messageIds) throws AckTrackerException {
        tracker.messagesReceived(messageIds);
    }

    /**
     * Acknowledges a single message. A batch is acknowledged as a whole entry once all its messages are.
     */
    public void acknowledge(MessageId messageId) throws AckTrackerException {
        MessageId ackMessageId = messageId;
        if (messageId instanceof BatchMessageIdImpl batchMessageId) {
            if (!batchMessageId.ackIndividual()) {
                if (log.isDebugEnabled()) {
                    log.debug("[{}] Batch of {} still has {} outstanding acks", subscription, messageId,
                            batchMessageId.getAcker().getOutstandingAcks());
                }
                tracker.ackSent(messageId);
                return;
            }
            ackMessageId = batchMessageId.toMessageIdImpl();
        }
        MessageId sentMessageId = ackMessageId;
        ackSender.sendIndividualAck(sentMessageId).whenComplete((__, ex) -> {
            if (ex != null) {
                log.warn("[{}] Failed to send ack for {}", subscription, sentMessageId, ex);
            }
        });
        tracker.ackSent(messageId);
    }

    /**
     * Acknowledges {@code messageId} and everything received before it.
     *
     * @return the boundary sent to the broker, or empty if nothing could be acknowledged
     */
    public Optional<MessageId> acknowledgeCumulative(MessageId messageId) throws AckTrackerException {
        if (messageId instanceof BatchMessageIdImpl batchMessageId) {
            // everything up to this message of the batch is acknowledged by this call
            batchMessageId.ackCumulative();
        }
        Optional<MessageId> boundary = tracker.getCumulativeMessageId(messageId);
        if (boundary.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("[{}] No cumulative ack boundary for {}", subscription, messageId);
            }
            return boundary;
        }
        MessageId ackMessageId = boundary.get();
        ackSender.sendCumulativeAck(ackMessageId).whenComplete((__, ex) -> {
            if (ex != null) {
                log.warn("[{}] Failed to send cumulative ack for {}", subscription, ackMessageId, ex);
            }
        });
        tracker.cumulativeAckSent(ackMessageId);
        return boundary;
    }

    @Override
    public void close() {
        log.info("[{}] Closing cumulative acknowledger", subscription);
        tracker.close();
    }
}
