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
import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.annotations.VisibleForTesting;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.apache.acktracker.client.api.AckTrackerException;
import org.apache.acktracker.client.api.CumulativeAcksTracker;
import org.apache.acktracker.client.api.MessageId;
import org.apache.acktracker.client.impl.conf.CumulativeAcksTrackerConfigurationData;

/**
 * {@link CumulativeAcksTracker} whose record is owned by a single worker thread.
 *
 * <p>Every operation is turned into a request and handed over to the worker through one queue, so the
 * requests are applied in the order the queue accepted them and the record needs no locking.
 */
@Slf4j
public class CumulativeAcksTrackerImpl implements CumulativeAcksTracker {

    private static final long CLOSE_CHECK_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);
    private static final long WAIT_FOREVER = -1;

    private final CumulativeAcksTrackerConfigurationData conf;
    private final BlockingQueue<TrackerRequest> requests;
    // only accessed from the worker thread
    private final List<MessageId> trackedMessageIds;
    private final Thread worker;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CumulativeAcksTrackerImpl(int receiverQueueSize) {
        this(newConf(receiverQueueSize));
    }

    public CumulativeAcksTrackerImpl(CumulativeAcksTrackerConfigurationData conf) {
        checkArgument(conf.getReceiverQueueSize() >= 0, "receiverQueueSize needs to be >= 0");
        checkArgument(conf.getRequestQueueSize() >= 0, "requestQueueSize needs to be >= 0");
        this.conf = conf.clone();
        this.requests = conf.getRequestQueueSize() == 0
                ? new SynchronousQueue<>()
                : new ArrayBlockingQueue<>(conf.getRequestQueueSize());
        this.trackedMessageIds = new ArrayList<>(conf.getReceiverQueueSize());
        this.worker = new DefaultThreadFactory(conf.getThreadName(), true).newThread(this::process);

        log.debug("Created new cumulative acks tracker");

        worker.start();
    }

    private static CumulativeAcksTrackerConfigurationData newConf(int receiverQueueSize) {
        CumulativeAcksTrackerConfigurationData conf = new CumulativeAcksTrackerConfigurationData();
        conf.setReceiverQueueSize(receiverQueueSize);
        return conf;
    }

    @Override
    public void messagesReceived(List<? extends MessageId> messageIds) throws AckTrackerException {
        enqueue(new MessagesReceivedRequest(List.copyOf(messageIds)), WAIT_FOREVER);
    }

    @Override
    public void ackSent(MessageId messageId) throws AckTrackerException {
        enqueue(new AckSentRequest(checkNotNull(messageId, "messageId")), WAIT_FOREVER);
    }

    @Override
    public void cumulativeAckSent(MessageId messageId) throws AckTrackerException {
        enqueue(new CumulativeAckSentRequest(checkNotNull(messageId, "messageId")), WAIT_FOREVER);
    }

    @Override
    public Optional<MessageId> getCumulativeMessageId(MessageId messageId) throws AckTrackerException {
        try {
            return getCumulativeMessageIdAsync(messageId).get();
        } catch (InterruptedException | ExecutionException e) {
            throw AckTrackerException.unwrap(e);
        }
    }

    @Override
    public Optional<MessageId> getCumulativeMessageId(MessageId messageId, long timeout, TimeUnit unit)
            throws AckTrackerException {
        long timeoutNanos = Math.max(0, unit.toNanos(timeout));
        long deadline = System.nanoTime() + timeoutNanos;
        CompletableFuture<Optional<MessageId>> ackMessageId = new CompletableFuture<>();
        if (!enqueue(new GetCumulativeMessageIdRequest(checkNotNull(messageId, "messageId"), ackMessageId),
                timeoutNanos)) {
            throw new AckTrackerException.TimeoutException(
                    "Timed out handing over cumulative message id query for " + messageId);
        }
        try {
            return ackMessageId.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (java.util.concurrent.TimeoutException e) {
            throw new AckTrackerException.TimeoutException(
                    "Timed out waiting for cumulative message id of " + messageId);
        } catch (InterruptedException | ExecutionException e) {
            throw AckTrackerException.unwrap(e);
        }
    }

    @Override
    public CompletableFuture<Optional<MessageId>> getCumulativeMessageIdAsync(MessageId messageId)
            throws AckTrackerException {
        CompletableFuture<Optional<MessageId>> ackMessageId = new CompletableFuture<>();
        enqueue(new GetCumulativeMessageIdRequest(checkNotNull(messageId, "messageId"), ackMessageId),
                WAIT_FOREVER);
        return ackMessageId;
    }

    @Override
    public List<MessageId> getTrackedMessageIds() throws AckTrackerException {
        CompletableFuture<List<MessageId>> snapshot = new CompletableFuture<>();
        enqueue(new GetTrackedMessageIdsRequest(snapshot), WAIT_FOREVER);
        try {
            return snapshot.get();
        } catch (InterruptedException | ExecutionException e) {
            throw AckTrackerException.unwrap(e);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing cumulative acks tracker");
        worker.interrupt();
    }

    @VisibleForTesting
    boolean isProcessorRunning() {
        return worker.isAlive();
    }

    /**
     * Hands a request over to the worker.
     *
     * @param timeoutNanos how long to wait for the worker to accept, or {@link #WAIT_FOREVER}
     * @return false if the request was not accepted in time
     */
    private boolean enqueue(TrackerRequest request, long timeoutNanos) throws AckTrackerException {
        checkOpen();
        boolean bounded = timeoutNanos != WAIT_FOREVER;
        try {
            if (!bounded && !conf.isFailFastAfterClose()) {
                requests.put(request);
                return true;
            }
            long deadline = System.nanoTime() + timeoutNanos;
            while (true) {
                long waitNanos = CLOSE_CHECK_INTERVAL_NANOS;
                if (bounded) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    waitNanos = Math.min(waitNanos, remaining);
                }
                if (requests.offer(request, waitNanos, TimeUnit.NANOSECONDS)) {
                    break;
                }
                checkOpen();
            }
        } catch (InterruptedException e) {
            throw AckTrackerException.unwrap(e);
        }
        if (closed.get() && conf.isFailFastAfterClose()) {
            // the worker may have stopped before taking it
            failPendingRequests();
        }
        return true;
    }

    private void checkOpen() throws AckTrackerException.AlreadyClosedException {
        if (closed.get() && conf.isFailFastAfterClose()) {
            throw new AckTrackerException.AlreadyClosedException("Cumulative acks tracker is already closed");
        }
    }

    private void failPendingRequests() {
        List<TrackerRequest> pending = new ArrayList<>();
        requests.drainTo(pending);
        if (!pending.isEmpty()) {
            log.debug("Discarding {} requests queued at close", pending.size());
        }
        pending.forEach(request -> request.fail(
                new AckTrackerException.AlreadyClosedException("Cumulative acks tracker is already closed")));
    }

    private void process() {
        log.debug("Starting cumulative acks tracker request processor");
        try {
            while (!closed.get()) {
                TrackerRequest request;
                try {
                    request = requests.take();
                } catch (InterruptedException e) {
                    if (closed.get()) {
                        break;
                    }
                    log.warn("Cumulative acks tracker request processor interrupted while still open", e);
                    continue;
                }
                handle(request);
            }
        } finally {
            if (conf.isFailFastAfterClose()) {
                failPendingRequests();
            }
            log.debug("Stopped cumulative acks tracker request processor");
        }
    }

    private void handle(TrackerRequest request) {
        try {
            if (request instanceof MessagesReceivedRequest p) {
                trackedMessageIds.addAll(p.messageIds());
            } else if (request instanceof AckSentRequest p) {
                if (!removeMessageId(p.messageId()) && log.isDebugEnabled()) {
                    log.debug("Ack sent for untracked message {}", p.messageId());
                }
            } else if (request instanceof CumulativeAckSentRequest p) {
                if (!removeUntilMessageId(p.messageId()) && log.isDebugEnabled()) {
                    log.debug("Cumulative ack sent for untracked message {}", p.messageId());
                }
            } else if (request instanceof GetCumulativeMessageIdRequest p) {
                p.ackMessageId().complete(getGreatestCumulativeMessageId(p.messageId()));
            } else if (request instanceof GetTrackedMessageIdsRequest p) {
                p.trackedMessageIds().complete(new ArrayList<>(trackedMessageIds));
            }
        } catch (RuntimeException e) {
            log.warn("Failed to process cumulative acks tracker request {}", request, e);
            request.fail(e);
        }
    }

    private int getMessageIdIndex(MessageId messageId) {
        for (int i = 0; i < trackedMessageIds.size(); i++) {
            if (messageId.equals(trackedMessageIds.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private boolean removeMessageId(MessageId messageId) {
        int idx = getMessageIdIndex(messageId);
        if (idx == -1) {
            return false;
        }
        trackedMessageIds.remove(idx);
        return true;
    }

    private boolean removeUntilMessageId(MessageId messageId) {
        int idx = getMessageIdIndex(messageId);
        if (idx == -1) {
            return false;
        }
        trackedMessageIds.subList(0, idx + 1).clear();
        return true;
    }

    private Optional<MessageId> getGreatestCumulativeMessageId(MessageId messageId) {
        int idx = getMessageIdIndex(messageId);
        if (idx == -1) {
            return Optional.empty();
        }

        MessageId tracked = trackedMessageIds.get(idx);
        // false for a message of a batch that is not completely acknowledged yet
        if (tracked.canAckCumulative()) {
            return Optional.of(tracked);
        }

        // the message received before it is assumed to be completely consumed
        if (idx > 0) {
            return Optional.of(trackedMessageIds.get(idx - 1));
        }
        return Optional.empty();
    }

    private interface TrackerRequest {
        default void fail(Throwable t) {
            // nobody waits on a fire-and-forget request
        }
    }

    private record MessagesReceivedRequest(List<MessageId> messageIds) implements TrackerRequest {
    }

    private record AckSentRequest(MessageId messageId) implements TrackerRequest {
    }

    private record CumulativeAckSentRequest(MessageId messageId) implements TrackerRequest {
    }

    private record GetCumulativeMessageIdRequest(MessageId messageId,
                                                 CompletableFuture<Optional<MessageId>> ackMessageId)
            implements TrackerRequest {
        @Override
        public void fail(Throwable t) {
            ackMessageId.completeExceptionally(t);
        }
    }

    private record GetTrackedMessageIdsRequest(CompletableFuture<List<MessageId>> trackedMessageIds)
            implements TrackerRequest {
        @Override
        public void fail(Throwable t) {
            trackedMessageIds.completeExceptionally(t);
        }
    }
}
