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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.acktracker.client.api.MessageId;
import org.apache.acktracker.client.impl.conf.CumulativeAcksTrackerConfigurationData;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

@Slf4j
@Test(groups = "client")
public class CumulativeAcksTrackerConcurrencyTest {

    private static final int NUM_THREADS = 8;
    private static final int MESSAGES_PER_THREAD = 500;

    private ExecutorService executor;

    @BeforeMethod
    public void setup() {
        executor = Executors.newFixedThreadPool(NUM_THREADS);
    }

    @AfterMethod(alwaysRun = true)
    public void cleanup() {
        executor.shutdownNow();
    }

    @DataProvider(name = "requestQueueSizes")
    public Object[][] requestQueueSizes() {
        return new Object[][]{{0}, {16}, {1024}};
    }

    private static CumulativeAcksTrackerImpl newTracker(int requestQueueSize) {
        CumulativeAcksTrackerConfigurationData conf = new CumulativeAcksTrackerConfigurationData();
        conf.setReceiverQueueSize(NUM_THREADS * MESSAGES_PER_THREAD);
        conf.setRequestQueueSize(requestQueueSize);
        return new CumulativeAcksTrackerImpl(conf);
    }

    private List<Future<?>> runOnAllThreads(ThrowingConsumer<Integer> task) {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < NUM_THREADS; t++) {
            final int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                task.accept(thread);
                return null;
            }));
        }
        start.countDown();
        return futures;
    }

    private static void waitFor(List<Future<?>> futures) throws Exception {
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
    }

    @Test(dataProvider = "requestQueueSizes")
    public void testConcurrentMessagesReceived(int requestQueueSize) throws Exception {
        CumulativeAcksTrackerImpl tracker = newTracker(requestQueueSize);
        try {
            waitFor(runOnAllThreads(thread -> {
                for (int i = 0; i < MESSAGES_PER_THREAD; i++) {
                    tracker.messagesReceived(List.of(new MessageIdImpl(thread, i, -1)));
                }
            }));

            List<MessageId> tracked = tracker.getTrackedMessageIds();
            assertEquals(tracked.size(), NUM_THREADS * MESSAGES_PER_THREAD);
            Set<MessageId> distinct = new HashSet<>(tracked);
            assertEquals(distinct.size(), NUM_THREADS * MESSAGES_PER_THREAD);
            for (int thread = 0; thread < NUM_THREADS; thread++) {
                for (int i = 0; i < MESSAGES_PER_THREAD; i++) {
                    assertTrue(distinct.contains(new MessageIdImpl(thread, i, -1)));
                }
            }

            // the messages of each caller keep the order they were handed over in
            long[] lastEntryId = new long[NUM_THREADS];
            Arrays.fill(lastEntryId, -1);
            for (MessageId messageId : tracked) {
                MessageIdImpl id = (MessageIdImpl) messageId;
                int thread = (int) id.getLedgerId();
                assertTrue(id.getEntryId() > lastEntryId[thread]);
                lastEntryId[thread] = id.getEntryId();
            }
        } finally {
            tracker.close();
        }
    }

    @Test(dataProvider = "requestQueueSizes")
    public void testConcurrentAcksAndQueries(int requestQueueSize) throws Exception {
        CumulativeAcksTrackerImpl tracker = newTracker(requestQueueSize);
        try {
            List<MessageId> received = new ArrayList<>();
            for (int thread = 0; thread < NUM_THREADS; thread++) {
                for (int i = 0; i < MESSAGES_PER_THREAD; i++) {
                    received.add(new MessageIdImpl(thread, i, -1));
                }
            }
            tracker.messagesReceived(received);

            waitFor(runOnAllThreads(thread -> {
                for (int i = 0; i < MESSAGES_PER_THREAD; i++) {
                    MessageIdImpl id = new MessageIdImpl(thread, i, -1);
                    // a message is only removed by its own caller
                    assertEquals(tracker.getCumulativeMessageId(id), Optional.of(id));
                    tracker.ackSent(id);
                    assertEquals(tracker.getCumulativeMessageId(id), Optional.empty());
                }
            }));

            assertTrue(tracker.getTrackedMessageIds().isEmpty());
        } finally {
            tracker.close();
        }
    }

    @Test
    public void testQueriesSeeEarlierRequestsOfTheSameCaller() throws Exception {
        CumulativeAcksTrackerImpl tracker = newTracker(1024);
        try {
            waitFor(runOnAllThreads(thread -> {
                for (int i = 0; i < MESSAGES_PER_THREAD; i++) {
                    MessageIdImpl id = new MessageIdImpl(thread, i, -1);
                    tracker.messagesReceived(List.of(id));
                    assertEquals(tracker.getCumulativeMessageId(id), Optional.of(id));
                    tracker.ackSent(id);
                }
            }));

            List<MessageId> remaining = tracker.getTrackedMessageIds();
            log.info("Remaining tracked messages: {}", remaining.size());
            assertTrue(remaining.isEmpty());
        } finally {
            tracker.close();
        }
    }

    @FunctionalInterface
    private interface ThrowingConsumer<T> {
        void accept(T t) throws Exception;
    }
}
