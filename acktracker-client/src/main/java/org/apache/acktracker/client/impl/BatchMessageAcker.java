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

import java.util.BitSet;

/**
 * Tracks which messages of one batch entry are still waiting for an acknowledgment. Shared by all the
 * {@link BatchMessageIdImpl} of the same batch.
 */
public class BatchMessageAcker {

    private final BitSet bitSet;
    private final int batchSize;

    static BatchMessageAcker newAcker(int batchSize) {
        BitSet bitSet = new BitSet(batchSize);
        bitSet.set(0, batchSize);
        return new BatchMessageAcker(bitSet, batchSize);
    }

    BatchMessageAcker(BitSet bitSet, int batchSize) {
        this.bitSet = bitSet;
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Marks a single message of the batch as acknowledged.
     *
     * @return true if the whole batch is now acknowledged
     */
    public synchronized boolean ackIndividual(int batchIndex) {
        bitSet.clear(batchIndex);
        return bitSet.isEmpty();
    }

    /**
     * Marks the message at {@code batchIndex} and every message before it as acknowledged.
     *
     * @return true if the whole batch is now acknowledged
     */
    public synchronized boolean ackCumulative(int batchIndex) {
        // bitset.clear(fromIndex, toIndex) is exclusive on toIndex
        bitSet.clear(0, batchIndex + 1);
        return bitSet.isEmpty();
    }

    public synchronized int getOutstandingAcks() {
        return bitSet.cardinality();
    }

    @Override
    public synchronized String toString() {
        return "BatchMessageAcker{batchSize=" + batchSize + ", outstanding=" + bitSet + "}";
    }
}
