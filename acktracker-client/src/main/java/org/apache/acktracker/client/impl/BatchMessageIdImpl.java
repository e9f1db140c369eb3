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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.Getter;

/**
 * Id of one message of a batch entry.
 *
 * <p>The message may only be used as a cumulative acknowledgment boundary once every message of its
 * batch has been acknowledged on the shared {@link BatchMessageAcker}.
 */
public class BatchMessageIdImpl extends MessageIdImpl {

    @Getter
    private final int batchIndex;
    @Getter
    private final int batchSize;
    private final BatchMessageAcker acker;

    public BatchMessageIdImpl(long ledgerId, long entryId, int partitionIndex, int batchIndex, int batchSize,
                              BatchMessageAcker acker) {
        super(ledgerId, entryId, partitionIndex);
        checkArgument(batchSize > 0, "batchSize must be positive, got %s", batchSize);
        checkArgument(batchIndex >= 0 && batchIndex < batchSize,
                "batchIndex %s is out of range for batch of size %s", batchIndex, batchSize);
        this.batchIndex = batchIndex;
        this.batchSize = batchSize;
        this.acker = checkNotNull(acker, "acker");
    }

    /**
     * Creates the ids of every message in one batch entry, sharing a new acker.
     */
    public static List<BatchMessageIdImpl> newBatch(long ledgerId, long entryId, int partitionIndex, int batchSize) {
        BatchMessageAcker acker = BatchMessageAcker.newAcker(batchSize);
        List<BatchMessageIdImpl> ids = new ArrayList<>(batchSize);
        for (int i = 0; i < batchSize; i++) {
            ids.add(new BatchMessageIdImpl(ledgerId, entryId, partitionIndex, i, batchSize, acker));
        }
        return ids;
    }

    public BatchMessageAcker getAcker() {
        return acker;
    }

    /**
     * @return true if this acknowledgment completed the batch
     */
    public boolean ackIndividual() {
        return acker.ackIndividual(batchIndex);
    }

    /**
     * @return true if this acknowledgment completed the batch
     */
    public boolean ackCumulative() {
        return acker.ackCumulative(batchIndex);
    }

    @Override
    public boolean canAckCumulative() {
        return acker.getOutstandingAcks() == 0;
    }

    /**
     * Id of the whole entry holding this batch.
     */
    public MessageIdImpl toMessageIdImpl() {
        return new MessageIdImpl(ledgerId, entryId, partitionIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        return batchIndex == ((BatchMessageIdImpl) o).batchIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), batchIndex);
    }

    @Override
    public String toString() {
        return super.toString() + ":" + batchIndex;
    }
}
