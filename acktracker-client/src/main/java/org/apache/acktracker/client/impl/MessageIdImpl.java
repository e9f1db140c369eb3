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

import java.util.Objects;
import lombok.Getter;
import org.apache.acktracker.client.api.MessageId;

/**
 * Id of a message stored on its own in a ledger entry.
 */
@Getter
public class MessageIdImpl implements MessageId {
    protected final long ledgerId;
    protected final long entryId;
    protected final int partitionIndex;

    public MessageIdImpl(long ledgerId, long entryId, int partitionIndex) {
        this.ledgerId = ledgerId;
        this.entryId = entryId;
        this.partitionIndex = partitionIndex;
    }

    @Override
    public boolean canAckCumulative() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        // a batch message id never equals a plain one
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MessageIdImpl other = (MessageIdImpl) o;
        return ledgerId == other.ledgerId && entryId == other.entryId && partitionIndex == other.partitionIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ledgerId, entryId, partitionIndex);
    }

    @Override
    public String toString() {
        return ledgerId + ":" + entryId + ":" + partitionIndex;
    }
}
