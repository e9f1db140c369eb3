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

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base type for the failures surfaced by a {@link CumulativeAcksTracker}.
 *
 * <p>A message id that is not tracked is never reported through this exception.
 */
@SuppressWarnings("serial")
public class AckTrackerException extends Exception {

    public AckTrackerException(String msg) {
        super(msg);
    }

    public AckTrackerException(Throwable t) {
        super(t);
    }

    public AckTrackerException(String msg, Throwable t) {
        super(msg, t);
    }

    /**
     * Thrown when an operation is issued on a closed tracker that was configured to fail fast.
     */
    public static class AlreadyClosedException extends AckTrackerException {
        public AlreadyClosedException(String msg) {
            super(msg);
        }
    }

    /**
     * Thrown when a bounded wait for a reply expires.
     */
    public static class TimeoutException extends AckTrackerException {
        public TimeoutException(String msg) {
            super(msg);
        }

        public TimeoutException(Throwable t) {
            super(t);
        }
    }

    /**
     * Converts the failure of a tracker future into an {@link AckTrackerException}.
     *
     * <p>If the calling thread was interrupted, the interrupt flag is restored.
     */
    public static AckTrackerException unwrap(Throwable t) {
        if (t instanceof AckTrackerException) {
            return (AckTrackerException) t;
        } else if (t instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new AckTrackerException("Interrupted while waiting on the ack tracker", t);
        } else if (t instanceof java.util.concurrent.TimeoutException) {
            return new TimeoutException(t);
        } else if ((t instanceof ExecutionException || t instanceof CompletionException)
                && t.getCause() != null) {
            return unwrap(t.getCause());
        }
        return new AckTrackerException(t);
    }
}
