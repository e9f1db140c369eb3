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

import static org.assertj.core.api.Assertions.assertThat;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.Test;

public class AckTrackerExceptionTest {

    @AfterMethod(alwaysRun = true)
    public void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    public void testUnwrapKeepsTrackerExceptions() {
        AckTrackerException closed = new AckTrackerException.AlreadyClosedException("closed");

        assertThat(AckTrackerException.unwrap(closed)).isSameAs(closed);
        assertThat(AckTrackerException.unwrap(new ExecutionException(closed))).isSameAs(closed);
        assertThat(AckTrackerException.unwrap(new CompletionException(closed))).isSameAs(closed);
    }

    @Test
    public void testUnwrapWrapsOtherFailures() {
        IllegalStateException cause = new IllegalStateException("broken");

        AckTrackerException e = AckTrackerException.unwrap(new ExecutionException(cause));
        assertThat(e).isExactlyInstanceOf(AckTrackerException.class);
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    public void testUnwrapTimeout() {
        AckTrackerException e = AckTrackerException.unwrap(new java.util.concurrent.TimeoutException("late"));
        assertThat(e).isInstanceOf(AckTrackerException.TimeoutException.class);
    }

    @Test
    public void testUnwrapInterruptRestoresFlag() {
        InterruptedException interrupted = new InterruptedException();

        AckTrackerException e = AckTrackerException.unwrap(interrupted);

        assertThat(e.getCause()).isSameAs(interrupted);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
