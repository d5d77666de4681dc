/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/tools/TestAwaitUtils.java
 description: Await toolkit for deterministic channel tests: awaitTrue, awaitLatch, awaitDone/Cancelled/Completed/Failed for JCoroutineHandle.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tech.robd.jchannels.tools;

import tech.robd.jchannels.fn.JCoroutineHandle;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic wait helpers for concurrent tests.
 */
public final class TestAwaitUtils {
    private TestAwaitUtils() {
    }

    /**
     * Poll a boolean condition until true or timeout (fails the test on timeout).
     */
    public static void awaitTrue(BooleanSupplier cond, long timeoutMs, String msg) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (cond.getAsBoolean()) return;
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + msg);
            }
        }
        fail(msg);
    }

    /**
     * Await a CountDownLatch or fail with a useful message.
     */
    public static void awaitLatch(CountDownLatch latch, long timeoutMs, String msg) {
        try {
            assertTrue(latch.await(timeoutMs, TimeUnit.MILLISECONDS), msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch: " + e);
        }
    }

    /**
     * Spin-wait until the handle's future is done (cancelled or completed) or fail on timeout.
     */
    public static void awaitDone(JCoroutineHandle<?> handle, long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!handle.result().isDone() && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertTrue(handle.result().isDone(), "Handle did not complete within " + timeoutMs + "ms");
    }

    /**
     * Confirm a handle ends cancelled within timeout and that join() throws CancellationException.
     */
    public static void awaitCancelled(JCoroutineHandle<?> handle, long timeoutMs) {
        awaitDone(handle, timeoutMs);
        assertTrue(handle.result().isCancelled() || handle.result().isCompletedExceptionally(),
                "Future not cancelled/exceptional after completion");
        assertThrows(CancellationException.class, handle::join, "join() should throw CancellationException");
    }

    /**
     * Wait for successful completion and return the result.
     * Fails if cancelled/exceptional or if not done by the timeout.
     */
    public static <T> T awaitCompleted(JCoroutineHandle<T> handle, long timeoutMs) {
        awaitDone(handle, timeoutMs);
        try {
            return handle.join();
        } catch (Exception e) {
            fail("Handle completed exceptionally: " + e);
            throw new AssertionError(e); // unreachable
        }
    }

    /**
     * Wait for the handle to fail and return its (unwrapped) failure, asserting its type.
     */
    public static <X extends Throwable> X awaitFailed(JCoroutineHandle<?> handle, Class<X> type, long timeoutMs) {
        awaitDone(handle, timeoutMs);
        return assertThrows(type, handle::join, "join() should throw " + type.getSimpleName());
    }

    /**
     * Assert the handle stays incomplete for {@code millis}. Only a smoke check; tests pair it
     * with a waiter count so it never stands in for synchronization.
     */
    public static void assertStillRunning(JCoroutineHandle<?> handle, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        assertFalse(handle.isCompleted(), "Handle completed but should still be suspended");
    }
}
