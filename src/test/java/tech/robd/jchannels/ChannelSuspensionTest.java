/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/ChannelSuspensionTest.java
 description: Suspending channel paths: full sends, empty receives, close wake-ups, rendezvous, handoff order, cancellation.
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
package tech.robd.jchannels;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jchannels.fn.JCoroutineHandle;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.jchannels.tools.TestAwaitUtils.*;

final class ChannelSuspensionTest {

    private JCoroutineScope scope;

    @BeforeEach
    void setUp() {
        scope = Coroutines.newScope("suspension-test");
    }

    @AfterEach
    void tearDown() {
        scope.close();
    }

    @Test
    @Timeout(3)
        // Capacity 2: two sends, two receives, then a third receive must park.
        // Race-avoidance: the queued waiter count, not a sleep, proves the receiver is parked.
    void thirdReceiveOnEmptyOpenChannelSuspends() {
        Channel<Integer> ch = new Channel<>(2);
        scope.runBlocking(s -> {
            ch.send(s, 1);
            ch.send(s, 2);
            assertEquals(1, ch.receive(s));
            assertEquals(2, ch.receive(s));
            return null;
        });

        JCoroutineHandle<Integer> third = scope.async(ch::receive);
        awaitTrue(() -> ch.waiterCount() == 1, 1000, "receiver should be queued");
        assertStillRunning(third, 50);

        assertTrue(ch.trySend(3));
        Integer got = awaitCompleted(third, 1000);
        assertEquals(3, got);
    }

    @Test
    @Timeout(3)
        // A send beyond capacity parks; freeing a slot moves the parked value into the buffer.
    void fullSendSuspendsUntilSlotFrees() {
        Channel<String> ch = new Channel<>(1);
        assertTrue(ch.trySend("x"));

        JCoroutineHandle<String> sender = scope.async(s -> {
            ch.send(s, "y");
            return "sent";
        });
        awaitTrue(() -> ch.waiterCount() == 1, 1000, "sender should be queued");
        assertEquals(1, ch.size(), "buffer never exceeds capacity");
        assertStillRunning(sender, 50);

        assertEquals("x", ch.tryReceive());
        assertEquals("sent", awaitCompleted(sender, 1000));
        assertEquals(1, ch.size());
        assertEquals("y", ch.tryReceive());
        assertEquals(0, ch.waiterCount());
    }

    @Test
    @Timeout(3)
        // close() resumes receive, receiveOrNull and hasNext waiters with their closed outcomes.
    void closeWakesEveryQueuedReceiver() {
        Channel<Integer> ch = new Channel<>(1);
        JCoroutineHandle<Integer> plain = scope.async(ch::receive);
        JCoroutineHandle<Integer> orNull = scope.async(ch::receiveOrNull);
        JCoroutineHandle<Boolean> waiting = scope.async(s -> ch.iterator(s).hasNext());
        awaitTrue(() -> ch.waiterCount() == 3, 1000, "three receivers should be queued");

        ch.close();

        ChannelClosedException ex = awaitFailed(plain, ChannelClosedException.class, 1000);
        assertFalse(ex.isSendSide());
        assertNull(awaitCompleted(orNull, 1000));
        assertEquals(Boolean.FALSE, awaitCompleted(waiting, 1000));
        assertEquals(0, ch.waiterCount());
    }

    @Test
    @Timeout(3)
        // Closing a full channel rejects parked senders but keeps the buffered element.
    void closeRejectsParkedSendersAndKeepsBuffer() {
        Channel<Integer> ch = new Channel<>(1);
        assertTrue(ch.trySend(1));
        JCoroutineHandle<Object> sender = scope.async(s -> {
            ch.send(s, 2);
            return null;
        });
        awaitTrue(() -> ch.waiterCount() == 1, 1000, "sender should be queued");

        ch.close();

        ChannelClosedException ex = awaitFailed(sender, ChannelClosedException.class, 1000);
        assertTrue(ex.isSendSide());
        assertEquals(1, ch.tryReceive());
        assertThrows(ChannelClosedException.class, ch::tryReceive);
    }

    @Test
    @Timeout(3)
        // Receiver registered first: the send hands over directly and nothing stays buffered.
    void receiverFirstRendezvous() {
        Channel<Integer> ch = new Channel<>(1);
        JCoroutineHandle<Integer> receiver = scope.async(ch::receive);
        awaitTrue(() -> ch.waiterCount() == 1, 1000, "receiver should be queued");

        JCoroutineHandle<Object> sender = scope.async(s -> {
            ch.send(s, 42);
            return null;
        });

        Integer got = awaitCompleted(receiver, 1000);
        assertEquals(42, got);
        awaitCompleted(sender, 1000);
        assertTrue(ch.isEmpty());
    }

    @Test
    @Timeout(10)
        // Capacity 1, one producer and one consumer started in either order: exactly one delivery.
    void rendezvousNeverLosesOrDuplicates() {
        for (int i = 0; i < 200; i++) {
            Channel<Integer> ch = new Channel<>(1);
            final int value = i;
            JCoroutineHandle<Integer> consumer;
            JCoroutineHandle<Object> producer;
            if (i % 2 == 0) {
                consumer = scope.async(ch::receive);
                producer = scope.async(s -> {
                    ch.send(s, value);
                    return null;
                });
            } else {
                producer = scope.async(s -> {
                    ch.send(s, value);
                    return null;
                });
                consumer = scope.async(ch::receive);
            }
            Integer got = awaitCompleted(consumer, 2000);
            awaitCompleted(producer, 2000);
            assertEquals(value, got);
            assertTrue(ch.isEmpty(), "value must not be duplicated into the buffer");
            assertNull(ch.tryReceive());
        }
    }

    @Test
    @Timeout(3)
        // Direct handoffs follow the order in which receivers registered.
    void handoffFollowsReceiverRegistrationOrder() {
        Channel<Integer> ch = new Channel<>(1);
        List<JCoroutineHandle<Integer>> receivers = new ArrayList<>();
        for (int k = 0; k < 3; k++) {
            receivers.add(scope.async(ch::receive));
            final int expected = k + 1;
            awaitTrue(() -> ch.waiterCount() == expected, 1000, "receiver " + k + " should be queued");
        }

        for (int k = 1; k <= 3; k++) assertTrue(ch.trySend(k));

        for (int k = 0; k < 3; k++) {
            Integer got = awaitCompleted(receivers.get(k), 1000);
            assertEquals(k + 1, got);
        }
    }

    @Test
    @Timeout(3)
        // A cancelled receiver leaves the queue, so the next element is not swallowed.
    void cancelledReceiverWithdraws() {
        Channel<Integer> ch = new Channel<>(1);
        JCoroutineHandle<Integer> receiver = scope.async(ch::receive);
        awaitTrue(() -> ch.waiterCount() == 1, 1000, "receiver should be queued");

        receiver.cancel();
        awaitCancelled(receiver, 1000);
        assertEquals(0, ch.waiterCount());

        assertTrue(ch.trySend(7));
        assertEquals(7, ch.tryReceive());
    }

    @Test
    @Timeout(3)
        // A cancelled sender leaves the queue and its element is never delivered.
    void cancelledSenderWithdraws() {
        Channel<String> ch = new Channel<>(1);
        assertTrue(ch.trySend("kept"));
        JCoroutineHandle<Object> sender = scope.async(s -> {
            ch.send(s, "dropped");
            return null;
        });
        awaitTrue(() -> ch.waiterCount() == 1, 1000, "sender should be queued");

        sender.cancel();
        awaitCancelled(sender, 1000);

        assertEquals(0, ch.waiterCount());
        assertEquals("kept", ch.tryReceive());
        assertNull(ch.tryReceive());
    }

    @Test
    @Timeout(3)
        // Closing the scope cancels every coroutine parked on the channel.
    void scopeCloseCancelsParkedCoroutines() {
        Channel<Integer> ch = new Channel<>(1);
        JCoroutineHandle<Integer> a = scope.async(ch::receive);
        JCoroutineHandle<Integer> b = scope.async(ch::receive);
        awaitTrue(() -> ch.waiterCount() == 2, 1000, "receivers should be queued");

        scope.close();

        awaitCancelled(a, 1000);
        awaitCancelled(b, 1000);
        awaitTrue(() -> ch.waiterCount() == 0, 1000, "withdrawn receivers leave the queue");
        assertFalse(ch.isClosed());
    }
}
