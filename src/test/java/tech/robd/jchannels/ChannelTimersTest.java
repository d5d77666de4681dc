/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/ChannelTimersTest.java
 description: Timer channels: after() fires once then closes, tick() delivers repeatedly and stops when closed.
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

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class ChannelTimersTest {

    private JCoroutineScope scope;

    @BeforeEach
    void setUp() {
        scope = Coroutines.newScope("timers-test");
    }

    @AfterEach
    void tearDown() {
        scope.close();
    }

    @Test
    @Timeout(3)
    void afterDeliversOneInstantThenCloses() {
        Instant start = Instant.now();
        ReceiveChannel<Instant> timer = ChannelTimers.after(scope, 50);

        Instant fired = scope.runBlocking(timer::receive);
        assertFalse(fired.isBefore(start.plusMillis(40)), "fired too early: " + fired);
        assertNull(scope.runBlocking(timer::receiveOrNull));
        assertTrue(timer.isClosed());
    }

    @Test
    @Timeout(3)
        // The timeout idiom: a select over a silent channel and an after() channel picks the timer.
    void afterWorksAsSelectTimeout() {
        Channel<String> silent = new Channel<>(1);
        ReceiveChannel<Instant> timeout = ChannelTimers.after(scope, 30);

        String r = scope.runBlocking(s -> Select.select(s, sel -> sel
                .onReceive(silent, (c, v) -> v)
                .onReceive(timeout, (c, t) -> "timed out")));

        assertEquals("timed out", r);
        assertEquals(0, silent.waiterCount());
    }

    @Test
    @Timeout(3)
    void tickDeliversUntilClosedByConsumer() {
        ReceiveChannel<Instant> ticker = ChannelTimers.tick(scope, 10);

        Instant first = scope.runBlocking(ticker::receive);
        Instant second = scope.runBlocking(ticker::receive);
        Instant third = scope.runBlocking(ticker::receive);
        assertFalse(second.isBefore(first));
        assertFalse(third.isBefore(second));

        ticker.close();
        assertTrue(ticker.isClosed());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ChannelTimers.after(scope, -1));
        assertThrows(IllegalArgumentException.class, () -> ChannelTimers.tick(scope, 0));
        assertThrows(IllegalArgumentException.class, () -> ChannelTimers.after(null, 10));
    }
}
