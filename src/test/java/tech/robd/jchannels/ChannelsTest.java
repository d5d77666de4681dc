/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/ChannelsTest.java
 description: Channel helpers: fanIn merging and closing, drain collecting until close.
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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static tech.robd.jchannels.tools.TestAwaitUtils.awaitTrue;

final class ChannelsTest {

    private JCoroutineScope scope;

    @BeforeEach
    void setUp() {
        scope = Coroutines.newScope("channels-test");
    }

    @AfterEach
    void tearDown() {
        scope.close();
    }

    @Test
    @Timeout(3)
        // Elements of one input keep their relative order; the merge closes after every input.
    void fanInMergesAndClosesAfterAllInputs() {
        Channel<String> left = new Channel<>(2);
        Channel<String> right = new Channel<>(2);
        ReceiveChannel<String> merged = Channels.fanIn(scope, left, right);

        scope.launch(s -> {
            for (int i = 0; i < 5; i++) left.send(s, "L" + i);
            left.close();
        });
        scope.launch(s -> {
            for (int i = 0; i < 5; i++) right.send(s, "R" + i);
            right.close();
        });

        List<String> got = scope.runBlocking(s -> Channels.drain(s, merged));

        assertEquals(10, got.size());
        List<String> lefts = new ArrayList<>();
        List<String> rights = new ArrayList<>();
        for (String v : got) (v.startsWith("L") ? lefts : rights).add(v);
        assertEquals(List.of("L0", "L1", "L2", "L3", "L4"), lefts);
        assertEquals(List.of("R0", "R1", "R2", "R3", "R4"), rights);
        assertTrue(merged.isClosed());
    }

    @Test
    void fanInOfNothingIsClosedImmediately() {
        ReceiveChannel<Integer> merged = Channels.fanIn(scope);
        assertTrue(merged.isClosed());
        assertNull(scope.runBlocking(merged::receiveOrNull));
    }

    @Test
    @Timeout(3)
        // Closing the merged channel stops the forwarder at its next send; later input stays put.
    void closingTheMergeStopsForwarders() throws InterruptedException {
        Channel<Integer> source = new Channel<>(1);
        assertTrue(source.trySend(0));
        ReceiveChannel<Integer> merged = Channels.fanIn(scope, source);

        Integer first = scope.runBlocking(merged::receive);
        assertEquals(0, first);
        awaitTrue(() -> source.waiterCount() == 1, 1000, "forwarder should wait on the source");
        merged.close();
        Thread.sleep(50);
        assertEquals(1, source.waiterCount(), "forwarder stays parked until the source delivers");

        // handed straight to the parked forwarder, whose send then fails
        assertTrue(source.trySend(1));
        assertTrue(source.trySend(2));
        Thread.sleep(50);
        assertEquals(1, source.size());
        assertEquals(0, source.waiterCount(), "forwarder must not resume receiving");
        assertEquals(2, source.tryReceive());
    }

    @Test
    @Timeout(2)
    void drainCollectsBufferedElementsOfAClosedChannel() {
        Channel<Integer> ch = new Channel<>(3);
        for (int i = 1; i <= 3; i++) assertTrue(ch.trySend(i));
        ch.close();

        assertEquals(List.of(1, 2, 3), scope.runBlocking(s -> Channels.drain(s, ch)));
        assertEquals(List.of(), scope.runBlocking(s -> Channels.drain(s, ch)));
    }
}
