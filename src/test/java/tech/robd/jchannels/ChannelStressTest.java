/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/ChannelStressTest.java
 description: Stress: many producers and consumers on small buffers; counts, sums and the capacity bound must hold.
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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jchannels.fn.JCoroutineHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class ChannelStressTest {

    @Test
    @Timeout(10)
        // N producers and M consumers on a small buffer; counts and sums must match exactly.
        // Race-avoidance: join ALL producers before close(), then consumers drain and see null.
    void manyProducersConsumersSmallBuffer() throws Exception {
        final int PRODUCERS = 6, CONSUMERS = 4, N = 500, CAPACITY = 4;
        Channel<Integer> ch = Channel.buffered(CAPACITY);
        AtomicInteger consumed = new AtomicInteger();
        AtomicLong sum = new AtomicLong();
        AtomicInteger maxSeen = new AtomicInteger();

        try (JCoroutineScope scope = Coroutines.newScope("stress")) {
            List<JCoroutineHandle<Object>> consumers = new ArrayList<>();
            for (int c = 0; c < CONSUMERS; c++) {
                consumers.add(scope.async(s -> {
                    for (Integer v = ch.receiveOrNull(s); v != null; v = ch.receiveOrNull(s)) {
                        consumed.incrementAndGet();
                        sum.addAndGet(v);
                        maxSeen.accumulateAndGet(ch.size(), Math::max);
                    }
                    return null;
                }));
            }

            List<JCoroutineHandle<Object>> producers = new ArrayList<>();
            for (int p = 0; p < PRODUCERS; p++) {
                final int id = p;
                producers.add(scope.async(s -> {
                    for (int i = 0; i < N; i++) ch.send(s, id * N + i);
                    return null;
                }));
            }

            for (var h : producers) h.join();
            ch.close();
            for (var h : consumers) h.join();
        }

        int total = PRODUCERS * N;
        assertEquals(total, consumed.get());
        assertEquals((long) total * (total - 1) / 2, sum.get());
        assertTrue(maxSeen.get() <= CAPACITY, "buffer exceeded capacity: " + maxSeen.get());
        assertEquals(0, ch.waiterCount());
    }

    @Test
    @Timeout(10)
        // Single producer, single consumer on a rendezvous-sized buffer: strict FIFO end to end.
    void singlePairPreservesOrder() throws Exception {
        final int N = 2_000;
        Channel<Integer> ch = new Channel<>(1);
        try (JCoroutineScope scope = Coroutines.newScope("stress-fifo")) {
            JCoroutineHandle<Object> producer = scope.async(s -> {
                for (int i = 0; i < N; i++) ch.send(s, i);
                ch.close();
                return null;
            });
            List<Integer> got = scope.runBlocking(s -> Channels.drain(s, ch));
            producer.join();

            assertEquals(N, got.size());
            for (int i = 0; i < N; i++) assertEquals(i, got.get(i));
        }
    }
}
