/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/ChannelTimers.java
 description: Timer channels: a one-shot channel that fires after a delay and a periodic ticker channel.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
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

import org.jspecify.annotations.NonNull;
import tech.robd.jchannels.diagnostics.Diagnostics;

import java.time.Instant;

/**
 * Channels fed by a timer coroutine, for use as select cases ("timeout" and "heartbeat").
 *
 * <pre>{@code
 * ReceiveChannel<Instant> timeout = ChannelTimers.after(scope, 500);
 * String r = Select.select(s, b -> b
 *         .onReceive(replies, (c, v) -> v)
 *         .onReceive(timeout, (c, t) -> "timed out"));
 * }</pre>
 */
public final class ChannelTimers {

    private static final Diagnostics DIAG = Diagnostics.of(ChannelTimers.class);

    private ChannelTimers() {
    }

    // [🧩 Section: after]

    /**
     * Channel that receives a single {@link Instant} after {@code millis} and is then closed.
     * The timer coroutine runs on {@code scope}; closing the scope closes the channel early.
     */
    public static @NonNull ReceiveChannel<Instant> after(@NonNull JCoroutineScope scope, long millis) {
        if (scope == null) throw new IllegalArgumentException("scope cannot be null");
        if (millis < 0) throw new IllegalArgumentException("millis must not be negative");
        Channel<Instant> ch = new Channel<>(1);
        scope.launch(s -> {
            try {
                s.delay(millis);
                ch.send(s, Instant.now());
                DIAG.debug("after({}) fired on {}", millis, ch);
            } catch (ChannelClosedException e) {
                DIAG.debug("after({}) discarded: consumer closed {}", millis, ch);
            } finally {
                ch.close();
            }
        });
        return ch;
    }
    // [/🧩 Section: after]

    // [🧩 Section: tick]

    /**
     * Channel that receives {@link Instant#now()} every {@code millis}. A slow consumer holds
     * the ticker back: with one buffer slot at most one tick is pending. The ticker stops once
     * the consumer closes the channel, or when {@code scope} is closed.
     */
    public static @NonNull ReceiveChannel<Instant> tick(@NonNull JCoroutineScope scope, long millis) {
        if (scope == null) throw new IllegalArgumentException("scope cannot be null");
        if (millis <= 0) throw new IllegalArgumentException("millis must be positive");
        Channel<Instant> ch = new Channel<>(1);
        scope.launch(s -> {
            try {
                while (!ch.isClosed()) {
                    s.delay(millis);
                    ch.send(s, Instant.now());
                }
            } catch (ChannelClosedException e) {
                DIAG.debug("tick({}) stopped: {} closed", millis, ch);
            }
        });
        return ch;
    }
    // [/🧩 Section: tick]
}
