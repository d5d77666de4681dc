/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/ReceiveChannel.java
 description: Consumer-side view of a channel, including iteration helpers.
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
import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.internal.SelectCase;

/**
 * Consumer side of a {@link Channel}.
 *
 * @param <T> element type
 */
public sealed interface ReceiveChannel<T> permits Channel {

    // 🧩 Section: receive

    /**
     * Receive the next element, suspending while the buffer is empty.
     *
     * @throws ChannelClosedException if the channel is closed and drained
     */
    @NonNull T receive(@NonNull SuspendContext s);

    /**
     * Like {@link #receive(SuspendContext)}, but a closed and drained channel yields {@code null}.
     */
    @Nullable T receiveOrNull(@NonNull SuspendContext s);

    /**
     * Receive without suspending.
     *
     * @return the next element, or {@code null} if none is buffered yet
     * @throws ChannelClosedException if the channel is closed and drained
     */
    @Nullable T tryReceive();
    // [/🧩 Section: receive]

    // 🧩 Section: iteration
    @NonNull ReceiveIterator<T> iterator(@NonNull SuspendContext s);

    /**
     * {@link Iterable} view for enhanced-for loops inside a coroutine. Each call to
     * {@code iterator()} on the result creates a fresh {@link ReceiveIterator}.
     */
    default @NonNull Iterable<T> iterate(@NonNull SuspendContext s) {
        return () -> iterator(s);
    }

    /**
     * Consume every element until the channel is closed and drained.
     */
    default void forEach(@NonNull SuspendContext s, @NonNull SuspendConsumer<T> consumer) throws Exception {
        ReceiveIterator<T> it = iterator(s);
        while (it.hasNext()) {
            consumer.accept(s, it.next());
        }
    }
    // [/🧩 Section: iteration]

    // 🧩 Section: lifecycle

    /**
     * Close from the consumer side, e.g. to stop a ticker.
     */
    void close();

    boolean isClosed();

    boolean isEmpty();

    /**
     * Select hook: complete {@code c} now or queue it on this channel.
     *
     * @return {@code true} if the case's selector is resolved, {@code false} if queued
     */
    boolean selectReceive(SelectCase.@NonNull Receive<T, ?> c);
    // [/🧩 Section: lifecycle]
}
