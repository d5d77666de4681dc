/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/Channel.java
 description: Buffered channel with suspending send/receive, closing, iteration and select support.
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
import tech.robd.jchannels.internal.BaseChannel;

/**
 * Bounded FIFO channel between coroutines.
 *
 * <ul>
 *   <li>{@link #send(SuspendContext, Object)} suspends while {@link #capacity()} elements are
 *       buffered; {@link #receive(SuspendContext)} suspends while none are.</li>
 *   <li>{@link #close()} rejects further sends. Buffered elements can still be received;
 *       afterwards receivers see {@link ChannelClosedException} or {@code null}.</li>
 *   <li>Both sides take part in {@link Select#select}.</li>
 * </ul>
 *
 * <pre>{@code
 * Channel<Integer> ch = new Channel<>(4);
 * s.launch(p -> {
 *     for (int i = 0; i < 10; i++) ch.send(p, i);
 *     ch.close();
 * });
 * for (Integer i : ch.iterate(s)) System.out.println(i);
 * }</pre>
 *
 * <p>{@code null} is not a valid element; it is the closed marker of {@link #receiveOrNull}.</p>
 *
 * @param <T> element type
 * @author Rob Deas
 * @since 0.1.0
 */
public final class Channel<T> extends BaseChannel<T> implements SendChannel<T>, ReceiveChannel<T> {

    // 🧩 Section: factories

    /**
     * Rendezvous-style channel with one buffer slot.
     */
    public Channel() {
        this(1);
    }

    /**
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public Channel(int capacity) {
        super(capacity);
    }

    public static <T> @NonNull Channel<T> buffered(int capacity) {
        return new Channel<>(capacity);
    }
    // [/🧩 Section: factories]

    // 🧩 Section: send
    @Override
    public void send(@NonNull SuspendContext s, @NonNull T item) {
        sendInternal(s, item);
    }

    @Override
    public boolean trySend(@NonNull T item) {
        return trySendInternal(item);
    }
    // [/🧩 Section: send]

    // 🧩 Section: receive
    @Override
    public @NonNull T receive(@NonNull SuspendContext s) {
        return receiveInternal(s);
    }

    @Override
    public @Nullable T receiveOrNull(@NonNull SuspendContext s) {
        return receiveOrNullInternal(s);
    }

    @Override
    public @Nullable T tryReceive() {
        return tryReceiveInternal();
    }

    @Override
    public @NonNull ReceiveIterator<T> iterator(@NonNull SuspendContext s) {
        return iteratorInternal(s);
    }
    // [/🧩 Section: receive]
}
