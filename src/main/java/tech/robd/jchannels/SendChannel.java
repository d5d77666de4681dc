/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/SendChannel.java
 description: Producer-side view of a channel.
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
import tech.robd.jchannels.internal.SelectCase;

/**
 * Producer side of a {@link Channel}.
 *
 * @param <T> element type
 */
public sealed interface SendChannel<T> permits Channel {

    // 🧩 Section: api

    /**
     * Send {@code item}, suspending while the buffer is full.
     *
     * @throws ChannelClosedException  if the channel is closed before or while waiting
     * @throws NullPayloadException    if {@code item} is {@code null}
     * @throws java.util.concurrent.CancellationException if {@code s} is cancelled while waiting
     */
    void send(@NonNull SuspendContext s, @NonNull T item);

    /**
     * Send without suspending.
     *
     * @return {@code false} if the buffer is full or the channel is closed
     */
    boolean trySend(@NonNull T item);

    /**
     * Close the channel. Idempotent. Buffered elements remain receivable.
     */
    void close();

    boolean isClosed();

    /**
     * Select hook: complete {@code c} now or queue it on this channel.
     *
     * @return {@code true} if the case's selector is resolved, {@code false} if queued
     */
    boolean selectSend(SelectCase.@NonNull Send<T, ?> c);
    // [/🧩 Section: api]
}
