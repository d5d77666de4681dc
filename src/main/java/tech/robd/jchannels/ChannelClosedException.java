/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/ChannelClosedException.java
 description: Unchecked exception for operations on a closed channel: a rejected send or an exhausted receive.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

/**
 * Raised when a channel operation meets a closed channel.
 * <ul>
 *   <li>{@code send} after {@code close()} (send side).</li>
 *   <li>{@code receive} on a closed channel whose buffer is drained (receive side).</li>
 *   <li>Any waiter still suspended when {@code close()} runs, with the side of the waiter.</li>
 * </ul>
 * {@code receiveOrNull} and iteration never raise it; they report exhaustion as
 * {@code null} / {@code false}.
 */
public final class ChannelClosedException extends IllegalStateException {

    // [🧩 Section: api]
    public static final String CHANNEL_CLOSED = "Channel was closed";

    private final boolean sendSide;

    private ChannelClosedException(String message, boolean sendSide) {
        super(message);
        this.sendSide = sendSide;
    }

    /**
     * A value could not be sent because the channel is closed.
     */
    public static ChannelClosedException forSend() {
        return new ChannelClosedException(CHANNEL_CLOSED + ": send rejected", true);
    }

    /**
     * Nothing left to receive: the channel is closed and its buffer is empty.
     */
    public static ChannelClosedException forReceive() {
        return new ChannelClosedException(CHANNEL_CLOSED + ": no more elements", false);
    }

    /**
     * @return {@code true} for a rejected send, {@code false} for an exhausted receive
     */
    public boolean isSendSide() {
        return sendSide;
    }
    // [/🧩 Section: api]
}
