/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/SelectCase.java
 description: Send and receive cases of a select; queued like ordinary waiters but completed through their selector.
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

package tech.robd.jchannels.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.ChannelClosedException;
import tech.robd.jchannels.SuspendContext;
import tech.robd.jchannels.SuspendFunction;
import tech.robd.jchannels.SuspendMapper;

/**
 * A select alternative bound to one channel.
 *
 * <p>Counterparts complete a case like any waiter; the case records what happened and resumes
 * the selector with itself as the {@link Selector.Outcome}. The user action runs later in
 * {@link #complete(SuspendContext)}, on the selecting coroutine and outside every lock.</p>
 *
 * @param <T> channel element type
 * @param <R> select result type
 */
public abstract sealed class SelectCase<T, R> extends Waiter<T> implements Selector.Outcome<R>
        permits SelectCase.Send, SelectCase.Receive {

    protected final Selector<R> selector;
    protected final BaseChannel<T> channel;
    protected volatile boolean closed;

    private SelectCase(Selector<R> selector, BaseChannel<T> channel) {
        this.selector = selector;
        this.channel = channel;
    }

    /**
     * Try to complete against the channel, or queue there.
     *
     * @return {@code true} once the selector is resolved, by this case or earlier
     */
    public abstract boolean register();

    /**
     * Remove this case from its channel's queue if it is still there.
     */
    public void unregister() {
        channel.withdraw(this);
    }

    @Override
    public boolean claim() {
        return selector.tryResolve();
    }

    @Override
    public boolean isStale() {
        return selector.isResolved();
    }

    @Override
    public void resumeClosed() {
        closed = true;
        selector.resume(this);
    }

    // 🧩 Section: send-case
    public static final class Send<T, R> extends SelectCase<T, R> {
        private final T value;
        private final SuspendFunction<R> action;

        public Send(Selector<R> selector, BaseChannel<T> channel, T value, SuspendFunction<R> action) {
            super(selector, channel);
            this.value = value;
            this.action = action;
        }

        @Override
        public boolean register() {
            return channel.selectSend(this);
        }

        @Override
        public T sendValue() {
            return value;
        }

        @Override
        public void resumeSent() {
            selector.resume(this);
        }

        @Override
        public R complete(@NonNull SuspendContext s) throws Exception {
            if (closed) throw ChannelClosedException.forSend();
            return action.apply(s);
        }
    }
    // [/🧩 Section: send-case]

    // 🧩 Section: receive-case
    public static final class Receive<T, R> extends SelectCase<T, R> {
        private final SuspendMapper<T, R> action;
        private volatile @Nullable T value;

        public Receive(Selector<R> selector, BaseChannel<T> channel, SuspendMapper<T, R> action) {
            super(selector, channel);
            this.action = action;
        }

        @Override
        public boolean register() {
            return channel.selectReceive(this);
        }

        @Override
        public void deliver(T value) {
            this.value = value;
            selector.resume(this);
        }

        @Override
        public R complete(@NonNull SuspendContext s) throws Exception {
            if (closed) throw ChannelClosedException.forReceive();
            return action.apply(s, value);
        }
    }
    // [/🧩 Section: receive-case]
}
