/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/SelectBuilder.java
 description: Registration API of a select: onSend, onReceive and onDefault cases evaluated in registration order.
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
import tech.robd.jchannels.diagnostics.Diagnostics;
import tech.robd.jchannels.internal.SelectCase;
import tech.robd.jchannels.internal.Selector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Collects the cases of one {@link Select#select} call.
 * <p>
 * A builder is single-use: it owns one {@link Selector}, and {@link Select} creates a fresh
 * builder per select (and per {@link Select#whileSelect} round).
 * </p>
 *
 * @param <R> result type of the select
 */
public final class SelectBuilder<R extends @Nullable Object> {

    private static final Diagnostics DIAG = Diagnostics.of(SelectBuilder.class);

    // 🧩 Section: state
    private final Selector<R> selector = new Selector<>();
    private final List<SelectCase<?, R>> cases = new ArrayList<>();
    private @Nullable SuspendFunction<R> defaultAction;
    private int defaultPosition = -1;
    // [/🧩 Section: state]

    SelectBuilder() {
    }

    // 🧩 Section: registration

    /**
     * Offer {@code value} to {@code channel}; {@code action} runs if the send wins.
     */
    @SuppressWarnings("unchecked")
    public <T> @NonNull SelectBuilder<R> onSend(@NonNull SendChannel<T> channel, @NonNull T value,
                                                @NonNull SuspendFunction<R> action) {
        if (channel == null || action == null) throw new IllegalArgumentException("channel and action are required");
        if (value == null) throw NullPayloadException.forSend();
        cases.add(new SelectCase.Send<>(selector, (Channel<T>) channel, value, action));
        return this;
    }

    /**
     * Receive from {@code channel}; {@code action} maps the element to the select result.
     */
    @SuppressWarnings("unchecked")
    public <T> @NonNull SelectBuilder<R> onReceive(@NonNull ReceiveChannel<T> channel,
                                                   @NonNull SuspendMapper<T, R> action) {
        if (channel == null || action == null) throw new IllegalArgumentException("channel and action are required");
        cases.add(new SelectCase.Receive<>(selector, (Channel<T>) channel, action));
        return this;
    }

    /**
     * Fallback that wins when no case registered before it is ready. Never suspends.
     *
     * @throws IllegalStateException on a second default
     */
    public @NonNull SelectBuilder<R> onDefault(@NonNull SuspendFunction<R> action) {
        if (action == null) throw new IllegalArgumentException("action is required");
        if (defaultAction != null) throw new IllegalStateException("select already has a default case");
        defaultAction = action;
        defaultPosition = cases.size();
        return this;
    }
    // [/🧩 Section: registration]

    // 🧩 Section: select
    R doSelect(@NonNull SuspendContext s) {
        if (cases.isEmpty() && defaultAction == null) throw new EmptySelectorException();
        s.checkCancellation();

        List<SelectCase<?, R>> registered = new ArrayList<>(cases.size());
        Selector.Outcome<R> winner;
        try {
            for (int i = 0; i <= cases.size(); i++) {
                if (i == defaultPosition) {
                    if (selector.tryResolve()) {
                        DIAG.debug("{} -> default case", selector);
                        selector.resume(defaultAction::apply);
                    }
                    break;
                }
                if (i == cases.size()) break;
                SelectCase<?, R> c = cases.get(i);
                registered.add(c);
                if (c.register()) break;
            }
            winner = selector.await(s);
        } finally {
            // cases left queued on other channels
            for (SelectCase<?, R> c : registered) {
                c.unregister();
            }
        }

        try {
            return winner.complete(s);
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
    // [/🧩 Section: select]
}
