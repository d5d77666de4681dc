/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/Select.java
 description: select and whileSelect entry points over channel send/receive cases.
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

import java.util.function.Consumer;

/**
 * Multi-way wait over channel operations.
 *
 * <pre>{@code
 * String r = Select.select(s, b -> b
 *         .onReceive(numbers, (c, n) -> "number " + n)
 *         .onSend(log, "tick", c -> "logged")
 *         .onDefault(c -> "idle"));
 * }</pre>
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Cases are tried in registration order; the first one that can complete without
 *       waiting wins, and nothing happens on the channels of later cases.</li>
 *   <li>A default case wins if no case registered before it was ready; it never suspends.</li>
 *   <li>Otherwise the caller suspends until a counterpart completes exactly one case.</li>
 *   <li>The winning action runs on the caller, after every lock is released.</li>
 *   <li>A winning case on a closed channel throws {@link ChannelClosedException}.</li>
 *   <li>Checked exceptions thrown by an action surface as
 *       {@link java.util.concurrent.CompletionException}.</li>
 * </ul>
 */
public final class Select {

    private Select() {
    }

    /**
     * @throws EmptySelectorException if {@code cases} registers nothing
     * @throws java.util.concurrent.CancellationException if {@code s} is cancelled while waiting
     */
    public static <R extends @Nullable Object> R select(@NonNull SuspendContext s,
                                                        @NonNull Consumer<SelectBuilder<R>> cases) {
        if (s == null || cases == null) throw new IllegalArgumentException("context and cases are required");
        SelectBuilder<R> builder = new SelectBuilder<>();
        cases.accept(builder);
        return builder.doSelect(s);
    }

    /**
     * Run {@link #select} repeatedly, rebuilding the cases each round, until an action returns
     * {@code false}.
     */
    public static void whileSelect(@NonNull SuspendContext s, @NonNull Consumer<SelectBuilder<Boolean>> cases) {
        while (Boolean.TRUE.equals(select(s, cases))) {
            // next round
        }
    }
}
