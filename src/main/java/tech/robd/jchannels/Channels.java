/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/Channels.java
 description: Channel helpers: fan-in of several receive channels and draining a channel into a list.
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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Utility methods for composing {@link Channel}s.
 */
public final class Channels {
    private static final Diagnostics DIAG = Diagnostics.of(Channels.class);

    private Channels() {
    }

    // [🧩 Section: fan-in]

    /**
     * Merge {@code inputs} into one channel. Each input is forwarded by its own coroutine on
     * {@code scope}, so elements of one input keep their order while inputs interleave freely.
     * The merged channel closes after the last input is closed and drained. Closing the merged
     * channel stops each forwarder at its next element: one still waiting on an empty input
     * stays parked until that input delivers or closes.
     */
    @SafeVarargs
    public static <T> @NonNull ReceiveChannel<T> fanIn(@NonNull JCoroutineScope scope,
                                                       @NonNull ReceiveChannel<T>... inputs) {
        if (scope == null || inputs == null) throw new IllegalArgumentException("Arguments cannot be null");
        Channel<T> out = new Channel<>(1);
        if (inputs.length == 0) {
            out.close();
            return out;
        }
        AtomicInteger open = new AtomicInteger(inputs.length);
        for (ReceiveChannel<T> input : inputs) {
            if (input == null) throw new IllegalArgumentException("input channel cannot be null");
            scope.launch(s -> {
                try {
                    input.forEach(s, out::send);
                } catch (ChannelClosedException e) {
                    DIAG.debug("fanIn forwarder stopped: output closed");
                } finally {
                    if (open.decrementAndGet() == 0) {
                        DIAG.debug("fanIn all inputs done -> close {}", out);
                        out.close();
                    }
                }
            });
        }
        return out;
    }
    // [/🧩 Section: fan-in]

    // [🧩 Section: drain]

    /**
     * Receive until {@code ch} is closed and drained.
     *
     * @return the received elements in order
     */
    public static <T> @NonNull List<T> drain(@NonNull SuspendContext s, @NonNull ReceiveChannel<T> ch) {
        if (s == null || ch == null) throw new IllegalArgumentException("Arguments cannot be null");
        List<T> out = new ArrayList<>();
        ReceiveIterator<T> it = ch.iterator(s);
        while (it.hasNext()) {
            out.add(it.next());
        }
        DIAG.debug("drain collected {} element(s)", out.size());
        return out;
    }
    // [/🧩 Section: drain]
}
