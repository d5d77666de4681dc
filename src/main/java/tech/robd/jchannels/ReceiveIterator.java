/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/ReceiveIterator.java
 description: Suspending iterator over a receive channel.
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

import java.util.Iterator;

/**
 * Iterator bound to one {@link ReceiveChannel} and one {@link SuspendContext}.
 * <p>
 * {@link #hasNext()} suspends until an element arrives or the channel is closed and drained,
 * and keeps the element for the following {@link #next()}. Calling {@code next()} without a
 * prior {@code hasNext()} is a plain receive.
 * </p>
 * <p>Not thread-safe: use one iterator per consuming coroutine.</p>
 *
 * @param <T> element type
 */
public interface ReceiveIterator<T> extends Iterator<T> {

    /**
     * @return {@code false} once the channel is closed and drained
     * @throws java.util.concurrent.CancellationException if the owning coroutine is cancelled
     */
    @Override
    boolean hasNext();

    /**
     * @throws java.util.NoSuchElementException when the channel is closed and drained
     */
    @Override
    T next();
}
