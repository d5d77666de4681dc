/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/fn/JCoroutineHandle.java
 description: Handle to a launched coroutine: cancellation, state inspection, result future.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

package tech.robd.jchannels.fn;

import java.util.concurrent.CompletableFuture;

public interface JCoroutineHandle<T> {

    /**
     * Request cancellation. A coroutine suspended on a channel, select or mutex withdraws
     * and observes {@link java.util.concurrent.CancellationException}.
     *
     * @return {@code true} if this call requested the cancellation
     */
    boolean cancel();

    boolean isActive();

    /**
     * @return {@code true} once finished (success, failure, or cancellation)
     */
    boolean isCompleted();

    CompletableFuture<T> result();

    /**
     * Block the calling thread until the coroutine completes, then return its result.
     *
     * @throws Exception the coroutine's own failure, unwrapped
     */
    T join() throws Exception;
}
