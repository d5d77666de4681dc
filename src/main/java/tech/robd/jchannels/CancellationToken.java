/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/CancellationToken.java
 description: Cancellation signal carried by every SuspendContext. Tree-structured: cancelling
              a token cancels its children. Suspend points register interrupt hooks on it.
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

package tech.robd.jchannels;

public interface CancellationToken {

    /**
     * @return {@code true} once {@link #cancel()} ran on this token or an ancestor
     */
    boolean isCancelled();

    /**
     * Register a callback to run on cancellation.
     * <p>If already cancelled, the callback runs immediately on the calling thread.</p>
     *
     * @param callback fast, non-blocking action (suspend points use {@code Thread::interrupt})
     * @return handle removing the callback when closed
     */
    AutoCloseable onCancel(Runnable callback);

    /**
     * @return a new token cancelled together with this one, cancellable on its own
     */
    CancellationToken child();

    /**
     * Cancel this token and all its children. Safe to call repeatedly.
     *
     * @return {@code true} for the call that performed the cancellation
     */
    boolean cancel();
}
