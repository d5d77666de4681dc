/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/SuspendRunnable.java
 description: Functional interface representing a suspending runnable that executes with a SuspendContext.
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

import org.jspecify.annotations.NonNull;

@FunctionalInterface
public interface SuspendRunnable {

    // [🧩 Section: api]

    /**
     * Executes this runnable within the provided suspending {@code suspend} context.
     *
     * @throws Exception if the task fails. {@link java.util.concurrent.CancellationException}
     *                   signals cancellation.
     */
    void run(@NonNull SuspendContext suspend) throws Exception;
    // [/🧩 Section: api]
}
