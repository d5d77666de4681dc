/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/SuspendMapper.java
 description: Functional interface mapping a received element to a select result inside a SuspendContext.
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
import org.jspecify.annotations.Nullable;

/**
 * Action of an {@code onReceive} select case: turns the received element into the
 * result of the whole {@code select}.
 *
 * @param <T> element type of the channel
 * @param <R> result type of the select
 */
@FunctionalInterface
public interface SuspendMapper<T, R extends @Nullable Object> {

    // [🧩 Section: api]
    @Nullable
    R apply(@NonNull SuspendContext suspend, @NonNull T item) throws Exception;
    // [/🧩 Section: api]
}
