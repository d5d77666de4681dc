/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/BrokenInvariantError.java
 description: Error raised when an internal channel, selector or mutex invariant is found broken.
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
 * An internal invariant of a channel, selector, wait queue or mutex was violated: a waiter
 * linked twice or unlinked while not linked, a continuation resumed twice, a half-full
 * channel holding waiters, an unlock of an unlocked mutex.
 * <p>
 * This is an {@link Error}: the structure involved can no longer be trusted and the library
 * never catches it.
 */
public final class BrokenInvariantError extends Error {

    public BrokenInvariantError(String message) {
        super(message);
    }
}
