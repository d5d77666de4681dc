/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/NullPayloadException.java
 description: Runtime exception for a null element offered to a channel; null is reserved for receiveOrNull exhaustion.
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

public final class NullPayloadException extends RuntimeException {

    // [🧩 Section: api]

    public NullPayloadException(String message) {
        super(message);
    }

    /**
     * The common case: {@code null} cannot travel through a channel because
     * {@code receiveOrNull} uses it to report a closed, drained channel.
     */
    public static NullPayloadException forSend() {
        return new NullPayloadException(
                "Cannot send null: null is how receiveOrNull() reports a closed channel. " +
                        "Wrap the element (e.g. Optional<T>) if absence must be transmitted."
        );
    }
    // [/🧩 Section: api]
}
