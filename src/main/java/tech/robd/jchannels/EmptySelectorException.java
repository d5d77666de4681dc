/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/EmptySelectorException.java
 description: Raised when select is invoked without a single registered case.
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
 * A {@code select} was built with no cases. Caller programming error, never a race.
 */
public final class EmptySelectorException extends IllegalArgumentException {

    public EmptySelectorException() {
        super("select requires at least one onSend/onReceive/onDefault case");
    }
}
