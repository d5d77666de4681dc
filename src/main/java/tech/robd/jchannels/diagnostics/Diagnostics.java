/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/diagnostics/Diagnostics.java
 description: Lightweight diagnostics facade bound to an owning class. Forwards to
              DiagnosticsBackend (SLF4J); global switch via -Djchannels.diag=true.
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

package tech.robd.jchannels.diagnostics;

/**
 * Minimal tracing facade used by channels, selectors, mutexes and scopes.
 * <p>
 * Every class keeps one instance:
 * <pre>{@code
 * private static final Diagnostics DIAG = Diagnostics.of(Channel.class);
 * DIAG.debug("ch#{} send -> buffered (size={})", id, size);
 * }</pre>
 * Messages use SLF4J {@code {}} placeholders. When the {@code jchannels.diag} system
 * property is not {@code true} at class-initialisation time, {@link #of(Class)} hands out a
 * no-op instance and tracing costs a virtual call.
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the class whose logger receives this instance's output
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.log(owner(), DiagnosticsBackend.Level.DEBUG, msg, args);
    }

    default void info(String msg, Object... args) {
        DiagnosticsBackend.log(owner(), DiagnosticsBackend.Level.INFO, msg, args);
    }

    default void warn(String msg, Object... args) {
        DiagnosticsBackend.log(owner(), DiagnosticsBackend.Level.WARN, msg, args);
    }

    /**
     * Emit an error. A trailing {@link Throwable} argument is logged with its stack trace.
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.log(owner(), DiagnosticsBackend.Level.ERROR, msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Diagnostics for {@code owner}, or the no-op instance when tracing is globally off.
     */
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : NoOpD.INSTANCE;
    }

    /**
     * Always-active instance; the global flag is consulted on every call instead of once.
     * Tests that flip tracing at runtime use this.
     */
    static Diagnostics dynamic(Class<?> owner) {
        return new ActiveD(owner);
    }

    static Diagnostics noop() {
        return NoOpD.INSTANCE;
    }
    // [/🧩 Section: factories]

    // 🧩 Section: global-switch
    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }

    static void enable() {
        DiagnosticsBackend.setEnabled(true);
    }

    static void disable() {
        DiagnosticsBackend.setEnabled(false);
    }
    // [/🧩 Section: global-switch]
}
