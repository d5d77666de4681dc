/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/diagnostics/DiagnosticsBackend.java
 description: Diagnostics sink forwarding to SLF4J (LocationAwareLogger when the binding
              offers it). Global on/off switch: system property `jchannels.diag`.
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SLF4J sink behind {@link Diagnostics}.
 *
 * <ul>
 *   <li>Disabled unless {@code -Djchannels.diag=true}; a disabled call returns before any lookup.</li>
 *   <li>One {@link Logger} per owner class, cached.</li>
 *   <li>{@link LocationAwareLogger} is preferred so caller location points at library code,
 *       not at this class.</li>
 * </ul>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    static final String DIAGNOSTICS_PROPERTY_NAME = "jchannels.diag";

    private static final String FQCN = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: constants-and-state]

    enum Level {
        DEBUG(LocationAwareLogger.DEBUG_INT),
        INFO(LocationAwareLogger.INFO_INT),
        WARN(LocationAwareLogger.WARN_INT),
        ERROR(LocationAwareLogger.ERROR_INT);

        final int slf4jLevel;

        Level(int slf4jLevel) {
            this.slf4jLevel = slf4jLevel;
        }
    }

    private DiagnosticsBackend() {
    }

    // 🧩 Section: enablement
    static boolean isEnabled() {
        return enabled;
    }

    static void setEnabled(boolean on) {
        enabled = on;
    }
    // [/🧩 Section: enablement]

    // 🧩 Section: emit
    static void log(Class<?> owner, Level level, String msg, Object... args) {
        if (!enabled) return; // fast path
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);

        if (log instanceof LocationAwareLogger law) {
            Throwable t = MessageFormatter.getThrowableCandidate(args);
            Object[] params = t == null ? args : MessageFormatter.trimmedCopy(args);
            law.log(null, FQCN, level.slf4jLevel, msg, params, t);
            return;
        }

        switch (level) {
            case DEBUG -> {
                if (log.isDebugEnabled()) log.debug(msg, args);
            }
            case INFO -> {
                if (log.isInfoEnabled()) log.info(msg, args);
            }
            case WARN -> {
                if (log.isWarnEnabled()) log.warn(msg, args);
            }
            case ERROR -> {
                if (log.isErrorEnabled()) log.error(msg, args);
            }
        }
    }
    // [/🧩 Section: emit]
}
