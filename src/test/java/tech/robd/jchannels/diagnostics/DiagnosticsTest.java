/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/diagnostics/DiagnosticsTest.java
 description: Diagnostics facade: global switch, SLF4J forwarding with throwable extraction, no-op instance.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

final class DiagnosticsTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private boolean wasEnabled;

    @BeforeEach
    void attach() {
        wasEnabled = Diagnostics.isEnabled();
        logger = (Logger) LoggerFactory.getLogger(DiagnosticsTest.class);
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        if (wasEnabled) Diagnostics.enable();
        else Diagnostics.disable();
    }

    @Test
    void dynamicInstanceFollowsTheGlobalSwitch() {
        Diagnostics d = Diagnostics.dynamic(DiagnosticsTest.class);
        assertSame(DiagnosticsTest.class, d.owner());

        Diagnostics.disable();
        d.info("hidden {}", 1);
        Diagnostics.enable();
        d.debug("shown {}", 2);

        assertEquals(1, appender.list.size());
        assertEquals("shown 2", appender.list.get(0).getFormattedMessage());
        assertEquals(Level.DEBUG, appender.list.get(0).getLevel());
    }

    @Test
    void trailingThrowableIsLoggedAsCause() {
        Diagnostics.enable();
        Diagnostics d = Diagnostics.dynamic(DiagnosticsTest.class);

        d.error("ch#{} failed", 7, new IllegalStateException("boom"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals("ch#7 failed", event.getFormattedMessage());
        assertNotNull(event.getThrowableProxy());
        assertEquals("boom", event.getThrowableProxy().getMessage());
    }

    @Test
    void noopInstanceIgnoresEverything() {
        Diagnostics.enable();
        Diagnostics d = Diagnostics.noop();
        d.warn("nothing {}", 1);
        d.error("nothing", new RuntimeException("x"));
        assertTrue(appender.list.isEmpty());
        assertSame(d, Diagnostics.noop());
    }
}
