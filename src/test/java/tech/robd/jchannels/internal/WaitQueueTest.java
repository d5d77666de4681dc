/*
 [File Info]
 path: src/test/java/tech/robd/jchannels/internal/WaitQueueTest.java
 description: Intrusive wait queue: FIFO order, O(1) unlink from the middle, linkage invariants.
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
package tech.robd.jchannels.internal;

import org.junit.jupiter.api.Test;
import tech.robd.jchannels.BrokenInvariantError;

import static org.junit.jupiter.api.Assertions.*;

final class WaitQueueTest {

    private static final class N extends WaitQueue.Node {
        final String name;

        N(String name) {
            this.name = name;
        }
    }

    @Test
    void pollsInInsertionOrder() {
        WaitQueue<N> q = new WaitQueue<>();
        N a = new N("a"), b = new N("b"), c = new N("c");
        q.addLast(a);
        q.addLast(b);
        q.addLast(c);

        assertEquals(3, q.size());
        assertSame(a, q.pollFirst());
        assertSame(b, q.pollFirst());
        assertSame(c, q.pollFirst());
        assertNull(q.pollFirst());
        assertTrue(q.isEmpty());
    }

    @Test
    void unlinkFromMiddleKeepsNeighboursConnected() {
        WaitQueue<N> q = new WaitQueue<>();
        N a = new N("a"), b = new N("b"), c = new N("c");
        q.addLast(a);
        q.addLast(b);
        q.addLast(c);

        q.unlink(b);
        assertFalse(b.isLinked());
        assertEquals(2, q.size());
        assertEquals("a", q.pollFirst().name);
        assertEquals("c", q.pollFirst().name);
        assertTrue(q.isEmpty());
    }

    @Test
    void polledNodeCanBeQueuedAgain() {
        WaitQueue<N> q = new WaitQueue<>();
        N a = new N("a");
        q.addLast(a);
        assertTrue(a.isLinked());
        q.pollFirst();
        assertFalse(a.isLinked());

        q.addLast(a);
        assertSame(a, q.pollFirst());
    }

    @Test
    void linkageViolationsAreInvariantErrors() {
        WaitQueue<N> q = new WaitQueue<>();
        N a = new N("a");
        assertThrows(BrokenInvariantError.class, () -> q.unlink(a));

        q.addLast(a);
        assertThrows(BrokenInvariantError.class, () -> q.addLast(a));
        assertEquals(1, q.size());
    }
}
