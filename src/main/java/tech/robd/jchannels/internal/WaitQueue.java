/*
 [File Info]
 path: src/main/java/tech/robd/jchannels/internal/WaitQueue.java
 description: Intrusive circular doubly-linked wait queue with a sentinel node; O(1) append, poll and unlink.
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

package tech.robd.jchannels.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jchannels.BrokenInvariantError;

/**
 * FIFO of waiters that carry their own links.
 *
 * <p>Nodes subclass {@link Node}; a node sits in at most one queue at a time. The queue is
 * not thread-safe: every call happens under the lock of the channel or mutex owning it.</p>
 *
 * @param <N> node type
 */
public final class WaitQueue<N extends WaitQueue.Node> {

    /**
     * Link fields of a queued waiter. {@code next == null} means not linked.
     */
    public abstract static class Node {
        @Nullable Node prev;
        @Nullable Node next;

        public final boolean isLinked() {
            return next != null;
        }
    }

    private static final class Sentinel extends Node {
    }

    // 🧩 Section: state
    private final Sentinel head = new Sentinel();
    private int size;

    public WaitQueue() {
        head.prev = head;
        head.next = head;
    }
    // [/🧩 Section: state]

    // 🧩 Section: operations
    public void addLast(N node) {
        if (node.isLinked()) throw new BrokenInvariantError("waiter already linked");
        Node tail = head.prev;
        node.prev = tail;
        node.next = head;
        tail.next = node;
        head.prev = node;
        size++;
    }

    /**
     * @return the oldest node, unlinked, or {@code null} when empty
     */
    @SuppressWarnings("unchecked")
    public @Nullable N pollFirst() {
        Node first = head.next;
        if (first == head) return null;
        unlinkNode(first);
        return (N) first;
    }

    public void unlink(N node) {
        if (!node.isLinked()) throw new BrokenInvariantError("waiter not linked");
        unlinkNode(node);
    }

    public boolean isEmpty() {
        return head.next == head;
    }

    public int size() {
        return size;
    }
    // [/🧩 Section: operations]

    private void unlinkNode(Node node) {
        Node p = node.prev;
        Node n = node.next;
        p.next = n;
        n.prev = p;
        node.prev = null;
        node.next = null;
        size--;
    }
}
