/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.alipay.sofa.timing.util;

/**
 * A FIFO doubly-linked list of {@link LinkedNode}s.
 *
 * <p>Push to back, pop from front, removing a node and querying the size are
 * O(1). {@link #spliceBack(LinkedNodeList)} is the exception and costs O(k) in
 * the number of nodes moved, since every node keeps a reference to its owning
 * list and each one is repointed.
 *
 * <p>Not thread safe.
 *
 * @param <N> the node type
 */
public class LinkedNodeList<N extends LinkedNode<N>> {

    private final int id;
    private N         head;
    private N         tail;
    private int       size;

    /**
     * @param id an identifier the owner uses to tell its lists apart
     */
    public LinkedNodeList(final int id) {
        this.id = id;
    }

    public int id() {
        return this.id;
    }

    public int size() {
        return this.size;
    }

    public boolean isEmpty() {
        return this.size == 0;
    }

    /**
     * Link a detached node at the tail.
     *
     * @throws IllegalStateException if the node already belongs to a list
     */
    public void pushBack(final N node) {
        Requires.requireNonNull(node, "node");
        if (node.list != null) {
            throw new IllegalStateException("Node is already linked into list " + node.list.id);
        }
        node.list = this;
        if (this.head == null) {
            this.head = this.tail = node;
        } else {
            this.tail.next = node;
            node.prev = this.tail;
            this.tail = node;
        }
        this.size++;
    }

    /**
     * Unlink and return the head, or {@code null} when empty.
     */
    public N popFront() {
        final N node = this.head;
        if (node == null) {
            return null;
        }
        remove(node);
        return node;
    }

    /**
     * Unlink {@code node}. A node owned by another list, or by none, is left
     * untouched.
     *
     * @return true if the node was removed from this list
     */
    public boolean remove(final N node) {
        if (node == null || node.list != this) {
            return false;
        }
        final N next = node.next;
        final N prev = node.prev;
        if (prev == null) {
            this.head = next;
        } else {
            prev.next = next;
        }
        if (next == null) {
            this.tail = prev;
        } else {
            next.prev = prev;
        }
        // null out prev, next and list to allow for GC.
        node.prev = null;
        node.next = null;
        node.list = null;
        this.size--;
        return true;
    }

    /**
     * Move every node of {@code other} to the tail of this list, keeping their
     * order. {@code other} is empty afterwards.
     */
    public void spliceBack(final LinkedNodeList<N> other) {
        Requires.requireNonNull(other, "other");
        if (other == this || other.head == null) {
            return;
        }
        for (N node = other.head; node != null; node = node.next) {
            node.list = this;
        }
        if (this.head == null) {
            this.head = other.head;
        } else {
            this.tail.next = other.head;
            other.head.prev = this.tail;
        }
        this.tail = other.tail;
        this.size += other.size;

        other.head = other.tail = null;
        other.size = 0;
    }

    @Override
    public String toString() {
        return "LinkedNodeList [id=" + this.id + ", size=" + this.size + "]";
    }
}
