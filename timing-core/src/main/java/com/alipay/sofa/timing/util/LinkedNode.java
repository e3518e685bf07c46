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
 * Node of an intrusive {@link LinkedNodeList}. The node itself carries the
 * links, so no wrapper object is allocated and a node can detach itself from
 * whichever list currently holds it in O(1).
 *
 * <p>Not thread safe, the owner of the lists guards them.
 *
 * @param <N> the concrete node type
 */
public abstract class LinkedNode<N extends LinkedNode<N>> {

    N                 prev;
    N                 next;
    // The list this node is linked into, null when detached
    LinkedNodeList<N> list;

    /**
     * Whether this node currently belongs to a list.
     */
    public boolean isLinked() {
        return this.list != null;
    }

    /**
     * The list this node belongs to, or {@code null} if detached.
     */
    public LinkedNodeList<N> list() {
        return this.list;
    }

    /**
     * Detach this node from its list.
     *
     * @return false if the node was not linked
     */
    @SuppressWarnings("unchecked")
    public boolean removeSelf() {
        final LinkedNodeList<N> owner = this.list;
        if (owner == null) {
            return false;
        }
        owner.remove((N) this);
        return true;
    }
}
