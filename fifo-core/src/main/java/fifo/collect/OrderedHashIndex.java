/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package fifo.collect;

import java.util.HashMap;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;
import javax.annotation.Nullable;

import com.google.common.base.Equivalence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fifo.utils.Invariants;

import static fifo.collect.CollectionModifiers.PARANOIA;
import static fifo.utils.Invariants.illegalState;

/**
 * A singly linked chain of nodes in insertion order, plus a hash index from each node's identity to the
 * node <em>preceding</em> it in the chain. A singly linked chain can only unlink or link after a known
 * node, so every index entry is phrased in terms of the predecessor; erasing or front-inserting rebinds
 * the entry of the one neighbour whose predecessor changed.
 *
 * <p>The index keys are {@link Equivalence.Wrapper}s over the identity held inside each node, so an
 * identity is stored once. A lookup wraps the caller's argument in a transient wrapper.
 *
 * <p>Invariants, re-established by every public operation:
 * <ol>
 *     <li>each index entry belongs to exactly one linked node, and each linked node has an entry</li>
 *     <li>the entry for a node is the node linked immediately before it (possibly {@link #head})</li>
 *     <li>{@link #tail} is the last node, or {@link #head} iff the chain is empty</li>
 *     <li>no two linked nodes have equivalent identities</li>
 * </ol>
 *
 * Not thread safe.
 *
 * @param <I> the identity type: the element for a set, the key for a map
 * @param <N> the node type, which doubles as the handle callers hold
 */
public class OrderedHashIndex<I, N extends OrderedHashIndex.Node<I, N>> implements Iterable<N>
{
    private static final Logger logger = LoggerFactory.getLogger(OrderedHashIndex.class);

    public static abstract class Node<I, N extends Node<I, N>>
    {
        N next;

        protected abstract I identity();
    }

    private final N head;
    private Equivalence<I> equivalence;
    private HashMap<Equivalence.Wrapper<I>, N> predecessors;
    private N tail;

    /**
     * @param head a node that is never linked anywhere else; its identity is never consulted
     */
    @SuppressWarnings("unchecked")
    public OrderedHashIndex(N head, Equivalence<? super I> equivalence)
    {
        this.head = Invariants.nonNull(head, "head");
        // only ever applied to identities of type I
        this.equivalence = (Equivalence<I>) Invariants.nonNull(equivalence, "equivalence");
        this.predecessors = new HashMap<>();
        this.tail = head;
    }

    public Equivalence<? super I> equivalence()
    {
        return equivalence;
    }

    public int size()
    {
        return predecessors.size();
    }

    public boolean isEmpty()
    {
        return predecessors.isEmpty();
    }

    public @Nullable N first()
    {
        return head.next;
    }

    public @Nullable N last()
    {
        return tail == head ? null : tail;
    }

    public boolean contains(Object identity)
    {
        return predecessors.containsKey(wrap(identity));
    }

    /**
     * @return the node holding {@code identity}, or null if there is none
     */
    public @Nullable N find(Object identity)
    {
        N before = predecessors.get(wrap(identity));
        return before == null ? null : before.next;
    }

    /**
     * Append a node for {@code identity} unless one already exists. {@code factory} is only invoked once
     * the identity is known to be absent, and must return an unlinked node holding an equivalent identity.
     */
    public Emplaced<N> emplaceBack(I identity, Function<? super I, ? extends N> factory)
    {
        N existing = find(identity);
        if (existing != null)
            return new Emplaced<>(existing, false);

        N node = factory.apply(identity);
        linkLast(node);
        return new Emplaced<>(node, true);
    }

    /**
     * As {@link #emplaceBack}, but a new node is linked first.
     */
    public Emplaced<N> emplaceFront(I identity, Function<? super I, ? extends N> factory)
    {
        N existing = find(identity);
        if (existing != null)
            return new Emplaced<>(existing, false);

        N node = factory.apply(identity);
        linkFirst(node);
        return new Emplaced<>(node, true);
    }

    /**
     * Unlink the node holding {@code identity}, if any.
     *
     * @return the unlinked node, or null if the identity was absent
     */
    public @Nullable N erase(Object identity)
    {
        N before = predecessors.remove(wrap(identity));
        if (before == null)
            return null;

        return unlinkAfter(before);
    }

    /**
     * Unlink {@code node}, which must currently be linked into this index.
     *
     * @throws IllegalArgumentException if {@code node} belongs to another container or has already been erased
     */
    public void eraseNode(N node)
    {
        Invariants.checkArgument(node != head, "Cannot erase the head of the chain");
        Equivalence.Wrapper<I> key = equivalence.wrap(node.identity());
        N before = predecessors.get(key);
        if (before == null || before.next != node)
            throw new IllegalArgumentException(node + " is not an element of this container");

        predecessors.remove(key);
        unlinkAfter(before);
    }

    public void clear()
    {
        predecessors.clear();
        head.next = null;
        tail = head;
    }

    /**
     * Take over the chain, index and strategy of {@code from} in constant time, discarding whatever this
     * index held. {@code from} is left empty and usable.
     */
    public void transferFrom(OrderedHashIndex<I, N> from)
    {
        Invariants.checkArgument(from != this, "Cannot move a container into itself");

        equivalence = from.equivalence;
        predecessors = from.predecessors;
        head.next = from.head.next;
        tail = from.tail == from.head ? head : from.tail;

        from.predecessors = new HashMap<>();
        from.head.next = null;
        from.tail = from.head;

        repairHead(from.head);
        logger.trace("Transferred {} elements", predecessors.size());
        afterMutation();
    }

    /**
     * Point the first node's entry at this index's head, after the chain was adopted from an index whose
     * head was {@code previousHead}.
     */
    private void repairHead(N previousHead)
    {
        N first = head.next;
        if (first == null)
            return;

        N replaced = predecessors.put(equivalence.wrap(first.identity()), head);
        if (PARANOIA.local())
            Invariants.checkState(replaced == previousHead, "First element %s was indexed after %s", first, replaced);
    }

    private void linkLast(N node)
    {
        N before = tail;
        before.next = node;
        tail = node;

        N replaced = predecessors.put(equivalence.wrap(node.identity()), before);
        if (PARANOIA.local())
            Invariants.checkState(replaced == null, "%s was already indexed after %s", node, replaced);
        afterMutation();
    }

    private void linkFirst(N node)
    {
        N first = head.next;
        node.next = first;
        head.next = node;

        predecessors.put(equivalence.wrap(node.identity()), head);
        if (first == null)
        {
            tail = node;
        }
        else
        {
            N replaced = predecessors.put(equivalence.wrap(first.identity()), node);
            if (PARANOIA.local())
                Invariants.checkState(replaced == head, "Former first element %s was indexed after %s", first, replaced);
        }
        afterMutation();
    }

    /**
     * Unlink the node following {@code before}, whose own index entry has already been removed, and rebind
     * the entry of the node that now follows {@code before}.
     */
    private N unlinkAfter(N before)
    {
        N removed = before.next;
        N following = removed.next;
        before.next = following;
        removed.next = null;

        if (following == null)
        {
            tail = before;
        }
        else
        {
            N replaced = predecessors.put(equivalence.wrap(following.identity()), before);
            if (PARANOIA.local())
                Invariants.checkState(replaced == removed, "%s was indexed after %s", following, replaced);
        }
        afterMutation();
        return removed;
    }

    private void afterMutation()
    {
        if (PARANOIA.full())
            validate();
    }

    @SuppressWarnings("unchecked")
    private Equivalence.Wrapper<I> wrap(Object identity)
    {
        return equivalence.wrap((I) identity);
    }

    /**
     * Walk the chain and verify every invariant listed on this class.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void validate()
    {
        int size = predecessors.size();
        int count = 0;
        N before = head;
        for (N node = head.next ; node != null ; before = node, node = node.next)
        {
            if (++count > size)
                throw violation("Chain holds more than the " + size + " indexed elements");

            N indexed = predecessors.get(equivalence.wrap(node.identity()));
            if (indexed != before)
                throw violation(node + " follows " + describe(before) + " but is indexed after " + describe(indexed));
        }
        if (count != size)
            throw violation("Chain holds " + count + " elements but " + size + " are indexed");
        if (tail != before)
            throw violation("Tail is " + describe(tail) + " but the last element is " + describe(before));
    }

    private String describe(N node)
    {
        return node == head ? "<head>" : String.valueOf(node);
    }

    private IllegalStateException violation(String msg)
    {
        logger.error("Predecessor index corrupted: {}", msg);
        return illegalState(msg);
    }

    @Override
    public Iterator<N> iterator()
    {
        return new Iterator<N>()
        {
            N next = head.next;
            N last;

            @Override
            public boolean hasNext()
            {
                return next != null;
            }

            @Override
            public N next()
            {
                if (next == null)
                    throw new NoSuchElementException();
                last = next;
                next = next.next;
                return last;
            }

            @Override
            public void remove()
            {
                if (last == null)
                    throw new IllegalStateException();
                eraseNode(last);
                last = null;
            }
        };
    }
}
