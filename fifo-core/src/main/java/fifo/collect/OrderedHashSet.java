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

import java.util.AbstractSet;
import java.util.Iterator;
import javax.annotation.Nullable;

import com.google.common.base.Equivalence;
import com.google.common.collect.Iterators;

/**
 * A hash set that iterates in insertion order, backed by an {@link OrderedHashIndex}. Lookup, insertion at
 * either end and erasure are all constant time on average.
 *
 * <p>Inserting an element that is already present is a no-op, so an element erased and re-added moves to
 * the back. {@link Element} handles stay valid until their own element is erased.
 *
 * <p>Not thread safe.
 */
public class OrderedHashSet<T> extends AbstractSet<T>
{
    public static final class Element<T> extends OrderedHashIndex.Node<T, Element<T>>
    {
        final T value;

        Element(T value)
        {
            this.value = value;
        }

        public T get()
        {
            return value;
        }

        @Override
        protected T identity()
        {
            return value;
        }

        @Override
        public String toString()
        {
            return String.valueOf(value);
        }
    }

    final OrderedHashIndex<T, Element<T>> index;

    public OrderedHashSet()
    {
        this(Equivalence.equals());
    }

    public OrderedHashSet(Equivalence<? super T> equivalence)
    {
        index = new OrderedHashIndex<>(new Element<T>(null), equivalence);
    }

    /**
     * A copy of {@code copy}, with the same strategy, holding its elements in the same order.
     */
    public OrderedHashSet(OrderedHashSet<T> copy)
    {
        this(copy.equivalence());
        for (T value : copy)
            emplaceBack(value);
    }

    /**
     * A new set holding everything {@code from} held, leaving {@code from} empty.
     */
    public static <T> OrderedHashSet<T> moveOf(OrderedHashSet<T> from)
    {
        OrderedHashSet<T> result = new OrderedHashSet<>(from.equivalence());
        result.moveFrom(from);
        return result;
    }

    /**
     * Replace the contents of this set with copies of the elements of {@code from}, in order. This set
     * keeps its own strategy.
     */
    public OrderedHashSet<T> copyFrom(OrderedHashSet<? extends T> from)
    {
        if (from == this)
            return this;

        clear();
        for (T value : from)
            emplaceBack(value);
        return this;
    }

    /**
     * Replace the contents and strategy of this set with those of {@code from} in constant time, leaving
     * {@code from} empty.
     */
    public OrderedHashSet<T> moveFrom(OrderedHashSet<T> from)
    {
        index.transferFrom(from.index);
        return this;
    }

    public Equivalence<? super T> equivalence()
    {
        return index.equivalence();
    }

    public Emplaced<Element<T>> emplace(T value)
    {
        return emplaceBack(value);
    }

    public Emplaced<Element<T>> emplaceBack(T value)
    {
        return index.emplaceBack(value, Element::new);
    }

    public Emplaced<Element<T>> emplaceFront(T value)
    {
        return index.emplaceFront(value, Element::new);
    }

    @Override
    public boolean add(T value)
    {
        return emplaceBack(value).inserted;
    }

    /**
     * @return the handle of the element equivalent to {@code value}, or null
     */
    public @Nullable Element<T> find(Object value)
    {
        return index.find(value);
    }

    public int count(Object value)
    {
        return index.contains(value) ? 1 : 0;
    }

    @Override
    public boolean contains(Object value)
    {
        return index.contains(value);
    }

    /**
     * @throws IllegalArgumentException if {@code element} is not currently an element of this set
     */
    public void eraseElement(Element<T> element)
    {
        index.eraseNode(element);
    }

    /**
     * @return true if an element was erased; an absent value is ignored
     */
    public boolean erase(Object value)
    {
        return index.erase(value) != null;
    }

    @Override
    public boolean remove(Object value)
    {
        return erase(value);
    }

    public @Nullable T first()
    {
        Element<T> first = index.first();
        return first == null ? null : first.value;
    }

    public @Nullable T last()
    {
        Element<T> last = index.last();
        return last == null ? null : last.value;
    }

    @Override
    public void clear()
    {
        index.clear();
    }

    @Override
    public int size()
    {
        return index.size();
    }

    @Override
    public boolean isEmpty()
    {
        return index.isEmpty();
    }

    /**
     * Elements in insertion order. {@link Iterator#remove} erases the last element returned.
     */
    @Override
    public Iterator<T> iterator()
    {
        return Iterators.transform(index.iterator(), Element::get);
    }

    /**
     * Handles in insertion order; {@link Iterator#remove} is supported.
     */
    public Iterable<Element<T>> elements()
    {
        return index;
    }

    /**
     * @see OrderedHashIndex#validate()
     */
    public void validate()
    {
        index.validate();
    }
}
