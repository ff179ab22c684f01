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

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import javax.annotation.Nullable;

import com.google.common.base.Equivalence;
import com.google.common.collect.Iterators;

import fifo.utils.Invariants;

/**
 * A hash map that iterates in key insertion order, backed by an {@link OrderedHashIndex}. Lookup, insertion
 * at either end and erasure are all constant time on average.
 *
 * <p>{@link #put} on a present key replaces its value in place; on an absent key it appends. {@link #slot}
 * gives the live {@link Entry} for a key, appending one holding the default value if needed, so
 * {@code map.slot(k).setValue(v)} never fails.
 *
 * <p>Not thread safe.
 */
public class OrderedHashMap<K, V> extends AbstractMap<K, V>
{
    public static final class Entry<K, V> extends OrderedHashIndex.Node<K, Entry<K, V>> implements Map.Entry<K, V>
    {
        final K key;
        V value;

        Entry(K key, V value)
        {
            this.key = key;
            this.value = value;
        }

        @Override
        protected K identity()
        {
            return key;
        }

        @Override
        public K getKey()
        {
            return key;
        }

        @Override
        public V getValue()
        {
            return value;
        }

        @Override
        public V setValue(V value)
        {
            V prev = this.value;
            this.value = value;
            return prev;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o) return true;
            if (!(o instanceof Map.Entry)) return false;
            Map.Entry<?, ?> that = (Map.Entry<?, ?>) o;
            return Objects.equals(key, that.getKey()) && Objects.equals(value, that.getValue());
        }

        @Override
        public int hashCode()
        {
            return Objects.hashCode(key) ^ Objects.hashCode(value);
        }

        @Override
        public String toString()
        {
            return key + "=" + value;
        }
    }

    final OrderedHashIndex<K, Entry<K, V>> index;
    final Supplier<? extends V> defaultValue;

    public OrderedHashMap()
    {
        this(Equivalence.equals());
    }

    public OrderedHashMap(Equivalence<? super K> equivalence)
    {
        this(equivalence, () -> null);
    }

    /**
     * @param defaultValue supplies the value of entries created by {@link #slot(Object)}
     */
    public OrderedHashMap(Equivalence<? super K> equivalence, Supplier<? extends V> defaultValue)
    {
        this.index = new OrderedHashIndex<>(new Entry<K, V>(null, null), equivalence);
        this.defaultValue = Invariants.nonNull(defaultValue, "defaultValue");
    }

    /**
     * A copy of {@code copy}, with the same strategy and default value, holding its entries in the same
     * order. Values are shared, not cloned.
     */
    public OrderedHashMap(OrderedHashMap<K, V> copy)
    {
        this(copy.equivalence(), copy.defaultValue);
        for (Entry<K, V> e : copy.index)
            emplaceBack(e.key, e.value);
    }

    /**
     * A new map holding everything {@code from} held, leaving {@code from} empty.
     */
    public static <K, V> OrderedHashMap<K, V> moveOf(OrderedHashMap<K, V> from)
    {
        OrderedHashMap<K, V> result = new OrderedHashMap<>(from.equivalence(), from.defaultValue);
        result.moveFrom(from);
        return result;
    }

    /**
     * Replace the contents of this map with the entries of {@code from}, in order. This map keeps its own
     * strategy and default value.
     */
    public OrderedHashMap<K, V> copyFrom(OrderedHashMap<? extends K, ? extends V> from)
    {
        if (from == this)
            return this;

        clear();
        for (Entry<? extends K, ? extends V> e : from.index)
            emplaceBack(e.key, e.value);
        return this;
    }

    /**
     * Replace the contents and strategy of this map with those of {@code from} in constant time, leaving
     * {@code from} empty. This map keeps its own default value.
     */
    public OrderedHashMap<K, V> moveFrom(OrderedHashMap<K, V> from)
    {
        index.transferFrom(from.index);
        return this;
    }

    public Equivalence<? super K> equivalence()
    {
        return index.equivalence();
    }

    public Emplaced<Entry<K, V>> emplace(K key, V value)
    {
        return emplaceBack(key, value);
    }

    public Emplaced<Entry<K, V>> emplaceBack(K key, V value)
    {
        return index.emplaceBack(key, k -> new Entry<>(k, value));
    }

    public Emplaced<Entry<K, V>> emplaceFront(K key, V value)
    {
        return index.emplaceFront(key, k -> new Entry<>(k, value));
    }

    /**
     * @return the live entry for {@code key}, or null
     */
    public @Nullable Entry<K, V> find(Object key)
    {
        return index.find(key);
    }

    public int count(Object key)
    {
        return index.contains(key) ? 1 : 0;
    }

    /**
     * @throws NoSuchElementException if {@code key} is absent
     */
    public V at(K key)
    {
        Entry<K, V> entry = index.find(key);
        if (entry == null)
            throw new NoSuchElementException("No entry for key " + key);
        return entry.value;
    }

    /**
     * The entry for {@code key}, appended with the configured default value if absent.
     */
    public Entry<K, V> slot(K key)
    {
        return slot(key, defaultValue);
    }

    /**
     * The entry for {@code key}, appended with a value from {@code ifAbsent} if absent.
     */
    public Entry<K, V> slot(K key, Supplier<? extends V> ifAbsent)
    {
        return index.emplaceBack(key, k -> new Entry<>(k, ifAbsent.get())).handle;
    }

    @Override
    public V get(Object key)
    {
        Entry<K, V> entry = index.find(key);
        return entry == null ? null : entry.value;
    }

    @Override
    public boolean containsKey(Object key)
    {
        return index.contains(key);
    }

    @Override
    public V put(K key, V value)
    {
        Emplaced<Entry<K, V>> emplaced = emplaceBack(key, value);
        if (emplaced.inserted)
            return null;
        return emplaced.handle.setValue(value);
    }

    /**
     * @throws IllegalArgumentException if {@code entry} is not currently an entry of this map
     */
    public void eraseEntry(Entry<K, V> entry)
    {
        index.eraseNode(entry);
    }

    /**
     * @return true if an entry was erased; an absent key is ignored
     */
    public boolean erase(Object key)
    {
        return index.erase(key) != null;
    }

    @Override
    public V remove(Object key)
    {
        Entry<K, V> removed = index.erase(key);
        return removed == null ? null : removed.value;
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
     * Entries in insertion order. The entries are live: {@link Map.Entry#setValue} writes through, and
     * {@link Iterator#remove} erases.
     */
    @Override
    public Set<Map.Entry<K, V>> entrySet()
    {
        return new AbstractSet<Map.Entry<K, V>>()
        {
            @Override
            public Iterator<Map.Entry<K, V>> iterator()
            {
                return Iterators.transform(index.iterator(), e -> e);
            }

            @Override
            public boolean contains(Object o)
            {
                if (!(o instanceof Map.Entry))
                    return false;
                Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
                Entry<K, V> entry = index.find(e.getKey());
                return entry != null && Objects.equals(entry.value, e.getValue());
            }

            @Override
            public boolean remove(Object o)
            {
                if (!contains(o))
                    return false;
                index.erase(((Map.Entry<?, ?>) o).getKey());
                return true;
            }

            @Override
            public int size()
            {
                return index.size();
            }

            @Override
            public void clear()
            {
                index.clear();
            }
        };
    }

    @Override
    public Set<K> keySet()
    {
        return new AbstractSet<K>()
        {
            @Override
            public Iterator<K> iterator()
            {
                return Iterators.transform(index.iterator(), Entry::getKey);
            }

            @Override
            public boolean contains(Object o)
            {
                return index.contains(o);
            }

            @Override
            public boolean remove(Object o)
            {
                return index.erase(o) != null;
            }

            @Override
            public int size()
            {
                return index.size();
            }

            @Override
            public void clear()
            {
                index.clear();
            }
        };
    }

    /**
     * Entry handles in insertion order; {@link Iterator#remove} is supported.
     */
    public Iterable<Entry<K, V>> entries()
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
