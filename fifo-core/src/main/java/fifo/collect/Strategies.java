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

import java.util.function.BiPredicate;
import java.util.function.ToIntFunction;

import com.google.common.base.Equivalence;

import fifo.utils.Invariants;

/**
 * Hash and equality strategies accepted by {@link OrderedHashSet} and {@link OrderedHashMap}, beyond
 * Guava's own {@link Equivalence#equals()} and {@link Equivalence#identity()}.
 */
public class Strategies
{
    private Strategies()
    {
    }

    /**
     * Combine a separate hash function and equality predicate. The caller must keep them consistent:
     * equal identities must hash equally.
     */
    public static <T> Equivalence<T> of(ToIntFunction<? super T> hash, BiPredicate<? super T, ? super T> equal)
    {
        return new Custom<>(hash, equal);
    }

    private static final class Custom<T> extends Equivalence<T>
    {
        final ToIntFunction<? super T> hash;
        final BiPredicate<? super T, ? super T> equal;

        Custom(ToIntFunction<? super T> hash, BiPredicate<? super T, ? super T> equal)
        {
            this.hash = Invariants.nonNull(hash, "hash");
            this.equal = Invariants.nonNull(equal, "equal");
        }

        @Override
        protected boolean doEquivalent(T a, T b)
        {
            return equal.test(a, b);
        }

        @Override
        protected int doHash(T t)
        {
            return hash.applyAsInt(t);
        }

        @Override
        public String toString()
        {
            return "Strategies.of(" + hash + ", " + equal + ')';
        }
    }
}
