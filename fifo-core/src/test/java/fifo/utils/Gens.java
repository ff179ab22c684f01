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

package fifo.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class Gens
{
    private Gens()
    {
    }

    /**
     * Pick a key with probability proportional to its weight.
     */
    public static <T> Gen<T> pick(Map<T, Integer> weights)
    {
        Invariants.checkArgument(!weights.isEmpty(), "No values to pick from");
        List<T> values = new ArrayList<>(weights.size());
        int[] cumulative = new int[weights.size()];
        int total = 0;
        for (Map.Entry<T, Integer> e : weights.entrySet())
        {
            Invariants.checkArgument(e.getValue() > 0, "Weight of %s must be positive", e.getKey());
            total += e.getValue();
            cumulative[values.size()] = total;
            values.add(e.getKey());
        }
        int bound = total;
        return rs -> {
            int target = rs.nextInt(bound);
            int i = Arrays.binarySearch(cumulative, target + 1);
            if (i < 0) i = -1 - i;
            return values.get(i);
        };
    }

    public static Gen<Gen.Random> random()
    {
        return r -> r;
    }

    public static IntDSL ints()
    {
        return new IntDSL();
    }

    public static <T> ListDSL<T> lists(Gen<T> fn)
    {
        return new ListDSL<>(fn);
    }

    public static class IntDSL
    {
        public Gen.IntGen of(int value)
        {
            return r -> value;
        }

        public Gen.IntGen between(int min, int max)
        {
            Invariants.checkArgument(max >= min);
            if (min == max)
                return of(min);
            // bound is exclusive, so a max of MAX_VALUE is never produced
            if (max == Integer.MAX_VALUE)
                return r -> r.nextInt(min, max);
            return r -> r.nextInt(min, max + 1);
        }
    }

    public static class ListDSL<T>
    {
        private final Gen<T> fn;

        public ListDSL(Gen<T> fn)
        {
            this.fn = Objects.requireNonNull(fn);
        }

        /**
         * Lists without repeated values; the underlying generator must be able to produce enough distinct values.
         */
        public ListDSL<T> unique()
        {
            return new ListDSL<>(new Unique<>(fn));
        }

        public Gen<List<T>> ofSizeBetween(int minSize, int maxSize)
        {
            Gen.IntGen sizeGen = ints().between(minSize, maxSize);
            return r -> {
                Reset.tryReset(fn);
                int size = sizeGen.nextInt(r);
                List<T> list = new ArrayList<>(size);
                for (int i = 0; i < size; i++)
                    list.add(fn.next(r));
                return list;
            };
        }
    }

    interface Reset
    {
        static void tryReset(Object o)
        {
            if (o instanceof Reset)
                ((Reset) o).reset();
        }

        void reset();
    }

    private static class Unique<T> implements Gen<T>, Reset
    {
        private final Set<T> seen = new HashSet<>();
        private final Gen<T> fn;

        private Unique(Gen<T> fn)
        {
            this.fn = fn;
        }

        @Override
        public T next(Random random)
        {
            T value;
            while (!seen.add((value = fn.next(random)))) {}
            return value;
        }

        @Override
        public void reset()
        {
            seen.clear();
        }
    }
}
