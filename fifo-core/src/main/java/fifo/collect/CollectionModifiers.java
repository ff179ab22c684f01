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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide switches for the ordered collections, read once from system properties.
 */
public class CollectionModifiers
{
    public static final String PARANOIA_PROPERTY_NAME = "fifo.collect.paranoia";
    private static final Logger logger = LoggerFactory.getLogger(CollectionModifiers.class);

    public static final Paranoia PARANOIA = initialiseParanoia();

    /**
     * How much of the predecessor index is re-verified after each mutation.
     */
    public enum Paranoia
    {
        /** no checks beyond the ones every operation performs */
        NONE,
        /** verify the index entries touched by the mutation, O(1) */
        LOCAL,
        /** walk the whole container, O(n) */
        FULL;

        public boolean local()
        {
            return this != NONE;
        }

        public boolean full()
        {
            return this == FULL;
        }

        public static Paranoia parse(String description)
        {
            String normalised = description.trim().toUpperCase(Locale.ROOT);
            for (Paranoia paranoia : values())
            {
                if (paranoia.name().equals(normalised))
                    return paranoia;
            }
            throw new IllegalArgumentException("Unknown paranoia '" + description + "'; expected one of "
                                               + Arrays.stream(values()).map(p -> p.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")));
        }
    }

    static Paranoia initialiseParanoia()
    {
        String description = System.getProperty(PARANOIA_PROPERTY_NAME, "none");
        Paranoia paranoia = Paranoia.parse(description);
        if (paranoia != Paranoia.NONE)
            logger.info("Ordered collections will verify their predecessor index with paranoia {}", paranoia);
        return paranoia;
    }
}
