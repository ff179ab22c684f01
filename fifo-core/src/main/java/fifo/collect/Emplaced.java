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

/**
 * The outcome of an emplace: the handle of the element now holding the identity, and whether the
 * call created it. When {@link #inserted} is false the container was left untouched and {@link #handle}
 * is the element that was already present.
 */
public final class Emplaced<H>
{
    public final H handle;
    public final boolean inserted;

    Emplaced(H handle, boolean inserted)
    {
        this.handle = handle;
        this.inserted = inserted;
    }

    @Override
    public String toString()
    {
        return (inserted ? "inserted " : "existing ") + handle;
    }
}
