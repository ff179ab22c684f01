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

import net.nicoulaj.compilecommand.annotations.Inline;

/**
 * Argument and state checks shared by the collections. Argument failures are the caller's fault and
 * raise {@link IllegalArgumentException}; state failures mean a structure has been corrupted and raise
 * {@link IllegalStateException}.
 */
public class Invariants
{
    private Invariants()
    {
    }

    public static IllegalStateException illegalState(String msg)
    {
        return new IllegalStateException(msg);
    }

    public static void checkState(boolean condition, String fmt, Object arg1, Object arg2)
    {
        if (!condition)
            throw illegalState(String.format(fmt, arg1, arg2));
    }

    public static <T> T nonNull(T param, String msg)
    {
        if (param == null)
            throw new NullPointerException(msg);
        return param;
    }

    @Inline
    public static void checkArgument(boolean condition)
    {
        if (!condition)
            throw new IllegalArgumentException();
    }

    @Inline
    public static void checkArgument(boolean condition, String msg)
    {
        if (!condition)
            throw new IllegalArgumentException(msg);
    }

    public static void checkArgument(boolean condition, String fmt, Object arg)
    {
        if (!condition)
            throw new IllegalArgumentException(String.format(fmt, arg));
    }
}
