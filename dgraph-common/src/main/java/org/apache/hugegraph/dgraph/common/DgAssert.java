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

package org.apache.hugegraph.dgraph.common;

import java.util.Collection;
import java.util.function.Supplier;

public final class DgAssert {

    private DgAssert() {
    }

    public static void isTrue(boolean expression, String message) {
        if (message == null) {
            throw new IllegalArgumentException("message is null");
        }
        if (!expression) {
            throw new IllegalArgumentException(message);
        }
    }

    public static void isTrue(boolean expression, Supplier<String> msg) {
        if (msg == null) {
            throw new IllegalArgumentException("message supplier is null");
        }
        if (!expression) {
            throw new IllegalArgumentException(msg.get());
        }
    }

    public static void isFalse(boolean expression, String message) {
        isTrue(!expression, message);
    }

    public static void isArgumentValid(String str, String parameter) {
        isTrue(!isInvalid(str), () -> "The argument is invalid: " + parameter);
    }

    public static void isArgumentValid(Collection<?> collection, String parameter) {
        isTrue(collection != null && !collection.isEmpty(),
               () -> "The argument is invalid: " + parameter);
    }

    public static void isArgumentNotNull(Object obj, String parameter) {
        isTrue(obj != null, () -> "The argument is null: " + parameter);
    }

    public static boolean isInvalid(String... strs) {
        if (strs == null || strs.length == 0) {
            return true;
        }
        for (String item : strs) {
            if (item == null || item.trim().isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
