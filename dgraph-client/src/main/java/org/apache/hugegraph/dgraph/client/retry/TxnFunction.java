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

package org.apache.hugegraph.dgraph.client.retry;

import org.apache.hugegraph.dgraph.client.txn.Transaction;

/**
 * Work run inside a transaction by {@link TxnRetrier}. It is expected to
 * commit the transaction itself; anything left open is discarded.
 */
@FunctionalInterface
public interface TxnFunction<T> {

    T apply(Transaction txn);
}
