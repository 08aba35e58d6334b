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

/**
 * Thrown when a transaction is used in a way its protocol forbids: reusing a
 * finished transaction, writing through a read-only one, malformed requests or
 * a server context that contradicts the transaction's snapshot.
 * Never retried.
 */
public class TxnException extends DgraphException {

    public TxnException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    public static TxnException finished() {
        return new TxnException(ErrorType.FINISHED,
                                "Transaction has already been committed or discarded");
    }

    public static TxnException readOnly() {
        return new TxnException(ErrorType.READ_ONLY,
                                "Readonly transaction cannot run mutations or be committed");
    }
}
