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
 * The server asked the client to try again later, e.g. while an index is
 * being rebuilt. Treated like a conflict by the retry engine.
 */
public class RetriableException extends DgraphException {

    public RetriableException(Throwable cause) {
        super(ErrorType.RETRIABLE, messageOf(cause), cause);
    }

    protected RetriableException(ErrorType errorType, String message) {
        super(errorType, message);
    }

    protected RetriableException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }

    static String messageOf(Throwable cause) {
        return cause == null ? null : cause.getMessage();
    }
}
