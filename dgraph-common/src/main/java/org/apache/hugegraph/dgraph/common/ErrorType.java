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
 * Error kinds raised by the client. Each kind is classified once, where the
 * failure enters the client, and carried unchanged afterwards.
 */
public enum ErrorType {

    // Caller misuse of a transaction
    FINISHED(101, false),
    READ_ONLY(102, false),
    INVALID_REQUEST(103, false),
    INVALID_MUTATION(104, false),
    START_TS_MISMATCH(105, false),
    BEST_EFFORT_REQUIRES_READ_ONLY(106, false),

    // Reported by the server or the channel
    ABORTED(201, true),
    RETRIABLE(202, true),
    CONNECTION(203, false),
    JWT_EXPIRED(204, false),
    UNAUTHENTICATED(205, false),
    UNKNOWN(299, false),

    // Session handling
    NOT_LOGGED_IN(301, false),
    LOGIN_FAILED(302, false);

    private final int code;
    private final boolean retriable;

    ErrorType(int code, boolean retriable) {
        this.code = code;
        this.retriable = retriable;
    }

    public int getCode() {
        return this.code;
    }

    /**
     * Whether a new transaction may succeed where this one failed.
     */
    public boolean isRetriable() {
        return this.retriable;
    }
}
