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
 * Base of every error raised by the client.
 */
public class DgraphException extends RuntimeException {

    private final ErrorType errorType;

    public DgraphException(ErrorType errorType) {
        super(errorType.name());
        this.errorType = errorType;
    }

    public DgraphException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DgraphException(ErrorType errorType, Throwable e) {
        super(errorType.name(), e);
        this.errorType = errorType;
    }

    public DgraphException(ErrorType errorType, String message, Throwable e) {
        super(message, e);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return this.errorType;
    }

    public int getErrorCode() {
        return this.errorType.getCode();
    }
}
