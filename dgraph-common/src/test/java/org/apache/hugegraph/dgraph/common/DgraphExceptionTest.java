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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;

import org.junit.Test;

public class DgraphExceptionTest {

    @Test
    public void testOnlyServerRetryKindsAreRetriable() {
        EnumSet<ErrorType> retriable = EnumSet.noneOf(ErrorType.class);
        for (ErrorType type : ErrorType.values()) {
            if (type.isRetriable()) {
                retriable.add(type);
            }
        }
        assertThat(retriable).containsExactlyInAnyOrder(ErrorType.ABORTED, ErrorType.RETRIABLE);
    }

    @Test
    public void testConflictIsRetriable() {
        IllegalStateException cause = new IllegalStateException("ABORTED: conflict");
        TxnConflictException conflict = new TxnConflictException(cause);

        assertThat(conflict).isInstanceOf(RetriableException.class)
                            .hasMessage(TxnConflictException.MESSAGE)
                            .hasCause(cause);
        assertThat(conflict.getErrorType()).isEqualTo(ErrorType.ABORTED);
        assertThat(conflict.getErrorCode()).isEqualTo(201);
    }

    @Test
    public void testRpcExceptionKeepsCauseMessage() {
        DgraphRpcException error = new DgraphRpcException(
                ErrorType.JWT_EXPIRED, new RuntimeException("Token is expired"));
        assertThat(error.isJwtExpired()).isTrue();
        assertThat(error).hasMessage("Token is expired");
        assertThat(new RetriableException(null).getMessage()).isNull();
    }

    @Test
    public void testTxnMisuse() {
        assertThat(TxnException.finished().getErrorType()).isEqualTo(ErrorType.FINISHED);
        assertThat(TxnException.readOnly().getErrorType()).isEqualTo(ErrorType.READ_ONLY);
    }
}
