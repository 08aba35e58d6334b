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

package org.apache.hugegraph.dgraph.client.txn;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.common.TxnException;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Mutation;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Request;

/**
 * Builders of {@link Request} messages. Everything here is a pure function of
 * its arguments.
 */
public final class TxnRequests {

    private TxnRequests() {
    }

    public static Request newQuery(String query, Map<?, ?> vars, ResponseFormat format,
                                   boolean readOnly, boolean bestEffort) {
        return newRequest(query, vars, Collections.emptyList(), false, format,
                          readOnly, bestEffort);
    }

    public static Request newMutation(Mutation mutation, boolean commitNow) {
        return newRequest(null, null, Collections.singletonList(mutation),
                          commitNow || mutation.getCommitNow(), ResponseFormat.JSON,
                          false, false);
    }

    public static Request newRequest(String query, Map<?, ?> vars, List<Mutation> mutations,
                                     boolean commitNow, ResponseFormat format,
                                     boolean readOnly, boolean bestEffort) {
        Request.Builder builder = Request.newBuilder()
                                         .setCommitNow(commitNow)
                                         .setReadOnly(readOnly)
                                         .setBestEffort(bestEffort)
                                         .setRespFormat(format == null ?
                                                        ResponseFormat.JSON.toProto() :
                                                        format.toProto());
        if (query != null) {
            builder.setQuery(query);
        }
        if (vars != null) {
            builder.putAllVars(checkVars(vars));
        }
        if (mutations != null) {
            builder.addAllMutations(mutations);
        }
        return builder.build();
    }

    /**
     * @throws TxnException with {@link ErrorType#INVALID_REQUEST} if a key or
     *                      a value is not a string
     */
    @SuppressWarnings("unchecked")
    public static Map<String, String> checkVars(Map<?, ?> vars) {
        for (Map.Entry<?, ?> entry : vars.entrySet()) {
            if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)) {
                throw new TxnException(ErrorType.INVALID_REQUEST,
                                       "Values and keys in variable map must be strings");
            }
        }
        return (Map<String, String>) vars;
    }

    /**
     * Binds a request to the transaction's snapshot.
     */
    public static Request stamp(Request request, TxnContext context) {
        return request.toBuilder()
                      .setStartTs(context.getStartTs())
                      .setHash(context.getHash())
                      .build();
    }
}
