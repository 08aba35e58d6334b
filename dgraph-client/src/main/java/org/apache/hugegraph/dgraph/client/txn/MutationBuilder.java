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

import static java.nio.charset.StandardCharsets.UTF_8;

import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.common.TxnException;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Mutation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.ByteString;

/**
 * Builds a {@link Mutation} from objects or N-Quad text. A mutation carries
 * payloads of one form only: JSON objects or raw N-Quads.
 * <p>
 * A {@code String} passed to the JSON setters is sent as is; any other value
 * is serialized with Jackson.
 */
public final class MutationBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Object setJson;
    private Object deleteJson;
    private String setNquads;
    private String delNquads;
    private String cond;
    private boolean commitNow;

    private MutationBuilder() {
    }

    public static MutationBuilder create() {
        return new MutationBuilder();
    }

    public MutationBuilder setJson(Object value) {
        this.setJson = value;
        return this;
    }

    public MutationBuilder deleteJson(Object value) {
        this.deleteJson = value;
        return this;
    }

    public MutationBuilder setNquads(String nquads) {
        this.setNquads = nquads;
        return this;
    }

    public MutationBuilder delNquads(String nquads) {
        this.delNquads = nquads;
        return this;
    }

    public MutationBuilder cond(String cond) {
        this.cond = cond;
        return this;
    }

    public MutationBuilder commitNow(boolean commitNow) {
        this.commitNow = commitNow;
        return this;
    }

    /**
     * @throws TxnException with {@link ErrorType#INVALID_MUTATION} when the
     *                      mutation is empty, mixes JSON with N-Quads, or an
     *                      object cannot be serialized
     */
    public Mutation build() {
        boolean json = this.setJson != null || this.deleteJson != null;
        boolean nquads = this.setNquads != null || this.delNquads != null;
        if (!json && !nquads) {
            throw new TxnException(ErrorType.INVALID_MUTATION,
                                   "Mutation must set or delete at least one value");
        }
        if (json && nquads) {
            throw new TxnException(ErrorType.INVALID_MUTATION,
                                   "Mutation cannot mix JSON and N-Quads payloads");
        }

        Mutation.Builder builder = Mutation.newBuilder().setCommitNow(this.commitNow);
        if (this.setJson != null) {
            builder.setSetJson(toJson(this.setJson));
        }
        if (this.deleteJson != null) {
            builder.setDeleteJson(toJson(this.deleteJson));
        }
        if (this.setNquads != null) {
            builder.setSetNquads(ByteString.copyFrom(this.setNquads, UTF_8));
        }
        if (this.delNquads != null) {
            builder.setDelNquads(ByteString.copyFrom(this.delNquads, UTF_8));
        }
        if (this.cond != null) {
            builder.setCond(this.cond);
        }
        return builder.build();
    }

    private static ByteString toJson(Object value) {
        if (value instanceof String) {
            return ByteString.copyFrom((String) value, UTF_8);
        }
        try {
            return ByteString.copyFrom(MAPPER.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            TxnException error = new TxnException(ErrorType.INVALID_MUTATION,
                                                  "Failed to serialize mutation: " +
                                                  e.getOriginalMessage());
            error.initCause(e);
            throw error;
        }
    }
}
