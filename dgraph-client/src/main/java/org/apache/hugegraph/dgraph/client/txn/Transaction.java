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

import java.util.Map;

import org.apache.hugegraph.dgraph.client.rpc.DgraphClientStub;
import org.apache.hugegraph.dgraph.client.rpc.GrpcErrors;
import org.apache.hugegraph.dgraph.client.session.SessionManager;
import org.apache.hugegraph.dgraph.grpc.DgraphProto;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Mutation;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Request;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;

import io.grpc.Metadata;
import lombok.extern.slf4j.Slf4j;

/**
 * A blocking transaction. Not thread safe: use one transaction per thread.
 * <p>
 * Queries and mutations run against the snapshot fixed by the first response.
 * Writes become visible to others only after {@link #commit()}; a conflict at
 * commit time surfaces as
 * {@link org.apache.hugegraph.dgraph.common.TxnConflictException} and the work
 * has to be redone in a new transaction.
 * <pre>{@code
 * try (Transaction txn = client.newTransaction()) {
 *     txn.mutateJson(person);
 *     txn.commit();
 * }
 * }</pre>
 */
@Slf4j
public class Transaction extends AbstractTransaction implements AutoCloseable {

    public Transaction(DgraphClientStub stub, SessionManager sessions) {
        this(stub, sessions, false, false);
    }

    public Transaction(DgraphClientStub stub, SessionManager sessions,
                       boolean readOnly, boolean bestEffort) {
        super(stub, sessions, readOnly, bestEffort);
    }

    public Response query(String query) {
        return this.query(query, null);
    }

    public Response query(String query, Map<String, String> vars) {
        return this.query(query, vars, ResponseFormat.JSON);
    }

    public Response query(String query, Map<?, ?> vars, ResponseFormat format) {
        return this.doRequest(this.queryRequest(query, vars, format));
    }

    public Response queryRdf(String query, Map<String, String> vars) {
        return this.query(query, vars, ResponseFormat.RDF);
    }

    public Response mutate(Mutation mutation) {
        return this.doRequest(this.mutationRequest(mutation));
    }

    public Response mutate(MutationBuilder builder) {
        return this.mutate(builder.build());
    }

    public Response mutateJson(Object value) {
        return this.mutate(MutationBuilder.create().setJson(value));
    }

    public Response deleteJson(Object value) {
        return this.mutate(MutationBuilder.create().deleteJson(value));
    }

    public Response mutateNquads(String nquads) {
        return this.mutate(MutationBuilder.create().setNquads(nquads));
    }

    public Response doRequest(Request request) {
        return this.doRequest(request, null);
    }

    /**
     * Sends a query, mutations, or both (an upsert block). If the call fails
     * the transaction is discarded and the failure is rethrown.
     */
    public Response doRequest(Request request, Metadata metadata) {
        Request stamped = this.beginRequest(request);
        Response response;
        try {
            response = this.sessions.callWithRefresh(md -> this.stub.query(stamped, md),
                                                     metadata);
        } catch (RuntimeException e) {
            this.discardQuietly(metadata);
            throw GrpcErrors.translate(e);
        }
        return this.onResponse(stamped, response);
    }

    public DgraphProto.TxnContext commit() {
        return this.commit(null);
    }

    /**
     * Commits the writes of this transaction. Committing a transaction that
     * wrote nothing does not contact the server.
     *
     * @return the context the server committed with, carrying the commit
     * timestamp; an empty context when nothing was written
     */
    public DgraphProto.TxnContext commit(Metadata metadata) {
        if (!this.beginCommit()) {
            return DgraphProto.TxnContext.getDefaultInstance();
        }
        DgraphProto.TxnContext toCommit = this.context.toProto();
        DgraphProto.TxnContext committed;
        try {
            committed = this.sessions.callWithRefresh(
                    md -> this.stub.commitOrAbort(toCommit, md), metadata);
        } catch (RuntimeException e) {
            throw GrpcErrors.translate(e);
        }
        this.context.setCommitTs(committed.getCommitTs());
        log.debug("Committed transaction {}", this.context);
        return committed;
    }

    public void discard() {
        this.discard(null);
    }

    /**
     * Aborts the transaction. Does nothing once the transaction is finished.
     */
    public void discard(Metadata metadata) {
        if (!this.beginDiscard()) {
            return;
        }
        DgraphProto.TxnContext toAbort = this.context.toProto();
        try {
            this.sessions.callWithRefresh(md -> this.stub.commitOrAbort(toAbort, md), metadata);
        } catch (RuntimeException e) {
            throw GrpcErrors.translate(e);
        }
    }

    private void discardQuietly(Metadata metadata) {
        try {
            this.discard(metadata);
        } catch (RuntimeException e) {
            log.debug("Failed to discard transaction {}: {}", this.context, e.getMessage());
        }
    }

    @Override
    public void close() {
        this.discardQuietly(null);
    }
}
