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
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.apache.hugegraph.dgraph.client.rpc.DgraphClientStub;
import org.apache.hugegraph.dgraph.client.rpc.GrpcErrors;
import org.apache.hugegraph.dgraph.client.session.SessionManager;
import org.apache.hugegraph.dgraph.client.support.AsyncMutex;
import org.apache.hugegraph.dgraph.client.support.AsyncMutex.Permit;
import org.apache.hugegraph.dgraph.grpc.DgraphProto;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Mutation;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Request;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;

import io.grpc.Metadata;
import lombok.extern.slf4j.Slf4j;

/**
 * The non-blocking counterpart of {@link Transaction}. Operations may be
 * issued concurrently; they are serialized by a per-transaction
 * {@link AsyncMutex} held for the whole of each request, commit or discard.
 * <p>
 * Cancelling a returned future cancels the call in flight. A cancelled
 * operation leaves the transaction as it was and is never retried.
 */
@Slf4j
public class AsyncTransaction extends AbstractTransaction implements AutoCloseable {

    private final AsyncMutex mutex = new AsyncMutex();

    public AsyncTransaction(DgraphClientStub stub, SessionManager sessions) {
        this(stub, sessions, false, false);
    }

    public AsyncTransaction(DgraphClientStub stub, SessionManager sessions,
                            boolean readOnly, boolean bestEffort) {
        super(stub, sessions, readOnly, bestEffort);
    }

    public CompletableFuture<Response> query(String query) {
        return this.query(query, null);
    }

    public CompletableFuture<Response> query(String query, Map<String, String> vars) {
        return this.query(query, vars, ResponseFormat.JSON);
    }

    public CompletableFuture<Response> query(String query, Map<?, ?> vars,
                                             ResponseFormat format) {
        Request request;
        try {
            request = this.queryRequest(query, vars, format);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return this.doRequest(request);
    }

    public CompletableFuture<Response> queryRdf(String query, Map<String, String> vars) {
        return this.query(query, vars, ResponseFormat.RDF);
    }

    public CompletableFuture<Response> mutate(Mutation mutation) {
        Request request;
        try {
            request = this.mutationRequest(mutation);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return this.doRequest(request);
    }

    public CompletableFuture<Response> mutate(MutationBuilder builder) {
        Mutation mutation;
        try {
            mutation = builder.build();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return this.mutate(mutation);
    }

    public CompletableFuture<Response> mutateJson(Object value) {
        return this.mutate(MutationBuilder.create().setJson(value));
    }

    public CompletableFuture<Response> deleteJson(Object value) {
        return this.mutate(MutationBuilder.create().deleteJson(value));
    }

    public CompletableFuture<Response> mutateNquads(String nquads) {
        return this.mutate(MutationBuilder.create().setNquads(nquads));
    }

    public CompletableFuture<Response> doRequest(Request request) {
        return this.doRequest(request, null);
    }

    public CompletableFuture<Response> doRequest(Request request, Metadata metadata) {
        return this.mutex.withLock(permit -> {
            Request stamped;
            try {
                stamped = this.beginRequest(request);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            return this.sessions.callWithRefreshAsync(
                    md -> permit.track(this.stub.queryAsync(stamped, md)), metadata)
                       .handle((response, error) -> {
                           if (error == null) {
                               return this.completeRequest(stamped, response);
                           }
                           return this.failRequest(error, metadata, permit);
                       })
                       .thenCompose(Function.identity());
        });
    }

    private CompletableFuture<Response> completeRequest(Request request, Response response) {
        try {
            return CompletableFuture.completedFuture(this.onResponse(request, response));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Discards while still holding the lock, then fails with the original
     * error. Cancellation skips the cleanup.
     */
    private CompletableFuture<Response> failRequest(Throwable error, Metadata metadata,
                                                    Permit permit) {
        if (GrpcErrors.isCancellation(error)) {
            return CompletableFuture.failedFuture(GrpcErrors.unwrap(error));
        }
        RuntimeException mapped = GrpcErrors.translate(error);
        return this.discardLocked(metadata, permit).handle((ignored, discardError) -> {
            if (discardError != null) {
                log.debug("Failed to discard transaction {}: {}", this.context,
                          GrpcErrors.unwrap(discardError).getMessage());
            }
            throw mapped;
        });
    }

    public CompletableFuture<DgraphProto.TxnContext> commit() {
        return this.commit(null);
    }

    public CompletableFuture<DgraphProto.TxnContext> commit(Metadata metadata) {
        return this.mutex.withLock(permit -> {
            boolean mutated;
            try {
                mutated = this.beginCommit();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            if (!mutated) {
                return CompletableFuture.completedFuture(
                        DgraphProto.TxnContext.getDefaultInstance());
            }
            DgraphProto.TxnContext toCommit = this.context.toProto();
            return this.sessions.callWithRefreshAsync(
                    md -> permit.track(this.stub.commitOrAbortAsync(toCommit, md)), metadata)
                       .handle((committed, error) -> {
                           if (error != null) {
                               throw translateUnlessCancelled(error);
                           }
                           this.context.setCommitTs(committed.getCommitTs());
                           log.debug("Committed transaction {}", this.context);
                           return committed;
                       });
        });
    }

    public CompletableFuture<Void> discard() {
        return this.discard(null);
    }

    public CompletableFuture<Void> discard(Metadata metadata) {
        return this.mutex.withLock(permit -> this.discardLocked(metadata, permit)
                                                 .handle((ignored, error) -> {
                                                     if (error != null) {
                                                         throw translateUnlessCancelled(error);
                                                     }
                                                     return null;
                                                 }));
    }

    /**
     * The body of {@link #discard()}, for callers that already hold the lock.
     */
    private CompletableFuture<Void> discardLocked(Metadata metadata, Permit permit) {
        if (!this.beginDiscard()) {
            return CompletableFuture.completedFuture(null);
        }
        DgraphProto.TxnContext toAbort = this.context.toProto();
        return this.sessions.callWithRefreshAsync(
                md -> permit.track(this.stub.commitOrAbortAsync(toAbort, md)), metadata)
                            .thenApply(ignored -> null);
    }

    /**
     * Discards unless finished; never fails.
     */
    public CompletableFuture<Void> closeAsync() {
        return this.discard().handle((ignored, error) -> {
            if (error != null) {
                log.debug("Failed to discard transaction {}: {}", this.context,
                          GrpcErrors.unwrap(error).getMessage());
            }
            return null;
        });
    }

    @Override
    public void close() {
        this.closeAsync().join();
    }

    AsyncMutex mutex() {
        return this.mutex;
    }

    private static RuntimeException translateUnlessCancelled(Throwable error) {
        Throwable cause = GrpcErrors.unwrap(error);
        if (GrpcErrors.isCancellation(cause)) {
            return (RuntimeException) cause;
        }
        return GrpcErrors.translate(cause);
    }
}
