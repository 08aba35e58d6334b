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
import java.util.Map;

import org.apache.hugegraph.dgraph.client.rpc.DgraphClientStub;
import org.apache.hugegraph.dgraph.client.session.SessionManager;
import org.apache.hugegraph.dgraph.common.DgAssert;
import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.common.TxnException;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Mutation;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Request;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;

/**
 * State shared by the blocking and the asynchronous transaction: the
 * lifecycle, the context accumulated from responses, and the checks run
 * before anything is sent.
 */
public abstract class AbstractTransaction {

    protected final DgraphClientStub stub;
    protected final SessionManager sessions;
    protected final TxnContext context = new TxnContext();

    private final boolean readOnly;
    private final boolean bestEffort;
    private volatile TxnState state = TxnState.ACTIVE;
    private boolean mutated;

    protected AbstractTransaction(DgraphClientStub stub, SessionManager sessions,
                                  boolean readOnly, boolean bestEffort) {
        DgAssert.isArgumentNotNull(stub, "stub");
        DgAssert.isArgumentNotNull(sessions, "sessions");
        if (bestEffort && !readOnly) {
            throw new TxnException(ErrorType.BEST_EFFORT_REQUIRES_READ_ONLY,
                                   "Best effort transactions are only compatible with " +
                                   "read-only transactions");
        }
        this.stub = stub;
        this.sessions = sessions;
        this.readOnly = readOnly;
        this.bestEffort = bestEffort;
    }

    protected Request queryRequest(String query, Map<?, ?> vars, ResponseFormat format) {
        return TxnRequests.newQuery(query, vars == null ? Collections.emptyMap() : vars,
                                    format, this.readOnly, this.bestEffort);
    }

    protected Request mutationRequest(Mutation mutation) {
        DgAssert.isArgumentNotNull(mutation, "mutation");
        return TxnRequests.newMutation(mutation, false);
    }

    /**
     * Validates a request against the current state and binds it to this
     * transaction. A request carrying mutations marks the transaction as
     * having pending writes before it is sent: a write that fails in flight
     * may still have reached the server.
     */
    protected Request beginRequest(Request request) {
        DgAssert.isArgumentNotNull(request, "request");
        if (this.state.isFinished()) {
            throw TxnException.finished();
        }
        if (request.getMutationsCount() > 0) {
            if (this.readOnly) {
                throw TxnException.readOnly();
            }
            this.mutated = true;
        }
        return TxnRequests.stamp(request, this.context);
    }

    protected Response onResponse(Request request, Response response) {
        if (request.getCommitNow()) {
            this.state = TxnState.COMMITTED;
        }
        this.context.merge(response.hasTxn() ? response.getTxn() : null);
        return response;
    }

    /**
     * Moves to COMMITTED.
     *
     * @return whether there are writes the server has to commit
     */
    protected boolean beginCommit() {
        if (this.readOnly) {
            throw TxnException.readOnly();
        }
        if (this.state.isFinished()) {
            throw TxnException.finished();
        }
        this.state = TxnState.COMMITTED;
        return this.mutated;
    }

    /**
     * Moves to DISCARDED unless already finished.
     *
     * @return whether the server holds writes that have to be aborted
     */
    protected boolean beginDiscard() {
        if (this.state.isFinished()) {
            return false;
        }
        this.state = TxnState.DISCARDED;
        if (!this.mutated) {
            return false;
        }
        this.context.markAborted();
        return true;
    }

    public TxnState state() {
        return this.state;
    }

    public boolean isFinished() {
        return this.state.isFinished();
    }

    public boolean isReadOnly() {
        return this.readOnly;
    }

    public boolean isBestEffort() {
        return this.bestEffort;
    }

    public TxnContext context() {
        return this.context.snapshot();
    }

    public DgraphClientStub stub() {
        return this.stub;
    }
}
