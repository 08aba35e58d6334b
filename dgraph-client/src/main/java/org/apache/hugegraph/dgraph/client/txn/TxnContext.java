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
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.common.TxnException;
import org.apache.hugegraph.dgraph.grpc.DgraphProto;

/**
 * The client's view of a transaction on the server: its snapshot timestamp and
 * everything it touched so far. A start timestamp of 0 means no response has
 * been seen yet.
 * <p>
 * Responses of an asynchronous transaction are merged on the transport thread;
 * every access holds the monitor of this object.
 */
public class TxnContext {

    private long startTs;
    private long commitTs;
    private String hash = "";
    private boolean aborted;
    private final Set<String> keys = new LinkedHashSet<>();
    private final Set<String> preds = new LinkedHashSet<>();

    /**
     * Folds a server context into this one. The first non-zero start timestamp
     * sticks; a different one afterwards means the server answered for another
     * transaction.
     *
     * @throws TxnException with {@link ErrorType#START_TS_MISMATCH}
     */
    public synchronized void merge(DgraphProto.TxnContext src) {
        if (src == null) {
            return;
        }
        if (this.startTs == 0) {
            this.startTs = src.getStartTs();
        } else if (src.getStartTs() != this.startTs) {
            throw new TxnException(ErrorType.START_TS_MISMATCH,
                                   String.format("StartTs mismatch: expected %d but got %d",
                                                 this.startTs, src.getStartTs()));
        }
        this.hash = src.getHash();
        this.keys.addAll(src.getKeysList());
        this.preds.addAll(src.getPredsList());
    }

    public synchronized DgraphProto.TxnContext toProto() {
        return DgraphProto.TxnContext.newBuilder()
                                     .setStartTs(this.startTs)
                                     .setCommitTs(this.commitTs)
                                     .setAborted(this.aborted)
                                     .setHash(this.hash)
                                     .addAllKeys(this.keys)
                                     .addAllPreds(this.preds)
                                     .build();
    }

    /**
     * A detached copy, safe to hand out while the transaction keeps running.
     * Key and predicate views of a snapshot never change afterwards.
     */
    public synchronized TxnContext snapshot() {
        TxnContext copy = new TxnContext();
        copy.startTs = this.startTs;
        copy.commitTs = this.commitTs;
        copy.hash = this.hash;
        copy.aborted = this.aborted;
        copy.keys.addAll(this.keys);
        copy.preds.addAll(this.preds);
        return copy;
    }

    public synchronized void markAborted() {
        this.aborted = true;
    }

    public synchronized long getStartTs() {
        return this.startTs;
    }

    public synchronized long getCommitTs() {
        return this.commitTs;
    }

    synchronized void setCommitTs(long commitTs) {
        this.commitTs = commitTs;
    }

    public synchronized String getHash() {
        return this.hash;
    }

    public synchronized boolean isAborted() {
        return this.aborted;
    }

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(this.keys);
    }

    public Set<String> getPreds() {
        return Collections.unmodifiableSet(this.preds);
    }

    @Override
    public synchronized String toString() {
        return "TxnContext{startTs=" + this.startTs +
               ", commitTs=" + this.commitTs +
               ", keys=" + this.keys.size() +
               ", preds=" + this.preds +
               ", aborted=" + this.aborted + '}';
    }
}
