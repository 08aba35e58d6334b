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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.apache.hugegraph.dgraph.client.BaseClientTest;
import org.apache.hugegraph.dgraph.client.session.SessionManager;
import org.apache.hugegraph.dgraph.client.test.FakeDgraphServer;
import org.apache.hugegraph.dgraph.common.DgraphConnectionException;
import org.apache.hugegraph.dgraph.common.DgraphException;
import org.apache.hugegraph.dgraph.common.DgraphRpcException;
import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.common.RetriableException;
import org.apache.hugegraph.dgraph.common.TxnException;
import org.apache.hugegraph.dgraph.grpc.DgraphProto;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Request;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;
import org.junit.Test;

import io.grpc.Metadata;
import io.grpc.Status;

public class TransactionTest extends BaseClientTest {

    private static final String QUERY = "{ q(func: has(name)) { uid name balance } }";

    @Test
    public void testStartTsIsFixedByFirstResponse() {
        Transaction txn = this.client.newTransaction();
        txn.query(QUERY);
        long startTs = txn.context().getStartTs();
        assertThat(startTs).isPositive();

        txn.mutateJson(person(null, "alice", 10));
        assertEquals(startTs, this.fake.lastRequest().getStartTs());
        assertEquals("h" + startTs, this.fake.lastRequest().getHash());
        assertEquals(startTs, txn.context().getStartTs());
        txn.discard();
    }

    @Test
    public void testStartTsMismatchFailsRequest() {
        Transaction txn = this.client.newTransaction();
        txn.query(QUERY);
        long startTs = txn.context().getStartTs();

        this.fake.injectStartTs(startTs + 1000);
        TxnException e = assertThrows(TxnException.class, () -> txn.query(QUERY));
        assertEquals(ErrorType.START_TS_MISMATCH, e.getErrorType());
        assertEquals(startTs, txn.context().getStartTs());
    }

    @Test
    public void testReadYourOwnWrites() {
        Transaction txn = this.client.newTransaction();
        Response mutated = txn.mutateJson(person("_:alice", "alice", 10));
        String uid = mutated.getUidsMap().get("alice");

        Response response = txn.query(QUERY, id(uid));
        assertEquals("alice", first(TxnResponses.json(response)).path("name").asText());
        assertThat(txn.context().getKeys()).containsExactly(uid);
        assertThat(txn.context().getPreds()).contains("name", "balance");
    }

    @Test
    public void testFinishedTransactionRejectsEverything() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));
        txn.commit();
        assertEquals(TxnState.COMMITTED, txn.state());

        int queries = this.fake.calls("Query");
        assertEquals(ErrorType.FINISHED,
                     assertThrows(TxnException.class, () -> txn.query(QUERY)).getErrorType());
        assertEquals(ErrorType.FINISHED,
                     assertThrows(TxnException.class,
                                  () -> txn.mutateJson(person(null, "bob", 1))).getErrorType());
        assertEquals(ErrorType.FINISHED,
                     assertThrows(TxnException.class, txn::commit).getErrorType());
        assertEquals(queries, this.fake.calls("Query"));

        txn.discard();
        txn.discard();
        assertEquals(TxnState.COMMITTED, txn.state());
    }

    @Test
    public void testDiscardIsIdempotent() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));
        txn.discard();
        txn.discard();
        txn.close();

        assertEquals(TxnState.DISCARDED, txn.state());
        List<DgraphProto.TxnContext> commits = this.fake.commitRequests();
        assertEquals(1, commits.size());
        assertTrue(commits.get(0).getAborted());
        assertEquals(0, this.fake.pendingTransactions());
        assertThrows(TxnException.class, () -> txn.query(QUERY));
    }

    @Test
    public void testReadOnlyTransactionNeverWrites() {
        Transaction txn = this.client.newReadOnlyTransaction();

        TxnException e = assertThrows(TxnException.class,
                                      () -> txn.mutateJson(person(null, "alice", 10)));
        assertEquals(ErrorType.READ_ONLY, e.getErrorType());
        assertEquals(0, this.fake.calls("Query"));

        e = assertThrows(TxnException.class, txn::commit);
        assertEquals(ErrorType.READ_ONLY, e.getErrorType());

        txn.query(QUERY);
        assertTrue(this.fake.lastRequest().getReadOnly());
        txn.discard();
        assertEquals(0, this.fake.calls("CommitOrAbort"));
        assertEquals(TxnState.DISCARDED, txn.state());
    }

    @Test
    public void testBestEffortRequiresReadOnly() {
        TxnException e = assertThrows(TxnException.class,
                                      () -> this.client.newTransaction(false, true));
        assertEquals(ErrorType.BEST_EFFORT_REQUIRES_READ_ONLY, e.getErrorType());

        Transaction txn = this.client.newReadOnlyTransaction(true);
        txn.query(QUERY);
        assertTrue(this.fake.lastRequest().getBestEffort());
    }

    @Test
    public void testCommitWithoutWritesSendsNothing() {
        Transaction txn = this.client.newTransaction();
        txn.query(QUERY);

        DgraphProto.TxnContext committed = txn.commit();
        assertSame(DgraphProto.TxnContext.getDefaultInstance(), committed);
        assertEquals(0, this.fake.calls("CommitOrAbort"));
        assertEquals(TxnState.COMMITTED, txn.state());
    }

    @Test
    public void testCommitReturnsCommitTs() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));

        DgraphProto.TxnContext committed = txn.commit();
        assertThat(committed.getCommitTs()).isGreaterThan(txn.context().getStartTs());
        assertEquals(committed.getCommitTs(), txn.context().getCommitTs());
        assertEquals(1, this.fake.commitRequests().size());
    }

    @Test
    public void testCommitNowFinishesTransaction() {
        Transaction txn = this.client.newTransaction();
        txn.mutate(MutationBuilder.create()
                                  .setNquads("_:a <name> \"A\" .")
                                  .commitNow(true));

        assertEquals(TxnState.COMMITTED, txn.state());
        assertTrue(this.fake.lastRequest().getCommitNow());
        assertEquals(1, this.fake.committedUids().size());
        assertThrows(TxnException.class, txn::commit);
        txn.close();
        assertEquals(0, this.fake.calls("CommitOrAbort"));
    }

    @Test
    public void testFailedRequestDiscardsPendingWrites() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));

        this.fake.failNext("Query", Status.UNAVAILABLE.withDescription("server down"));
        assertThrows(DgraphConnectionException.class, () -> txn.query(QUERY));

        assertEquals(TxnState.DISCARDED, txn.state());
        List<DgraphProto.TxnContext> commits = this.fake.commitRequests();
        assertEquals(1, commits.size());
        assertTrue(commits.get(0).getAborted());
        assertEquals(0, this.fake.pendingTransactions());
    }

    @Test
    public void testFailedQueryWithoutWritesSendsNoAbort() {
        Transaction txn = this.client.newTransaction();
        this.fake.failNext("Query", Status.UNKNOWN.withDescription("Please retry later"));

        assertThrows(RetriableException.class, () -> txn.query(QUERY));
        assertEquals(TxnState.DISCARDED, txn.state());
        assertEquals(0, this.fake.calls("CommitOrAbort"));
    }

    @Test
    public void testFailedMutationStillAborts() {
        Transaction txn = this.client.newTransaction();
        this.fake.failNext("Query", Status.INTERNAL.withDescription("disk full"));

        DgraphRpcException e = assertThrows(DgraphRpcException.class,
                                            () -> txn.mutateJson(person(null, "a", 1)));
        assertEquals(ErrorType.UNKNOWN, e.getErrorType());
        assertEquals(1, this.fake.calls("CommitOrAbort"));
    }

    @Test
    public void testCleanupFailureKeepsOriginalError() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));

        this.fake.failNext("Query", Status.UNAVAILABLE.withDescription("server down"));
        this.fake.failNext("CommitOrAbort", Status.UNAVAILABLE.withDescription("still down"));
        DgraphConnectionException e = assertThrows(DgraphConnectionException.class,
                                                   () -> txn.query(QUERY));
        assertThat(e.getMessage()).contains("server down");
        assertEquals(TxnState.DISCARDED, txn.state());
    }

    @Test
    public void testExplicitDiscardPropagatesFailure() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));

        this.fake.failNext("CommitOrAbort", Status.UNAVAILABLE.withDescription("down"));
        assertThrows(DgraphConnectionException.class, txn::discard);
        assertEquals(TxnState.DISCARDED, txn.state());
    }

    @Test
    public void testCloseNeverThrows() {
        Transaction txn = this.client.newTransaction();
        txn.mutateJson(person(null, "alice", 10));

        this.fake.failNext("CommitOrAbort", Status.UNAVAILABLE.withDescription("down"));
        txn.close();
        assertEquals(TxnState.DISCARDED, txn.state());
    }

    @Test
    public void testExpiredTokenIsRefreshedOnce() {
        this.fake.setRequireLogin(true);
        this.client.login(FakeDgraphServer.USER, FakeDgraphServer.PASSWORD);

        Transaction txn = this.client.newTransaction();
        txn.query(QUERY);
        this.fake.expireAccessTokens();
        txn.mutateJson(person(null, "alice", 10));
        txn.commit();

        assertEquals(2, this.fake.calls("Login"));
        assertEquals(3, this.fake.calls("Query"));
        assertEquals(TxnState.COMMITTED, txn.state());
    }

    @Test
    public void testSecondExpiryIsFinal() {
        this.client.login(FakeDgraphServer.USER, FakeDgraphServer.PASSWORD);
        Status expired = Status.UNAUTHENTICATED.withDescription("Token is expired");
        this.fake.failNext("Query", expired);
        this.fake.failNext("Query", expired);

        Transaction txn = this.client.newTransaction();
        DgraphRpcException e = assertThrows(DgraphRpcException.class, () -> txn.query(QUERY));
        assertEquals(ErrorType.JWT_EXPIRED, e.getErrorType());
        assertEquals(2, this.fake.calls("Login"));
        assertEquals(2, this.fake.calls("Query"));
    }

    @Test
    public void testExpiryWithoutSessionFails() {
        this.fake.failNext("Query", Status.UNAUTHENTICATED.withDescription("Token is expired"));

        Transaction txn = this.client.newTransaction();
        DgraphException e = assertThrows(DgraphException.class, () -> txn.query(QUERY));
        assertEquals(ErrorType.NOT_LOGGED_IN, e.getErrorType());
        assertEquals(0, this.fake.calls("Login"));
    }

    @Test
    public void testCallerCannotOverrideAccessToken() {
        this.client.login(FakeDgraphServer.USER, FakeDgraphServer.PASSWORD);
        Metadata.Key<String> trace = Metadata.Key.of("trace-id", Metadata.ASCII_STRING_MARSHALLER);
        Metadata metadata = new Metadata();
        metadata.put(SessionManager.ACCESS_JWT, "forged");
        metadata.put(trace, "t-1");

        Transaction txn = this.client.newTransaction();
        Request request = TxnRequests.newQuery(QUERY, null, ResponseFormat.JSON, false, false);
        txn.doRequest(request, metadata);

        Metadata sent = this.fake.lastHeaders();
        assertEquals(this.client.sessions().current().getAccessToken(),
                     sent.get(SessionManager.ACCESS_JWT));
        assertThat(sent.getAll(SessionManager.ACCESS_JWT)).hasSize(1);
        assertEquals("t-1", sent.get(trace));
    }

    @Test
    public void testRdfQuery() {
        Transaction txn = this.client.newTransaction();
        Response mutated = txn.mutateNquads("_:bob <name> \"bob\" .");
        String uid = mutated.getUidsMap().get("bob");

        Response response = txn.queryRdf(QUERY, id(uid));
        assertEquals("<" + uid + "> <name> \"bob\" .\n", TxnResponses.rdf(response));
        assertEquals(Request.RespFormat.RDF, this.fake.lastRequest().getRespFormat());
    }

    @Test
    public void testUpsertBlock() {
        Transaction txn = this.client.newTransaction();
        Request upsert = TxnRequests.newRequest(QUERY, null,
                                                List.of(MutationBuilder.create()
                                                                       .setJson(person(null, "carol", 5))
                                                                       .build()),
                                                true, ResponseFormat.JSON, false, false);
        Response response = txn.doRequest(upsert);

        assertEquals(TxnState.COMMITTED, txn.state());
        assertThat(response.getTxn().getCommitTs()).isPositive();
        assertEquals(1, this.fake.committedUids().size());
    }
}
