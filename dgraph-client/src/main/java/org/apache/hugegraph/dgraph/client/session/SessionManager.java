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

package org.apache.hugegraph.dgraph.client.session;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.hugegraph.dgraph.client.rpc.DgraphClientStub;
import org.apache.hugegraph.dgraph.client.rpc.GrpcErrors;
import org.apache.hugegraph.dgraph.common.DgAssert;
import org.apache.hugegraph.dgraph.common.DgraphException;
import org.apache.hugegraph.dgraph.common.DgraphRpcException;
import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.LoginRequest;

import io.grpc.Metadata;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the session of one client and renews it. Concurrent refreshes of the
 * same stale session collapse into one Login call.
 */
@Slf4j
public class SessionManager {

    public static final Metadata.Key<String> ACCESS_JWT =
            Metadata.Key.of("accessjwt", Metadata.ASCII_STRING_MARSHALLER);

    private final Supplier<DgraphClientStub> stubs;
    private final AtomicReference<Session> session = new AtomicReference<>(Session.EMPTY);
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<CompletableFuture<Session>> pendingRefresh =
            new AtomicReference<>();

    public SessionManager(Supplier<DgraphClientStub> stubs) {
        DgAssert.isArgumentNotNull(stubs, "stubs");
        this.stubs = stubs;
    }

    public Session login(String userId, String password) {
        return this.login(userId, password, 0L);
    }

    public Session login(String userId, String password, long namespace) {
        DgAssert.isArgumentValid(userId, "userId");
        DgAssert.isArgumentNotNull(password, "password");
        LoginRequest request = LoginRequest.newBuilder()
                                           .setUserid(userId)
                                           .setPassword(password)
                                           .setNamespace(namespace)
                                           .build();
        Session fresh = Session.fromResponse(this.stubs.get().login(request));
        this.session.set(fresh);
        log.info("Logged in as {} into namespace {}", userId, namespace);
        return fresh;
    }

    public Session current() {
        return this.session.get();
    }

    public Session refresh() {
        return this.refresh(this.current());
    }

    /**
     * Renews {@code stale} with its refresh token. When another caller already
     * replaced it, the current session is returned without calling the server.
     */
    public Session refresh(Session stale) {
        this.refreshLock.lock();
        try {
            Session current = this.session.get();
            if (current != stale && current.isLoggedIn()) {
                return current;
            }
            Session fresh = Session.fromResponse(
                    this.stubs.get().login(refreshRequest(current)));
            this.session.set(fresh);
            log.debug("Session refreshed");
            return fresh;
        } finally {
            this.refreshLock.unlock();
        }
    }

    public CompletableFuture<Session> refreshAsync(Session stale) {
        while (true) {
            Session current = this.session.get();
            if (current != stale && current.isLoggedIn()) {
                return CompletableFuture.completedFuture(current);
            }
            CompletableFuture<Session> pending = this.pendingRefresh.get();
            if (pending != null) {
                return pending;
            }
            CompletableFuture<Session> mine = new CompletableFuture<>();
            if (!this.pendingRefresh.compareAndSet(null, mine)) {
                continue;
            }
            this.startRefresh(current, mine);
            return mine;
        }
    }

    private void startRefresh(Session current, CompletableFuture<Session> target) {
        CompletableFuture<Session> call;
        try {
            call = this.stubs.get().loginAsync(refreshRequest(current))
                       .thenApply(Session::fromResponse);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((fresh, error) -> {
            if (error == null) {
                this.session.set(fresh);
                log.debug("Session refreshed");
            }
            this.pendingRefresh.compareAndSet(target, null);
            if (error == null) {
                target.complete(fresh);
            } else {
                target.completeExceptionally(error);
            }
        });
    }

    private static LoginRequest refreshRequest(Session current) {
        if (!current.hasRefreshToken()) {
            throw new DgraphException(ErrorType.NOT_LOGGED_IN, "refresh jwt should not be empty");
        }
        return LoginRequest.newBuilder().setRefreshToken(current.getRefreshToken()).build();
    }

    /**
     * The metadata sent with a call: the caller's entries plus the access
     * token of {@code session}, which always replaces any caller-supplied
     * token.
     */
    public static Metadata metadata(Session session, Metadata caller) {
        Metadata headers = new Metadata();
        if (caller != null) {
            headers.merge(caller);
        }
        headers.discardAll(ACCESS_JWT);
        if (session.isLoggedIn()) {
            headers.put(ACCESS_JWT, session.getAccessToken());
        }
        return headers;
    }

    public Metadata metadata(Metadata caller) {
        return metadata(this.current(), caller);
    }

    /**
     * Runs {@code call} with the session's metadata. If the server reports the
     * access token as expired, the session is refreshed and the call is sent
     * once more; whatever the second attempt raises is final.
     */
    public <T> T callWithRefresh(Function<Metadata, T> call, Metadata caller) {
        Session session = this.current();
        try {
            return call.apply(metadata(session, caller));
        } catch (DgraphRpcException e) {
            if (!e.isJwtExpired()) {
                throw e;
            }
            log.debug("Access token expired, refreshing session and retrying once");
            Session fresh = this.refresh(session);
            return call.apply(metadata(fresh, caller));
        }
    }

    public <T> CompletableFuture<T> callWithRefreshAsync(
            Function<Metadata, CompletableFuture<T>> call, Metadata caller) {
        Session session = this.current();
        return invoke(call, metadata(session, caller)).handle((value, error) -> {
            if (error == null) {
                return CompletableFuture.completedFuture(value);
            }
            if (!GrpcErrors.isJwtExpired(error)) {
                return CompletableFuture.<T>failedFuture(GrpcErrors.unwrap(error));
            }
            log.debug("Access token expired, refreshing session and retrying once");
            return this.refreshAsync(session)
                       .thenCompose(fresh -> invoke(call, metadata(fresh, caller)));
        }).thenCompose(Function.identity());
    }

    private static <T> CompletableFuture<T> invoke(Function<Metadata, CompletableFuture<T>> call,
                                                   Metadata metadata) {
        try {
            return call.apply(metadata);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
