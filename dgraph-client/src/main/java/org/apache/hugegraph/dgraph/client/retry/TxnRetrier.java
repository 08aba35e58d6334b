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

package org.apache.hugegraph.dgraph.client.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.hugegraph.dgraph.client.DgraphClient;
import org.apache.hugegraph.dgraph.client.rpc.GrpcErrors;
import org.apache.hugegraph.dgraph.client.support.DgraphExecutors;
import org.apache.hugegraph.dgraph.client.txn.AsyncTransaction;
import org.apache.hugegraph.dgraph.client.txn.Transaction;
import org.apache.hugegraph.dgraph.common.DgAssert;
import org.apache.hugegraph.dgraph.common.RetriableException;

import lombok.extern.slf4j.Slf4j;

/**
 * Re-runs transactional work that lost a conflict. Only
 * {@link RetriableException}s, conflicts included, are retried; any other
 * failure propagates at once. After {@code maxRetries + 1} failed attempts the
 * last failure is rethrown.
 */
@Slf4j
public class TxnRetrier {

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final ScheduledExecutorService scheduler;

    public TxnRetrier(RetryPolicy policy) {
        this(policy, Sleeper.THREAD, DgraphExecutors.retryScheduler());
    }

    public TxnRetrier(RetryPolicy policy, Sleeper sleeper, ScheduledExecutorService scheduler) {
        DgAssert.isArgumentNotNull(policy, "policy");
        DgAssert.isArgumentNotNull(sleeper, "sleeper");
        DgAssert.isArgumentNotNull(scheduler, "scheduler");
        this.policy = policy;
        this.sleeper = sleeper;
        this.scheduler = scheduler;
    }

    public RetryPolicy getPolicy() {
        return this.policy;
    }

    public <T> T call(Supplier<T> work) {
        DgAssert.isArgumentNotNull(work, "work");
        int attempt = 0;
        while (true) {
            try {
                return work.get();
            } catch (RetriableException e) {
                if (attempt >= this.policy.getMaxRetries()) {
                    log.warn("Giving up after {} attempts: {}", attempt + 1, e.getMessage());
                    throw e;
                }
                Duration delay = this.policy.delay(attempt);
                log.debug("Attempt {} failed with {}, retrying in {} ms", attempt + 1,
                          e.getErrorType(), delay.toMillis());
                try {
                    this.sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    public <T> T runTransaction(DgraphClient client, TxnFunction<T> fn) {
        return this.runTransaction(client, fn, false, false);
    }

    /**
     * Runs {@code fn} in a fresh transaction per attempt. The transaction is
     * discarded afterwards, which does nothing if {@code fn} committed it.
     */
    public <T> T runTransaction(DgraphClient client, TxnFunction<T> fn,
                                boolean readOnly, boolean bestEffort) {
        DgAssert.isArgumentNotNull(client, "client");
        DgAssert.isArgumentNotNull(fn, "fn");
        return this.call(() -> {
            Transaction txn = client.newTransaction(readOnly, bestEffort);
            try {
                return fn.apply(txn);
            } finally {
                try {
                    txn.discard();
                } catch (RuntimeException e) {
                    log.debug("Failed to discard transaction after attempt: {}", e.getMessage());
                }
            }
        });
    }

    /**
     * Asynchronous {@link #call}: waits between attempts on the scheduler
     * instead of a thread. Cancelling the returned future cancels the attempt
     * in flight and stops retrying.
     */
    public <T> CompletableFuture<T> callAsync(Supplier<CompletableFuture<T>> work) {
        DgAssert.isArgumentNotNull(work, "work");
        RetryingFuture<T> result = new RetryingFuture<>();
        this.attempt(work, 0, result);
        return result;
    }

    public <T> CompletableFuture<T> runTransactionAsync(
            DgraphClient client, Function<AsyncTransaction, CompletableFuture<T>> fn,
            boolean readOnly, boolean bestEffort) {
        DgAssert.isArgumentNotNull(client, "client");
        DgAssert.isArgumentNotNull(fn, "fn");
        return this.callAsync(() -> {
            AsyncTransaction txn = client.newAsyncTransaction(readOnly, bestEffort);
            CompletableFuture<T> work;
            try {
                work = fn.apply(txn);
            } catch (RuntimeException e) {
                work = CompletableFuture.failedFuture(e);
            }
            CompletableFuture<T> userWork = work;
            CompletableFuture<T> outcome =
                    userWork.handle((value, error) -> txn.closeAsync().thenApply(ignored -> {
                        if (error != null) {
                            throw GrpcErrors.translate(error);
                        }
                        return value;
                    })).thenCompose(Function.identity());
            outcome.whenComplete((value, error) -> {
                if (outcome.isCancelled()) {
                    userWork.cancel(true);
                }
            });
            return outcome;
        });
    }

    private <T> void attempt(Supplier<CompletableFuture<T>> work, int attempt,
                             RetryingFuture<T> result) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<T> current;
        try {
            current = work.get();
        } catch (RuntimeException e) {
            current = CompletableFuture.failedFuture(e);
        }
        result.current = current;
        if (result.isCancelled()) {
            current.cancel(true);
            return;
        }
        current.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = GrpcErrors.unwrap(error);
            if (!(cause instanceof RetriableException) || result.isDone()) {
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= this.policy.getMaxRetries()) {
                log.warn("Giving up after {} attempts: {}", attempt + 1, cause.getMessage());
                result.completeExceptionally(cause);
                return;
            }
            Duration delay = this.policy.delay(attempt);
            log.debug("Attempt {} failed with {}, retrying in {} ms", attempt + 1,
                      ((RetriableException) cause).getErrorType(), delay.toMillis());
            ScheduledFuture<?> timer;
            try {
                timer = this.scheduler.schedule(() -> this.attempt(work, attempt + 1, result),
                                                delay.toNanos(), TimeUnit.NANOSECONDS);
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(cause);
                return;
            }
            result.pending = timer;
            if (result.isCancelled()) {
                timer.cancel(false);
            }
        });
    }

    private static final class RetryingFuture<T> extends CompletableFuture<T> {

        private volatile CompletableFuture<T> current;
        // Timer of the next attempt while waiting out a delay
        private volatile Future<?> pending;

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            if (!cancelled) {
                return false;
            }
            Future<?> pending = this.pending;
            if (pending != null) {
                pending.cancel(false);
            }
            CompletableFuture<T> current = this.current;
            if (current != null) {
                current.cancel(mayInterruptIfRunning);
            }
            return true;
        }
    }
}
