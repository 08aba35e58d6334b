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

package org.apache.hugegraph.dgraph.client.support;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.apache.hugegraph.dgraph.client.rpc.GrpcErrors;

/**
 * A non-reentrant lock for asynchronous code. Waiters are granted the lock in
 * arrival order by completing their future; nothing ever blocks a thread.
 * <p>
 * Since it is not reentrant, an operation holding the lock must not call
 * another operation that takes the same lock.
 */
public final class AsyncMutex {

    private final Queue<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private boolean locked;

    public CompletableFuture<Void> acquire() {
        synchronized (this) {
            if (!this.locked) {
                this.locked = true;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            this.waiters.add(waiter);
            return waiter;
        }
    }

    public synchronized boolean tryAcquire() {
        if (this.locked) {
            return false;
        }
        this.locked = true;
        return true;
    }

    public void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            if (!this.locked) {
                throw new IllegalStateException("AsyncMutex is not locked");
            }
            // Skip waiters that gave up, hand the lock to the first live one
            do {
                next = this.waiters.poll();
            } while (next != null && next.isDone());
            if (next == null) {
                this.locked = false;
                return;
            }
        }
        // Completed outside the monitor, the continuation may run inline
        if (!next.complete(null)) {
            this.release();
        }
    }

    public synchronized boolean isLocked() {
        return this.locked;
    }

    /**
     * Runs {@code body} while holding the lock. The lock is released once the
     * future returned by {@code body} completes, before the result is
     * completed, so a continuation may take the lock again immediately.
     * <p>
     * Cancelling the returned future cancels the futures the body tracked on
     * its {@link Permit}. The lock is still held until the body settles.
     */
    public <T> CompletableFuture<T> withLock(Function<Permit, CompletableFuture<T>> body) {
        Permit permit = new Permit();
        CompletableFuture<T> result = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                boolean cancelled = super.cancel(mayInterruptIfRunning);
                if (cancelled) {
                    permit.cancelTracked();
                }
                return cancelled;
            }
        };
        permit.owner = result;

        this.acquire().whenComplete((ignored, lockError) -> {
            if (result.isDone()) {
                this.release();
                return;
            }
            CompletableFuture<T> inner;
            try {
                inner = body.apply(permit);
            } catch (Throwable e) {
                this.release();
                result.completeExceptionally(e);
                return;
            }
            if (inner == null) {
                this.release();
                result.completeExceptionally(
                        new NullPointerException("Locked body returned no future"));
                return;
            }
            inner.whenComplete((value, error) -> {
                this.release();
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(GrpcErrors.unwrap(error));
                }
            });
        });
        return result;
    }

    /**
     * Handed to the body of {@link #withLock}: futures tracked here are
     * cancelled when the caller cancels the locked operation.
     */
    public static final class Permit {

        private final List<Future<?>> tracked = new CopyOnWriteArrayList<>();
        private volatile CompletableFuture<?> owner;

        private Permit() {
        }

        public <F extends Future<?>> F track(F future) {
            this.tracked.add(future);
            if (this.isCancelled()) {
                future.cancel(true);
            }
            return future;
        }

        public boolean isCancelled() {
            CompletableFuture<?> owner = this.owner;
            return owner != null && owner.isCancelled();
        }

        private void cancelTracked() {
            for (Future<?> future : this.tracked) {
                future.cancel(true);
            }
        }
    }
}
