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

package org.apache.hugegraph.dgraph.client.rpc;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.apache.commons.lang3.StringUtils;
import org.apache.hugegraph.dgraph.common.DgraphConnectionException;
import org.apache.hugegraph.dgraph.common.DgraphException;
import org.apache.hugegraph.dgraph.common.DgraphRpcException;
import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.common.RetriableException;
import org.apache.hugegraph.dgraph.common.TxnConflictException;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

/**
 * Classifies transport failures at the edge of the client. Nothing past
 * {@link DgraphClientStub} inspects status codes or error text again.
 */
public final class GrpcErrors {

    public static final String JWT_EXPIRED_MESSAGE = "Token is expired";
    public static final String RETRY_MESSAGE = "Please retry";

    private GrpcErrors() {
    }

    public static ErrorType classify(Throwable error) {
        Status status = Status.fromThrowable(error);
        String message = StringUtils.defaultString(status.getDescription());
        if (status.getCode() == Status.Code.ABORTED) {
            return ErrorType.ABORTED;
        }
        if (message.contains(JWT_EXPIRED_MESSAGE) ||
            StringUtils.contains(error.getMessage(), JWT_EXPIRED_MESSAGE)) {
            return ErrorType.JWT_EXPIRED;
        }
        switch (status.getCode()) {
            case UNKNOWN:
                return message.contains(RETRY_MESSAGE) ? ErrorType.RETRIABLE : ErrorType.UNKNOWN;
            case UNAVAILABLE:
                return ErrorType.CONNECTION;
            case UNAUTHENTICATED:
                return ErrorType.UNAUTHENTICATED;
            default:
                return ErrorType.UNKNOWN;
        }
    }

    public static DgraphRpcException toRpcException(Throwable error) {
        if (error instanceof DgraphRpcException) {
            return (DgraphRpcException) error;
        }
        return new DgraphRpcException(classify(error), error);
    }

    /**
     * Maps a classified failure onto the exception callers catch.
     */
    public static RuntimeException translate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof StatusRuntimeException || cause instanceof StatusException) {
            cause = toRpcException(cause);
        }
        if (!(cause instanceof DgraphRpcException)) {
            if (cause instanceof RuntimeException) {
                return (RuntimeException) cause;
            }
            return new DgraphException(ErrorType.UNKNOWN, cause);
        }
        DgraphRpcException rpcError = (DgraphRpcException) cause;
        Throwable origin = rpcError.getCause() == null ? rpcError : rpcError.getCause();
        switch (rpcError.getErrorType()) {
            case ABORTED:
                return new TxnConflictException(origin);
            case RETRIABLE:
                return new RetriableException(origin);
            case CONNECTION:
                return new DgraphConnectionException(origin);
            default:
                return rpcError;
        }
    }

    public static boolean isJwtExpired(Throwable error) {
        Throwable cause = unwrap(error);
        return cause instanceof DgraphRpcException &&
               ((DgraphRpcException) cause).isJwtExpired();
    }

    public static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) &&
               cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Bridges a gRPC future into a {@link CompletableFuture}. Cancelling the
     * returned future cancels the call; failures are classified before they
     * reach the caller.
     */
    public static <T> CompletableFuture<T> toCompletable(ListenableFuture<T> call) {
        CompletableFuture<T> future = new CompletableFuture<>() {
            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                call.cancel(mayInterruptIfRunning);
                return super.cancel(mayInterruptIfRunning);
            }
        };
        Futures.addCallback(call, new FutureCallback<T>() {
            @Override
            public void onSuccess(T result) {
                future.complete(result);
            }

            @Override
            public void onFailure(Throwable t) {
                if (t instanceof CancellationException) {
                    future.cancel(false);
                } else {
                    future.completeExceptionally(toRpcException(t));
                }
            }
        }, MoreExecutors.directExecutor());
        return future;
    }
}
