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

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.apache.hugegraph.dgraph.client.DgraphConfig;
import org.apache.hugegraph.dgraph.client.interceptor.Authentication;
import org.apache.hugegraph.dgraph.common.DgAssert;
import org.apache.hugegraph.dgraph.grpc.DgraphGrpc;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Check;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.LoginRequest;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Operation;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Payload;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Request;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.TxnContext;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Version;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.AbstractStub;
import io.grpc.stub.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * One channel to one server. Every call carries the caller's metadata and the
 * configured deadline; failures leave this class already classified as
 * {@link org.apache.hugegraph.dgraph.common.DgraphRpcException}.
 */
@Slf4j
public class DgraphClientStub implements Closeable {

    private final ManagedChannel channel;
    private final DgraphConfig config;
    private final DgraphGrpc.DgraphBlockingStub blockingStub;
    private final DgraphGrpc.DgraphFutureStub futureStub;

    public DgraphClientStub(ManagedChannel channel, DgraphConfig config) {
        DgAssert.isArgumentNotNull(channel, "channel");
        DgAssert.isArgumentNotNull(config, "config");
        this.channel = channel;
        this.config = config;
        this.blockingStub = DgraphGrpc.newBlockingStub(channel)
                                      .withMaxInboundMessageSize(config.getInboundMessageSize());
        this.futureStub = DgraphGrpc.newFutureStub(channel)
                                    .withMaxInboundMessageSize(config.getInboundMessageSize());
    }

    public static DgraphClientStub create(String target, DgraphConfig config) {
        DgAssert.isArgumentValid(target, "target");
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forTarget(target)
                                                                .maxInboundMessageSize(
                                                                        config.getInboundMessageSize());
        if (config.isUseTls()) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        String authorization = config.getAuthorization();
        if (authorization != null) {
            builder.intercept(new Authentication(authorization));
        }
        log.info("DgraphClientStub connecting to {}, tls: {}", target, config.isUseTls());
        return new DgraphClientStub(builder.build(), config);
    }

    private <T extends AbstractStub<T>> T withParams(T stub, Metadata metadata) {
        if (this.config.getGrpcTimeOut() > 0) {
            stub = stub.withDeadlineAfter(this.config.getGrpcTimeOut(), TimeUnit.MILLISECONDS);
        }
        if (metadata != null) {
            stub = stub.withInterceptors(MetadataUtils.newAttachHeadersInterceptor(metadata));
        }
        return stub;
    }

    public Response login(LoginRequest request) {
        try {
            return this.withParams(this.blockingStub, null).login(request);
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.toRpcException(e);
        }
    }

    public CompletableFuture<Response> loginAsync(LoginRequest request) {
        return GrpcErrors.toCompletable(this.withParams(this.futureStub, null).login(request));
    }

    public Response query(Request request, Metadata metadata) {
        try {
            return this.withParams(this.blockingStub, metadata).query(request);
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.toRpcException(e);
        }
    }

    public CompletableFuture<Response> queryAsync(Request request, Metadata metadata) {
        return GrpcErrors.toCompletable(this.withParams(this.futureStub, metadata).query(request));
    }

    public TxnContext commitOrAbort(TxnContext context, Metadata metadata) {
        try {
            return this.withParams(this.blockingStub, metadata).commitOrAbort(context);
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.toRpcException(e);
        }
    }

    public CompletableFuture<TxnContext> commitOrAbortAsync(TxnContext context,
                                                            Metadata metadata) {
        return GrpcErrors.toCompletable(
                this.withParams(this.futureStub, metadata).commitOrAbort(context));
    }

    public Payload alter(Operation operation, Metadata metadata) {
        try {
            return this.withParams(this.blockingStub, metadata).alter(operation);
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.toRpcException(e);
        }
    }

    public CompletableFuture<Payload> alterAsync(Operation operation, Metadata metadata) {
        return GrpcErrors.toCompletable(this.withParams(this.futureStub, metadata).alter(operation));
    }

    public Version checkVersion(Metadata metadata) {
        try {
            return this.withParams(this.blockingStub, metadata)
                       .checkVersion(Check.getDefaultInstance());
        } catch (StatusRuntimeException e) {
            throw GrpcErrors.toRpcException(e);
        }
    }

    public String getTarget() {
        return this.channel.authority();
    }

    public DgraphConfig getConfig() {
        return this.config;
    }

    @Override
    public void close() {
        try {
            while (!this.channel.shutdownNow().awaitTermination(100, TimeUnit.MILLISECONDS)) {
                log.debug("Waiting for channel {} to terminate", this.channel.authority());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing channel {}", this.channel.authority());
        }
    }
}
