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

package org.apache.hugegraph.dgraph.client;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.function.BooleanSupplier;

import org.apache.hugegraph.dgraph.client.rpc.DgraphClientStub;
import org.apache.hugegraph.dgraph.client.test.FakeDgraphServer;
import org.junit.After;
import org.junit.Before;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;

public class BaseClientTest {

    protected static final ObjectMapper MAPPER = new ObjectMapper();

    protected FakeDgraphServer fake;
    protected Server server;
    protected ManagedChannel channel;
    protected DgraphConfig config;
    protected DgraphClientStub stub;
    protected DgraphClient client;

    @Before
    public void startServer() throws IOException {
        String name = InProcessServerBuilder.generateName();
        this.fake = new FakeDgraphServer();
        this.server = InProcessServerBuilder.forName(name)
                                            .addService(ServerInterceptors.intercept(
                                                    this.fake, this.fake.interceptor()))
                                            .build()
                                            .start();
        this.channel = InProcessChannelBuilder.forName(name).build();
        this.config = DgraphConfig.of("in-process:" + name, 5000)
                                  .setRetry(3, Duration.ofMillis(1), Duration.ofMillis(5), 0.0);
        this.stub = new DgraphClientStub(this.channel, this.config);
        this.client = new DgraphClient(this.config, Collections.singletonList(this.stub));
    }

    @After
    public void stopServer() {
        this.client.close();
        this.server.shutdownNow();
    }

    protected static ObjectNode person(String uid, String name, int balance) {
        ObjectNode node = MAPPER.createObjectNode();
        if (uid != null) {
            node.put("uid", uid);
        }
        node.put("name", name);
        node.put("balance", balance);
        return node;
    }

    protected static Map<String, String> id(String uid) {
        return Collections.singletonMap("$id", uid);
    }

    protected static JsonNode first(JsonNode result) {
        return result.path("q").path(0);
    }

    protected static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within 5 seconds");
            }
            Thread.sleep(5);
        }
    }
}
