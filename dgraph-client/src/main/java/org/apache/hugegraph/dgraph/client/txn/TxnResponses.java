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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;

import org.apache.hugegraph.dgraph.common.DgraphException;
import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

public final class TxnResponses {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TxnResponses() {
    }

    public static JsonNode json(Response response) {
        if (response.getJson().isEmpty()) {
            return MissingNode.getInstance();
        }
        try {
            return MAPPER.readTree(response.getJson().toByteArray());
        } catch (IOException e) {
            throw new DgraphException(ErrorType.UNKNOWN, "Malformed JSON in response", e);
        }
    }

    public static <T> T json(Response response, Class<T> type) {
        try {
            return MAPPER.readValue(response.getJson().toByteArray(), type);
        } catch (IOException e) {
            throw new DgraphException(ErrorType.UNKNOWN,
                                      "Failed to read response as " + type.getSimpleName(), e);
        }
    }

    public static String rdf(Response response) {
        return response.getRdf().toString(UTF_8);
    }
}
