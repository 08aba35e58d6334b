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

import org.apache.commons.lang3.StringUtils;
import org.apache.hugegraph.dgraph.common.DgraphException;
import org.apache.hugegraph.dgraph.common.ErrorType;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Jwt;
import org.apache.hugegraph.dgraph.grpc.DgraphProto.Response;

import com.google.protobuf.InvalidProtocolBufferException;

/**
 * The tokens of one login. Immutable: a refresh replaces the whole session,
 * so a reader never sees an access token paired with a stale refresh token.
 */
public final class Session {

    public static final Session EMPTY = new Session("", "");

    private final String accessToken;
    private final String refreshToken;

    public Session(String accessToken, String refreshToken) {
        this.accessToken = StringUtils.defaultString(accessToken);
        this.refreshToken = StringUtils.defaultString(refreshToken);
    }

    /**
     * Reads the tokens the server returns from Login, serialized into the
     * json field of the response.
     */
    public static Session fromResponse(Response response) {
        Jwt jwt;
        try {
            jwt = Jwt.parseFrom(response.getJson());
        } catch (InvalidProtocolBufferException e) {
            throw new DgraphException(ErrorType.LOGIN_FAILED,
                                      "Failed to parse login response", e);
        }
        if (jwt.getAccessJwt().isEmpty()) {
            throw new DgraphException(ErrorType.LOGIN_FAILED,
                                      "Login response did not contain access_jwt");
        }
        return new Session(jwt.getAccessJwt(), jwt.getRefreshJwt());
    }

    public String getAccessToken() {
        return this.accessToken;
    }

    public String getRefreshToken() {
        return this.refreshToken;
    }

    public boolean isLoggedIn() {
        return !this.accessToken.isEmpty();
    }

    public boolean hasRefreshToken() {
        return !this.refreshToken.isEmpty();
    }

    @Override
    public String toString() {
        return "Session{loggedIn=" + this.isLoggedIn() +
               ", refreshable=" + this.hasRefreshToken() + '}';
    }
}
