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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.PropertyResourceBundle;
import java.util.ResourceBundle;

import org.apache.commons.lang3.StringUtils;
import org.apache.hugegraph.dgraph.client.retry.RetryPolicy;
import org.apache.hugegraph.dgraph.common.DgAssert;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class DgraphConfig {

    public static final String SCHEME = "dgraph";
    private static final String FILE_NAME = "dgraph-client";
    private static final int GRPC_DEFAULT_MAX_INBOUND_MESSAGE_SIZE = 4 * 1024 * 1024;

    private String serverHost = "localhost:9080";

    // Deadline of a single grpc call in milliseconds, 0 means no deadline
    private long grpcTimeOut = 60000;

    private int inboundMessageSize = GRPC_DEFAULT_MAX_INBOUND_MESSAGE_SIZE;

    private boolean useTls = false;
    private String apiKey;
    private String bearerToken;

    private String userName;
    private String password;
    private long namespace = 0L;

    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
    private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
    private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
    private double jitter = RetryPolicy.DEFAULT_JITTER;

    private DgraphConfig() {
    }

    /**
     * Defaults, overridden by dgraph-client.properties when it is on the classpath.
     */
    public static DgraphConfig of() {
        DgraphConfig config = new DgraphConfig();
        overrideViaProperties(config);
        return config;
    }

    public static DgraphConfig of(String serverHost) {
        DgraphConfig config = of();
        config.serverHost = serverHost;
        return config;
    }

    public static DgraphConfig of(String serverHost, long timeOut) {
        DgraphConfig config = of(serverHost);
        config.grpcTimeOut = timeOut;
        return config;
    }

    /**
     * Parses a connection string of the form
     * {@code dgraph://[user:password@]host:port[?sslmode=..&apikey=..|bearertoken=..]}.
     */
    public static DgraphConfig parse(String connectionString) {
        DgAssert.isArgumentValid(connectionString, "connectionString");
        URI uri;
        try {
            uri = new URI(connectionString);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Failed to parse connection string: " +
                                               connectionString, e);
        }
        if (!SCHEME.equals(uri.getScheme())) {
            throw new IllegalArgumentException(
                    "Invalid connection string: scheme must be '" + SCHEME + "'");
        }
        if (StringUtils.isEmpty(uri.getHost())) {
            throw new IllegalArgumentException("Invalid connection string: hostname required");
        }
        if (uri.getPort() < 0) {
            throw new IllegalArgumentException("Invalid connection string: port required");
        }

        DgraphConfig config = of(uri.getHost() + ":" + uri.getPort());

        String userInfo = uri.getRawUserInfo();
        if (userInfo != null) {
            int split = userInfo.indexOf(':');
            String user = decode(split < 0 ? userInfo : userInfo.substring(0, split));
            String pwd = split < 0 ? null : decode(userInfo.substring(split + 1));
            if (StringUtils.isEmpty(pwd)) {
                throw new IllegalArgumentException("Invalid connection string: " +
                                                   "password required when username is provided");
            }
            config.setAuthority(user, pwd);
        }

        Map<String, String> params = queryParams(uri.getRawQuery());
        String sslMode = params.get("sslmode");
        if (sslMode != null) {
            switch (sslMode) {
                case "disable":
                    config.useTls = false;
                    break;
                case "verify-ca":
                    config.useTls = true;
                    break;
                case "require":
                    throw new IllegalArgumentException(
                            "sslmode=require is not supported, use verify-ca");
                default:
                    throw new IllegalArgumentException("Invalid sslmode: " + sslMode);
            }
        }

        if (params.containsKey("apikey") && params.containsKey("bearertoken")) {
            throw new IllegalArgumentException("apikey and bearertoken cannot both be provided");
        }
        if (params.containsKey("apikey")) {
            config.setApiKey(params.get("apikey"));
        } else if (params.containsKey("bearertoken")) {
            config.setBearerToken(params.get("bearertoken"));
        }
        return config;
    }

    private static Map<String, String> queryParams(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (StringUtils.isEmpty(rawQuery)) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int split = pair.indexOf('=');
            String key = decode(split < 0 ? pair : pair.substring(0, split));
            String value = split < 0 ? "" : decode(pair.substring(split + 1));
            params.put(key, value);
        }
        return params;
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, UTF_8);
    }

    private static void overrideViaProperties(DgraphConfig config) {
        PropertyResourceBundle prb;
        try {
            prb = (PropertyResourceBundle) ResourceBundle.getBundle(FILE_NAME);
        } catch (Throwable t) {
            log.debug("No {}.properties found, default configuration was activated", FILE_NAME);
            return;
        }
        config.serverHost = getStr(prb, "dgraph.server.host", config.serverHost);
        config.grpcTimeOut = Long.parseLong(getStr(prb, "dgraph.grpc.timeout",
                                                   String.valueOf(config.grpcTimeOut)));
        config.inboundMessageSize = Integer.parseInt(
                getStr(prb, "dgraph.grpc.max.inbound.message.size",
                       String.valueOf(config.inboundMessageSize)));
        config.maxRetries = Integer.parseInt(getStr(prb, "dgraph.retry.max",
                                                    String.valueOf(config.maxRetries)));
        config.baseDelay = getMillis(prb, "dgraph.retry.base.delay.ms", config.baseDelay);
        config.maxDelay = getMillis(prb, "dgraph.retry.max.delay.ms", config.maxDelay);
        config.jitter = Double.parseDouble(getStr(prb, "dgraph.retry.jitter",
                                                  String.valueOf(config.jitter)));
        log.info("Loaded {}.properties: {}", FILE_NAME, config);
    }

    private static Duration getMillis(PropertyResourceBundle prb, String key,
                                      Duration defaultValue) {
        String value = getStr(prb, key, null);
        return value == null ? defaultValue : Duration.ofMillis(Long.parseLong(value));
    }

    private static String getStr(PropertyResourceBundle prb, String key, String defaultValue) {
        if (!prb.containsKey(key)) {
            return defaultValue;
        }
        String value = prb.getString(key);
        return StringUtils.isBlank(value) ? defaultValue : value.trim();
    }

    public String getServerHost() {
        return serverHost;
    }

    public String[] getServerHosts() {
        return StringUtils.split(serverHost, ',');
    }

    public long getGrpcTimeOut() {
        return grpcTimeOut;
    }

    public DgraphConfig setGrpcTimeOut(long grpcTimeOut) {
        this.grpcTimeOut = grpcTimeOut;
        return this;
    }

    public int getInboundMessageSize() {
        return inboundMessageSize;
    }

    public DgraphConfig setInboundMessageSize(int inboundMessageSize) {
        this.inboundMessageSize = inboundMessageSize;
        return this;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public DgraphConfig setUseTls(boolean useTls) {
        this.useTls = useTls;
        return this;
    }

    public String getApiKey() {
        return apiKey;
    }

    public DgraphConfig setApiKey(String apiKey) {
        this.apiKey = apiKey;
        this.bearerToken = null;
        return this;
    }

    public String getBearerToken() {
        return bearerToken;
    }

    public DgraphConfig setBearerToken(String bearerToken) {
        this.bearerToken = bearerToken;
        this.apiKey = null;
        return this;
    }

    /**
     * The value of the authorization header, or null when neither an API key
     * nor a bearer token is configured.
     */
    public String getAuthorization() {
        if (StringUtils.isNotEmpty(apiKey)) {
            return apiKey;
        }
        if (StringUtils.isNotEmpty(bearerToken)) {
            return "Bearer " + bearerToken;
        }
        return null;
    }

    public DgraphConfig setAuthority(String userName, String pwd) {
        this.userName = userName;
        this.password = pwd;
        return this;
    }

    public String getUserName() {
        return userName;
    }

    public String getPassword() {
        return password;
    }

    public long getNamespace() {
        return namespace;
    }

    public DgraphConfig setNamespace(long namespace) {
        this.namespace = namespace;
        return this;
    }

    public DgraphConfig setRetry(int maxRetries, Duration baseDelay, Duration maxDelay,
                                 double jitter) {
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        return this;
    }

    public RetryPolicy getRetryPolicy() {
        return RetryPolicy.of(maxRetries, baseDelay, maxDelay, jitter);
    }

    @Override
    public String toString() {
        return "DgraphConfig{" +
               "serverHost='" + serverHost + '\'' +
               ", grpcTimeOut=" + grpcTimeOut +
               ", useTls=" + useTls +
               ", userName='" + userName + '\'' +
               ", maxRetries=" + maxRetries +
               '}';
    }
}
