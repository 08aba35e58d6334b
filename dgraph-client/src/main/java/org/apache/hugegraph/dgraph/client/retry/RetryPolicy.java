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
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

import org.apache.hugegraph.dgraph.common.DgAssert;

/**
 * Exponential backoff with jitter. The delay before retry {@code n} (starting
 * at 0) is {@code min(baseDelay * 2^n, maxDelay)} plus a random share of up to
 * {@code jitter} of that value.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final double DEFAULT_JITTER = 0.1;

    private static final RetryPolicy DEFAULT = new RetryPolicy(DEFAULT_MAX_RETRIES,
                                                               DEFAULT_BASE_DELAY,
                                                               DEFAULT_MAX_DELAY,
                                                               DEFAULT_JITTER);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;

    private RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitter) {
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
    }

    public static RetryPolicy of() {
        return DEFAULT;
    }

    public static RetryPolicy of(int maxRetries, Duration baseDelay, Duration maxDelay,
                                 double jitter) {
        DgAssert.isTrue(maxRetries >= 0, "maxRetries must not be negative");
        DgAssert.isArgumentNotNull(baseDelay, "baseDelay");
        DgAssert.isArgumentNotNull(maxDelay, "maxDelay");
        DgAssert.isFalse(baseDelay.isNegative(), "baseDelay must not be negative");
        DgAssert.isFalse(maxDelay.isNegative(), "maxDelay must not be negative");
        DgAssert.isTrue(jitter >= 0.0 && jitter <= 1.0, "jitter must be within [0, 1]");
        return new RetryPolicy(maxRetries, baseDelay, maxDelay, jitter);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration delay(int attempt) {
        return this.delay(attempt, ThreadLocalRandom.current());
    }

    Duration delay(int attempt, Random random) {
        DgAssert.isTrue(attempt >= 0, "attempt must not be negative");
        double max = this.maxDelay.toNanos();
        // 2^62 already overflows any sane max delay
        double exp = this.baseDelay.toNanos() * Math.pow(2, Math.min(attempt, 62));
        double capped = Math.min(exp, max);
        double delay = capped + capped * this.jitter * random.nextDouble();
        return Duration.ofNanos((long) delay);
    }

    public int getMaxRetries() {
        return this.maxRetries;
    }

    public Duration getBaseDelay() {
        return this.baseDelay;
    }

    public Duration getMaxDelay() {
        return this.maxDelay;
    }

    public double getJitter() {
        return this.jitter;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + this.maxRetries +
               ", baseDelay=" + this.baseDelay +
               ", maxDelay=" + this.maxDelay +
               ", jitter=" + this.jitter + '}';
    }

    public static final class Builder {

        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double jitter = DEFAULT_JITTER;

        private Builder() {
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public RetryPolicy build() {
            return RetryPolicy.of(this.maxRetries, this.baseDelay, this.maxDelay, this.jitter);
        }
    }
}
