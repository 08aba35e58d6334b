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

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

import org.apache.hugegraph.dgraph.common.DgAssert;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class DgraphExecutors {

    private static final String POOL_PREFIX_NAME = "dgraph-c-";
    private static final ScheduledExecutorService RETRY_POOL = newScheduledPool("retry", 1);

    private DgraphExecutors() {
    }

    /**
     * The shared scheduler backing asynchronous retry backoff. Its threads are
     * daemons, so it never has to be shut down.
     */
    public static ScheduledExecutorService retryScheduler() {
        return RETRY_POOL;
    }

    /**
     * Set up a scheduled pool of daemon threads.
     *
     * @param poolName    The name of the thread pool.
     * @param coreThreads The number of threads kept in the pool.
     */
    public static ScheduledExecutorService newScheduledPool(String poolName, int coreThreads) {
        DgAssert.isArgumentValid(poolName, "poolName");
        DgAssert.isFalse(coreThreads <= 0, "The number of threads must be positive");

        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(coreThreads, newFactory(poolName));
        executor.setRemoveOnCancelPolicy(true);
        log.debug("Created scheduled pool [ {} ] with {} threads", poolName, coreThreads);
        return executor;
    }

    private static ThreadFactory newFactory(String poolName) {
        return new ThreadFactoryBuilder().setDaemon(true)
                                         .setNameFormat(getPoolName(poolName))
                                         .build();
    }

    private static String getPoolName(String name) {
        return POOL_PREFIX_NAME + name.toLowerCase() + "-%d";
    }
}
