/*
 * Copyright 2009 Mike Cumings
 * Copyright 2026 The BOSH Transport Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.igniterealtime.boshtransport;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.http.HttpHost;
import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

/**
 * Implementation of the {@code HTTPSender} interface which uses the
 * Apache HttpClient API to send messages to the connection manager.
 */
final class ApacheHTTPSender implements HTTPSender {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(ApacheHTTPSender.class.getName());

    /**
     * Maximum number of pooled connections.  Long-polling keeps requests
     * outstanding, so the per-route limit must not fall back to the
     * client's small default.
     */
    private static final int MAX_CONNECTIONS = 100;

    /**
     * Lock used for internal synchronization.
     */
    private final Lock lock = new ReentrantLock();

    /**
     * Session configuration.
     */
    private TransportConfig cfg;

    /**
     * HttpClient instance to use to communicate.
     */
    private CloseableHttpClient httpClient;

    /**
     * Threads executing the blocking client calls.  A request is started as
     * soon as it is sent so that requests go out in the order they were
     * sent.
     */
    private ExecutorService executor;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent construction apart from our package.
     */
    ApacheHTTPSender() {
        // Load Apache HTTP client class
        HttpClient.class.getName();
    }

    ///////////////////////////////////////////////////////////////////////////
    // HTTPSender interface methods:

    /**
     * {@inheritDoc}
     */
    public void init(final TransportConfig session) {
        lock.lock();
        try {
            cfg = session;
            httpClient = initHttpClient(session);
            executor = initExecutor();
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    public void destroy() {
        lock.lock();
        try {
            if (httpClient != null) {
                httpClient.close();
            }
        } catch (IOException iox) {
            LOG.log(Level.FINEST, "Ignoring exception on close", iox);
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
            cfg = null;
            httpClient = null;
            executor = null;
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    public HTTPResponse send(final XMLElement body) {
        CloseableHttpClient mClient;
        ExecutorService mExecutor;
        TransportConfig mCfg;
        lock.lock();
        try {
            if (cfg == null) {
                throw(new IllegalStateException("Sender is not initialized"));
            }
            if (httpClient == null) {
                httpClient = initHttpClient(cfg);
            }
            mClient = httpClient;
            mExecutor = executor;
            mCfg = cfg;
        } finally {
            lock.unlock();
        }
        return new ApacheHTTPResponse(mClient, mExecutor, mCfg, body);
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    private static ExecutorService initExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger count = new AtomicInteger();

            public Thread newThread(final Runnable runnable) {
                Thread thread = new Thread(runnable,
                        "ApacheHTTPSender: request " + count.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    private static CloseableHttpClient initHttpClient(
            final TransportConfig config) {
        PoolingHttpClientConnectionManager cm =
                new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(MAX_CONNECTIONS);
        cm.setDefaultMaxPerRoute(MAX_CONNECTIONS);

        // No socket timeout: the connection manager holds polls open
        RequestConfig requestCfg = RequestConfig.custom()
                .setExpectContinueEnabled(false)
                .build();

        HttpClientBuilder builder = HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestCfg);
        if (config != null
                && config.getProxyHost() != null
                && config.getProxyPort() != 0) {
            builder.setProxy(new HttpHost(
                    config.getProxyHost(),
                    config.getProxyPort()));
        }
        return builder.build();
    }

}
