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
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.xlightweb.client.HttpClient;

/**
 * {@code HTTPSender} backed by the non-blocking xLightweb client.  Requests
 * are handed to the client as soon as they are sent and complete
 * asynchronously.  HTTP proxies are not supported.
 */
final class XLightWebSender implements HTTPSender {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(XLightWebSender.class.getName());

    /**
     * Guards the client and the target URI.
     */
    private final Lock lock = new ReentrantLock();

    /**
     * Client, or {@code null} when not initialized.
     */
    private HttpClient client;

    /**
     * URI every request is posted to.
     */
    private String targetURI;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent construction apart from our package.
     */
    XLightWebSender() {
        // Fail here, rather than on first use, if xLightweb is missing
        HttpClient.class.getName();
    }

    ///////////////////////////////////////////////////////////////////////////
    // HTTPSender interface methods:

    /**
     * {@inheritDoc}
     */
    public void init(final TransportConfig cfg) throws BOSHException {
        if (cfg.getProxyHost() != null) {
            throw(new BOSHException(
                    "HTTP proxies are not supported by the xLightweb sender"));
        }
        String uri = cfg.getEndpoint().toURI().toString();
        lock.lock();
        try {
            if (client != null) {
                throw(new IllegalStateException("Sender already initialized"));
            }
            client = new HttpClient();
            targetURI = uri;
        } finally {
            lock.unlock();
        }
        LOG.log(Level.FINE, "Posting to {0}", uri);
    }

    /**
     * {@inheritDoc}
     */
    public void destroy() {
        HttpClient closing;
        lock.lock();
        try {
            closing = client;
            client = null;
            targetURI = null;
        } finally {
            lock.unlock();
        }
        if (closing == null) {
            return;
        }
        try {
            closing.close();
        } catch (IOException iox) {
            LOG.log(Level.FINEST, "Ignoring exception on close", iox);
        }
    }

    /**
     * {@inheritDoc}
     */
    public HTTPResponse send(final XMLElement body) {
        lock.lock();
        try {
            if (client == null) {
                throw(new IllegalStateException("Sender is not initialized"));
            }
            // Issued under the lock so concurrent sends keep their order
            return new XLightWebResponse(client, targetURI, body);
        } finally {
            lock.unlock();
        }
    }

}
