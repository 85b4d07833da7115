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
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.xlightweb.IFutureResponse;
import org.xlightweb.IHttpResponse;
import org.xlightweb.PostRequest;
import org.xlightweb.client.HttpClient;

/**
 * Response to a request sent using the xLightweb client.  The request is
 * issued when the response object is created; xLightweb performs it
 * asynchronously.
 */
final class XLightWebResponse implements HTTPResponse {

    private static final Logger LOG =
            Logger.getLogger(XLightWebResponse.class.getName());

    private static final String CONTENT_TYPE = "text/xml; charset=utf-8";

    private final Lock lock = new ReentrantLock();

    /**
     * Pending response, or {@code null} if the request could not be issued.
     */
    private final IFutureResponse future;

    /**
     * Failure to report instead of a response, once known.
     */
    private BOSHException failure;

    /**
     * Status code, valid once {@code body} is set.
     */
    private int status;

    /**
     * Response body, once read.
     */
    private byte[] body;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Issue a new request.
     *
     * @param client xLightweb client to send with
     * @param uri URI to post to
     * @param request body to send
     */
    XLightWebResponse(
            final HttpClient client,
            final String uri,
            final XMLElement request) {
        byte[] data = request.toXML().getBytes(StandardCharsets.UTF_8);
        IFutureResponse issued = null;
        try {
            PostRequest post = new PostRequest(uri, CONTENT_TYPE, data);
            post.setTransferEncoding(null);
            post.setContentLength(data.length);
            issued = client.send(post);
        } catch (IOException iox) {
            LOG.log(Level.FINE, "Could not issue request", iox);
            failure = new BOSHException("Could not send request", iox);
        }
        future = issued;
    }

    ///////////////////////////////////////////////////////////////////////////
    // HTTPResponse interface methods:

    /**
     * {@inheritDoc}
     */
    public void abort() {
        if (future != null) {
            future.cancel(true);
        }
    }

    /**
     * {@inheritDoc}
     */
    public int getHTTPStatus() throws InterruptedException, BOSHException {
        lock.lock();
        try {
            readResponse();
            return status;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     */
    public byte[] getBody() throws InterruptedException, BOSHException {
        lock.lock();
        try {
            readResponse();
            return body;
        } finally {
            lock.unlock();
        }
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    /**
     * Read the status and body on first use.  Must be called with the lock
     * held.
     */
    private void readResponse() throws InterruptedException, BOSHException {
        if (failure != null) {
            throw(failure);
        }
        if (body != null) {
            return;
        }
        try {
            IHttpResponse response = future.getResponse();
            byte[] data = response.getBlockingBody().readBytes();
            status = response.getStatus();
            body = data;
        } catch (IOException iox) {
            failure = new BOSHException("Could not obtain response", iox);
            throw(failure);
        }
    }

}
