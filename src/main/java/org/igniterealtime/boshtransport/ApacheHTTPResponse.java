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
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.protocol.BasicHttpContext;
import org.apache.http.util.EntityUtils;

/**
 * Response to a request sent using Apache HttpClient.  The request starts
 * executing as soon as the response object is created, on a thread supplied
 * by the sender; accessors block until it has completed.
 */
final class ApacheHTTPResponse implements HTTPResponse {

    /**
     * Name of the content type header.
     */
    private static final String CONTENT_TYPE_HEADER = "Content-Type";

    /**
     * Content type to use when transmitting the body data.
     */
    private static final String CONTENT_TYPE = "text/xml; charset=utf-8";

    /**
     * Status and body of a completed exchange.
     */
    private static final class Outcome {
        private final int status;
        private final byte[] body;

        Outcome(final int httpStatus, final byte[] data) {
            status = httpStatus;
            body = data;
        }
    }

    /**
     * Method used to execute the HTTP request.
     */
    private final HttpPost post;

    /**
     * Request execution, started on construction.
     */
    private final FutureTask<Outcome> execution;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Create and start a new request.
     *
     * @param client HTTP client to execute with
     * @param executor executor to run the blocking request on
     * @param cfg transport configuration
     * @param request body to send
     */
    ApacheHTTPResponse(
            final HttpClient client,
            final Executor executor,
            final TransportConfig cfg,
            final XMLElement request) {
        post = new HttpPost(cfg.getEndpoint().toURI());
        byte[] data = request.toXML().getBytes(StandardCharsets.UTF_8);
        post.setEntity(new ByteArrayEntity(data));
        post.setHeader(CONTENT_TYPE_HEADER, CONTENT_TYPE);

        execution = new FutureTask<Outcome>(new Callable<Outcome>() {
            public Outcome call() throws IOException {
                HttpResponse httpResp =
                        client.execute(post, new BasicHttpContext());
                HttpEntity entity = httpResp.getEntity();
                byte[] body;
                if (entity == null) {
                    body = new byte[0];
                } else {
                    body = EntityUtils.toByteArray(entity);
                }
                return new Outcome(
                        httpResp.getStatusLine().getStatusCode(), body);
            }
        });
        try {
            executor.execute(execution);
        } catch (RejectedExecutionException rex) {
            throw(new IllegalStateException("Sender has been destroyed", rex));
        }
    }

    ///////////////////////////////////////////////////////////////////////////
    // HTTPResponse interface methods:

    /**
     * {@inheritDoc}
     */
    public void abort() {
        post.abort();
        execution.cancel(false);
    }

    /**
     * {@inheritDoc}
     */
    public int getHTTPStatus() throws InterruptedException, BOSHException {
        return awaitOutcome().status;
    }

    /**
     * {@inheritDoc}
     */
    public byte[] getBody() throws InterruptedException, BOSHException {
        return awaitOutcome().body;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    private Outcome awaitOutcome() throws InterruptedException, BOSHException {
        try {
            return execution.get();
        } catch (CancellationException cx) {
            throw(new BOSHException("Request was aborted", cx));
        } catch (ExecutionException exx) {
            Throwable cause = exx.getCause();
            if (cause instanceof RuntimeException) {
                throw((RuntimeException) cause);
            }
            if (cause instanceof Error) {
                throw((Error) cause);
            }
            throw(new BOSHException("Could not obtain response", cause));
        }
    }

}
