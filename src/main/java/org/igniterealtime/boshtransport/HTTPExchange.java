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

/**
 * A request and response pair representing a single exchange with a remote
 * connection manager.  The outcome is filled in by the dispatcher worker
 * which performed the exchange and is read by the session processing thread
 * once the completion has been handed over through the session mailbox.
 */
final class HTTPExchange {

    /**
     * Lowest HTTP status considered successful.
     */
    private static final int HTTP_OK_MIN = 200;

    /**
     * Highest HTTP status considered successful.
     */
    private static final int HTTP_OK_MAX = 299;

    /**
     * Request body.
     */
    private final XMLElement request;

    /**
     * HTTPResponse instance, once sent.
     */
    private HTTPResponse response;

    /**
     * HTTP status of the completed exchange.
     */
    private int status;

    /**
     * Response body of the completed exchange.
     */
    private byte[] responseBody;

    /**
     * Failure of the exchange, or {@code null} if it succeeded.
     */
    private BOSHException failure;

    ///////////////////////////////////////////////////////////////////////////
    // Constructor:

    /**
     * Create a new request/response pair object.
     *
     * @param req request message body
     */
    HTTPExchange(final XMLElement req) {
        if (req == null) {
            throw(new IllegalArgumentException("Request body cannot be null"));
        }
        request = req;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Get the original request message.
     *
     * @return request message body
     */
    XMLElement getRequest() {
        return request;
    }

    /**
     * Get the request ID carried by the request, as sent.
     *
     * @return rid attribute value, or {@code null} if absent
     */
    String getRequestRID() {
        return request.getAttribute(Attributes.RID);
    }

    /**
     * Set the HTTPResponse instance.
     *
     * @param resp HTTP response
     */
    void setHTTPResponse(final HTTPResponse resp) {
        if (response != null) {
            throw(new IllegalStateException(
                    "HTTPResponse was already set"));
        }
        response = resp;
    }

    /**
     * Block until the response has arrived and record the outcome.  A
     * response with a status outside of the 2xx range is recorded as a
     * failure.
     *
     * @throws InterruptedException if interrupted while awaiting the response
     */
    void awaitOutcome() throws InterruptedException {
        try {
            status = response.getHTTPStatus();
            responseBody = response.getBody();
            if (status < HTTP_OK_MIN || status > HTTP_OK_MAX) {
                failure = new BOSHException(
                        "Unexpected HTTP status " + status
                        + " in response to RID " + getRequestRID());
            }
        } catch (BOSHException boshx) {
            failure = boshx;
        }
    }

    /**
     * Abort the issued request, if any.
     */
    void abort() {
        if (response != null) {
            response.abort();
        }
    }

    /**
     * Record a failure which prevented the exchange from taking place.
     *
     * @param cause failure
     */
    void setFailure(final BOSHException cause) {
        failure = cause;
    }

    /**
     * Get the failure of the exchange.
     *
     * @return failure, or {@code null} if the exchange succeeded
     */
    BOSHException getFailure() {
        return failure;
    }

    /**
     * Get the HTTP status of the completed exchange.
     *
     * @return HTTP status
     */
    int getHTTPStatus() {
        return status;
    }

    /**
     * Get the response body of the completed exchange.
     *
     * @return response body, or {@code null} if the exchange failed before
     *  a response was read
     */
    byte[] getResponseBody() {
        return responseBody;
    }

}
