/*
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
 * Handle to a BOSH session, as given to the session owner.  A transport is
 * an immutable value: it may be copied and shared between threads freely,
 * and all copies refer to the same session.  Operations which change the
 * session are posted to the session's processing thread and return
 * immediately, unless documented otherwise.
 * <p/>
 * The transport always carries plain, uncompressed XML.  Requests to
 * negotiate TLS or compression at the stream level are answered with
 * {@link CapabilityResult#NOT_SUPPORTED}.
 *
 * @see BOSHTransport#connect(TransportConfig, TransportListener)
 */
public final class Transport {

    /**
     * Connection manager location.
     */
    private final Endpoint endpoint;

    /**
     * Session this handle refers to.
     */
    private final BOSHSession session;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent construction apart from our package.
     */
    Transport(final Endpoint sessEndpoint, final BOSHSession sess) {
        endpoint = sessEndpoint;
        session = sess;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Public methods:

    /**
     * Get the connection manager location this transport talks to.
     *
     * @return endpoint
     */
    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Determines whether the stream is protected by stream-level TLS.
     *
     * @return always {@code false}
     */
    public boolean isTLS() {
        return false;
    }

    /**
     * Determines whether the stream is compressed.
     *
     * @return always {@code false}
     */
    public boolean isCompressed() {
        return false;
    }

    /**
     * Send an element to the connection manager.  A {@link StreamStart}
     * becomes a session creation (or, once the session ID is known, a stream
     * restart) request, a {@link StreamEnd} becomes a session termination
     * request, and anything else is carried as the only payload of an
     * ordinary request.  Elements are sent in call order, one per request.
     *
     * @param element element to send
     */
    public void send(final XMLNode element) {
        session.send(element);
    }

    /**
     * Send a complete, caller-built {@code <body>} as is.
     * <p/>
     * Watch out for request IDs!  The transport takes care of wrapping
     * elements passed to {@link #send(XMLNode)}, keeping track of request
     * and session IDs itself.  A body sent using this method carries
     * whatever request ID the caller put on it, while the transport's own
     * sequence advances by one.  Bodies built with {@link #getRID()} and
     * {@link #getSID()} immediately before sending stay consistent; anything
     * else will confuse the connection manager.  Avoid interleaving this
     * method with {@link #send(XMLNode)}.
     *
     * @param body body to send
     * @see BOSHBodies
     */
    public void sendRaw(final XMLElement body) {
        session.sendRaw(body);
    }

    /**
     * Determines whether the session is still running.  This says nothing
     * about whether the connection manager is reachable.
     *
     * @return {@code true} if the session is running, {@code false} otherwise
     */
    public boolean isConnected() {
        return session.isAlive();
    }

    /**
     * Replace the session's response parser with a fresh one, without
     * affecting the HTTP session.
     */
    public void resetParser() {
        session.resetParser();
    }

    /**
     * Terminate the session, sending a termination request to the
     * connection manager first.  Blocks until the session has processed the
     * request; requests already in flight are not cancelled.
     *
     * @return {@link StopResult#OK}, or {@link StopResult#ALREADY_STOPPED}
     *  if the session had already ended
     */
    public StopResult stop() {
        return session.stop();
    }

    /**
     * Request stream-level TLS.
     *
     * @return always {@link CapabilityResult#NOT_SUPPORTED}
     */
    public CapabilityResult upgradeToTLS() {
        return CapabilityResult.NOT_SUPPORTED;
    }

    /**
     * Request stream-level compression.
     *
     * @return always {@link CapabilityResult#NOT_SUPPORTED}
     */
    public CapabilityResult useZlib() {
        return CapabilityResult.NOT_SUPPORTED;
    }

    /**
     * Get the session ID assigned by the connection manager.
     *
     * @return session ID, or {@code null} if no response has been received
     */
    public String getSID() {
        return session.getSID();
    }

    /**
     * Get the request ID that the next request will carry.
     *
     * @return next request ID
     */
    public long getRID() {
        return session.getRID();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof Transport)) {
            return false;
        }
        Transport other = (Transport) obj;
        return session == other.session && endpoint.equals(other.endpoint);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return endpoint.hashCode() * 31 + System.identityHashCode(session);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        return "Transport[" + endpoint + "]";
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Get the session this handle refers to.
     *
     * @return session
     */
    BOSHSession getSession() {
        return session;
    }

}
