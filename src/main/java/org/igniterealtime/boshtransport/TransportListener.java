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
 * Owner of a BOSH transport.  Every element unwrapped from a connection
 * manager response is delivered to the owner, in order, on the session's
 * processing thread.  Implementations should hand the element off quickly;
 * the session does not process further responses until the call returns.
 */
public interface TransportListener {

    /**
     * Called once for each element received from the connection manager.
     * Stream (re)starts and stream ends are delivered as {@link StreamStart}
     * and {@link StreamEnd} instances respectively.
     *
     * @param transport transport the element was received on
     * @param element received element
     */
    void stanzaReceived(Transport transport, XMLNode element);

    /**
     * Called once when the session ends because of an HTTP failure or an
     * unusable response.  No further calls will be made for this transport.
     *
     * @param transport transport which failed
     * @param cause reason for the failure
     */
    void sessionFailed(Transport transport, Throwable cause);

}
