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

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for establishing BOSH transports.  A transport carries an
 * XMPP stream over a sequence of HTTP requests to a BOSH connection
 * manager:
 * <pre>
 * TransportConfig cfg = TransportConfig.Builder.create()
 *     .setHost("xmpp.example.com")
 *     .build();
 * Transport transport = BOSHTransport.connect(cfg, listener);
 * transport.send(Stanzas.streamStart("example.com"));
 * </pre>
 * No request is made until the first element is sent.  From then on, the
 * session keeps one request outstanding at the connection manager at all
 * times, so that elements pushed by the server are delivered to the
 * {@link TransportListener} as soon as they arrive.
 * <p/>
 * The HTTP client implementation is selected at runtime.  Apache HttpClient
 * is used by default; a system property named after the fully qualified
 * name of the {@code HTTPSender} interface may name another implementation
 * class to try first.
 */
public final class BOSHTransport {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(BOSHTransport.class.getName());

    /**
     * Prevent instantiation.
     */
    private BOSHTransport() {
        // Empty
    }

    /**
     * Start a new session using the default configuration.
     *
     * @param owner receiver of the elements delivered by the session
     * @return handle of the new session
     * @throws BOSHException if the session could not be started
     */
    public static Transport connect(final TransportListener owner)
            throws BOSHException {
        return connect(TransportConfig.Builder.create().build(), owner);
    }

    /**
     * Start a new session configured from a generic key/value map.
     *
     * @param settings settings, see {@link TransportConfig#fromMap(Map)}
     * @param owner receiver of the elements delivered by the session
     * @return handle of the new session
     * @throws BOSHException if the session could not be started
     */
    public static Transport connect(
            final Map<String, ?> settings,
            final TransportListener owner)
            throws BOSHException {
        return connect(TransportConfig.fromMap(settings), owner);
    }

    /**
     * Start a new session.
     *
     * @param cfg transport configuration
     * @param owner receiver of the elements delivered by the session
     * @return handle of the new session
     * @throws BOSHException if the session could not be started
     */
    public static Transport connect(
            final TransportConfig cfg,
            final TransportListener owner)
            throws BOSHException {
        if (cfg == null) {
            throw(new IllegalArgumentException(
                    "Configuration may not be null"));
        }
        if (owner == null) {
            throw(new IllegalArgumentException("Owner may not be null"));
        }
        HTTPSender sender;
        try {
            sender = ServiceLib.loadService(HTTPSender.class);
        } catch (IllegalStateException isx) {
            LOG.log(Level.WARNING, "No usable HTTP sender", isx);
            throw(new BOSHException("Could not load an HTTP sender", isx));
        }
        BOSHSession session = BOSHSession.start(
                cfg, owner, sender, DOMStreamParser.newParser());
        return session.getTransport();
    }

}
