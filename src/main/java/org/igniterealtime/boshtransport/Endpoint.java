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

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Location of a BOSH connection manager: host, port and HTTP path.
 * Instances are immutable and may be shared freely between threads.
 */
public final class Endpoint {

    /**
     * Host name or address.
     */
    private final String host;

    /**
     * TCP port.
     */
    private final int port;

    /**
     * HTTP request path.
     */
    private final String path;

    /**
     * Create a new endpoint.
     *
     * @param cmHost host name or address of the connection manager
     * @param cmPort TCP port of the connection manager
     * @param cmPath HTTP path of the BOSH service
     */
    public Endpoint(final String cmHost, final int cmPort, final String cmPath) {
        if (cmHost == null || cmHost.trim().isEmpty()) {
            throw(new IllegalArgumentException("Host may not be empty"));
        }
        if (cmPort <= 0 || cmPort > 65535) {
            throw(new IllegalArgumentException(
                    "Port out of range: " + cmPort));
        }
        if (cmPath == null || !cmPath.startsWith("/")) {
            throw(new IllegalArgumentException(
                    "Path must begin with '/': " + cmPath));
        }
        host = cmHost;
        port = cmPort;
        path = cmPath;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getPath() {
        return path;
    }

    /**
     * Get the plain HTTP URI of the endpoint.
     *
     * @return endpoint URI
     */
    public URI toURI() {
        try {
            return new URI("http", null, host, port, path, null, null);
        } catch (URISyntaxException urisx) {
            throw(new IllegalStateException(
                    "Endpoint does not form a valid URI: " + this, urisx));
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof Endpoint)) {
            return false;
        }
        Endpoint other = (Endpoint) obj;
        return port == other.port
                && host.equals(other.host)
                && path.equals(other.path);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return (host.hashCode() * 31 + port) * 31 + path.hashCode();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        return host + ":" + port + path;
    }

}
