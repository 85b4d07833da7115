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

/**
 * BOSH transport configuration.  Instances of this class are immutable and
 * are created using the {@code Builder} or, for configuration held in a
 * generic key/value map, {@link #fromMap(Map)}:
 * <pre>
 * TransportConfig cfg = TransportConfig.Builder.create()
 *     .setHost("xmpp.example.com")
 *     .setPort(5280)
 *     .build();
 * </pre>
 * Any setting which is not provided falls back to its default: host
 * {@value #DEFAULT_HOST}, port {@value #DEFAULT_PORT} and path
 * {@value #DEFAULT_PATH}.
 */
public final class TransportConfig {

    /**
     * Default connection manager host.
     */
    public static final String DEFAULT_HOST = "localhost";

    /**
     * Default connection manager port.
     */
    public static final int DEFAULT_PORT = 5280;

    /**
     * Default BOSH service path.
     */
    public static final String DEFAULT_PATH = "/http-bind";

    /**
     * Map key of the host setting.
     */
    public static final String KEY_HOST = "host";

    /**
     * Map key of the port setting.
     */
    public static final String KEY_PORT = "port";

    /**
     * Map key of the path setting.
     */
    public static final String KEY_PATH = "path";

    /**
     * Map key of the proxy host setting.
     */
    public static final String KEY_PROXY_HOST = "proxyHost";

    /**
     * Map key of the proxy port setting.
     */
    public static final String KEY_PROXY_PORT = "proxyPort";

    /**
     * Connection manager location.
     */
    private final Endpoint endpoint;

    /**
     * Optional HTTP proxy host, or {@code null}.
     */
    private final String proxyHost;

    /**
     * Optional HTTP proxy port, or {@code 0}.
     */
    private final int proxyPort;

    ///////////////////////////////////////////////////////////////////////////
    // Classes:

    /**
     * Class instance builder, after the builder pattern.
     */
    public static final class Builder {
        private String bHost = DEFAULT_HOST;
        private int bPort = DEFAULT_PORT;
        private String bPath = DEFAULT_PATH;
        private String bProxyHost;
        private int bProxyPort;

        /**
         * Prevent direct construction.
         */
        private Builder() {
            // Empty
        }

        /**
         * Creates a new builder instance with all settings at their
         * defaults.
         *
         * @return builder instance
         */
        public static Builder create() {
            return new Builder();
        }

        /**
         * Set the connection manager host.
         *
         * @param host host name or address
         * @return builder instance
         */
        public Builder setHost(final String host) {
            if (host == null || host.trim().isEmpty()) {
                throw(new IllegalArgumentException("Host may not be empty"));
            }
            bHost = host;
            return this;
        }

        /**
         * Set the connection manager port.
         *
         * @param port TCP port
         * @return builder instance
         */
        public Builder setPort(final int port) {
            if (port <= 0 || port > 65535) {
                throw(new IllegalArgumentException(
                        "Port out of range: " + port));
            }
            bPort = port;
            return this;
        }

        /**
         * Set the HTTP path of the BOSH service.
         *
         * @param path request path, beginning with '/'
         * @return builder instance
         */
        public Builder setPath(final String path) {
            if (path == null || !path.startsWith("/")) {
                throw(new IllegalArgumentException(
                        "Path must begin with '/': " + path));
            }
            bPath = path;
            return this;
        }

        /**
         * Route all requests through the HTTP proxy specified.
         *
         * @param hostName proxy host name
         * @param port proxy port
         * @return builder instance
         */
        public Builder setProxy(final String hostName, final int port) {
            if (hostName == null || hostName.length() == 0) {
                throw(new IllegalArgumentException(
                        "Proxy host name cannot be null or empty"));
            }
            if (port <= 0) {
                throw(new IllegalArgumentException(
                        "Proxy port must be > 0"));
            }
            bProxyHost = hostName;
            bProxyPort = port;
            return this;
        }

        /**
         * Build the immutable configuration instance.
         *
         * @return configuration
         */
        public TransportConfig build() {
            return new TransportConfig(
                    new Endpoint(bHost, bPort, bPath),
                    bProxyHost,
                    bProxyPort);
        }

    }

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent direct construction.
     */
    private TransportConfig(
            final Endpoint cEndpoint,
            final String cProxyHost,
            final int cProxyPort) {
        endpoint = cEndpoint;
        proxyHost = cProxyHost;
        proxyPort = cProxyPort;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Public methods:

    /**
     * Create a configuration from a generic key/value map.  Recognized keys
     * are {@value #KEY_HOST}, {@value #KEY_PORT}, {@value #KEY_PATH},
     * {@value #KEY_PROXY_HOST} and {@value #KEY_PROXY_PORT}.  Values may be
     * strings or, for ports, numbers.  Unrecognized keys are ignored.
     *
     * @param settings settings to apply over the defaults
     * @return configuration
     */
    public static TransportConfig fromMap(final Map<String, ?> settings) {
        Builder builder = Builder.create();
        if (settings == null) {
            return builder.build();
        }
        Object host = settings.get(KEY_HOST);
        if (host != null) {
            builder.setHost(host.toString());
        }
        Object port = settings.get(KEY_PORT);
        if (port != null) {
            builder.setPort(toPort(KEY_PORT, port));
        }
        Object path = settings.get(KEY_PATH);
        if (path != null) {
            builder.setPath(path.toString());
        }
        Object proxyHost = settings.get(KEY_PROXY_HOST);
        if (proxyHost != null) {
            Object proxyPort = settings.get(KEY_PROXY_PORT);
            if (proxyPort == null) {
                throw(new IllegalArgumentException(
                        KEY_PROXY_HOST + " requires " + KEY_PROXY_PORT));
            }
            builder.setProxy(proxyHost.toString(),
                    toPort(KEY_PROXY_PORT, proxyPort));
        }
        return builder.build();
    }

    /**
     * Get the connection manager location.
     *
     * @return endpoint
     */
    public Endpoint getEndpoint() {
        return endpoint;
    }

    /**
     * Get the configured proxy host.
     *
     * @return proxy host name, or {@code null} if no proxy is used
     */
    public String getProxyHost() {
        return proxyHost;
    }

    /**
     * Get the configured proxy port.
     *
     * @return proxy port, or {@code 0} if no proxy is used
     */
    public int getProxyPort() {
        return proxyPort;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    private static int toPort(final String key, final Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException nfx) {
            throw(new IllegalArgumentException(
                    "Invalid " + key + ": " + value, nfx));
        }
    }

}
