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

import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Transport configuration tests.
 */
public class TransportConfigTest {

    @Test
    public void defaults() {
        TransportConfig cfg = TransportConfig.Builder.create().build();
        Endpoint endpoint = cfg.getEndpoint();
        assertEquals("localhost", endpoint.getHost());
        assertEquals(5280, endpoint.getPort());
        assertEquals("/http-bind", endpoint.getPath());
        assertNull(cfg.getProxyHost());
        assertEquals(0, cfg.getProxyPort());
        assertEquals("http://localhost:5280/http-bind",
                endpoint.toURI().toString());
    }

    @Test
    public void fromMapOverridesDefaults() {
        Map<String, Object> settings = new HashMap<String, Object>();
        settings.put("host", "x");
        settings.put("port", Integer.valueOf(1234));
        settings.put("unknown", "ignored");
        TransportConfig cfg = TransportConfig.fromMap(settings);
        assertEquals(new Endpoint("x", 1234, "/http-bind"),
                cfg.getEndpoint());
    }

    @Test
    public void fromMapAcceptsStrings() {
        Map<String, String> settings = new HashMap<String, String>();
        settings.put("port", "5281");
        settings.put("path", "/bosh");
        settings.put("proxyHost", "proxy");
        settings.put("proxyPort", "3128");
        TransportConfig cfg = TransportConfig.fromMap(settings);
        assertEquals(5281, cfg.getEndpoint().getPort());
        assertEquals("/bosh", cfg.getEndpoint().getPath());
        assertEquals("proxy", cfg.getProxyHost());
        assertEquals(3128, cfg.getProxyPort());
    }

    @Test
    public void nullMapYieldsDefaults() {
        assertEquals(TransportConfig.Builder.create().build().getEndpoint(),
                TransportConfig.fromMap(null).getEndpoint());
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidPortRejected() {
        Map<String, String> settings = new HashMap<String, String>();
        settings.put("port", "http");
        TransportConfig.fromMap(settings);
    }

    @Test(expected = IllegalArgumentException.class)
    public void relativePathRejected() {
        TransportConfig.Builder.create().setPath("http-bind");
    }

    @Test(expected = IllegalArgumentException.class)
    public void proxyHostWithoutPortRejected() {
        Map<String, String> settings = new HashMap<String, String>();
        settings.put("proxyHost", "proxy");
        TransportConfig.fromMap(settings);
    }

}
