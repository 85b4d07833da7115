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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory methods for the handful of XMPP stream elements the transport
 * needs to create on its own, and which callers commonly pass to
 * {@link Transport#send(XMLNode)}.
 */
public final class Stanzas {

    /**
     * Prevent instantiation.
     */
    private Stanzas() {
        // Empty
    }

    /**
     * Create a client stream opening tag addressed to the given domain.
     *
     * @param to target domain
     * @return stream start
     */
    public static StreamStart streamStart(final String to) {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put(Attributes.TO, to);
        attrs.put(Attributes.VERSION, "1.0");
        attrs.put(Attributes.LANG, "en");
        attrs.put(Attributes.XMLNS, Attributes.NS_JABBER_CLIENT);
        attrs.put(Attributes.XMLNS_STREAM, Attributes.NS_XMPP_STREAMS);
        return new StreamStart(attrs);
    }

    /**
     * Create a stream closing tag.
     *
     * @return stream end
     */
    public static StreamEnd streamEnd() {
        return new StreamEnd();
    }

    /**
     * Create a presence stanza of the given type.
     *
     * @param type presence type, or {@code null} for available presence
     * @return presence element
     */
    public static XMLElement presence(final String type) {
        return XMLElement.builder("presence")
                .setAttribute(Attributes.TYPE, type)
                .setAttribute(Attributes.XMLNS, Attributes.NS_JABBER_CLIENT)
                .build();
    }

}
