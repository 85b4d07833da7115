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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for the BOSH {@code <body>} wrapper elements.  These are used by
 * the session internally and are public so that callers of
 * {@link Transport#sendRaw(XMLElement)} can build protocol-correct bodies.
 */
public final class BOSHBodies {

    /**
     * Value of the 'content' attribute of session creation requests.
     */
    private static final String CONTENT_TYPE = "text/xml; charset=utf-8";

    /**
     * Stream version requested when none is specified.
     */
    static final String DEFAULT_VERSION = "1.0";

    /**
     * Stream language requested when none is specified.
     */
    static final String DEFAULT_LANG = "en";

    /**
     * Prevent instantiation.
     */
    private BOSHBodies() {
        // Empty
    }

    /**
     * Create a session creation request for a brand new session.
     *
     * @param rid request ID
     * @param to target domain
     * @return session creation body
     */
    public static XMLElement sessionCreationBody(
            final long rid, final String to) {
        return sessionCreationBody(
                DEFAULT_VERSION, DEFAULT_LANG, rid, to, null);
    }

    /**
     * Create a session creation request.  When a session ID is supplied the
     * request is marked as a stream restart of that session rather than the
     * creation of a new one.
     *
     * @param version requested XMPP version
     * @param lang stream language
     * @param rid request ID
     * @param to target domain
     * @param sid session ID, or {@code null} for a new session
     * @return session creation body
     */
    public static XMLElement sessionCreationBody(
            final String version,
            final String lang,
            final long rid,
            final String to,
            final String sid) {
        Map<String, String> extra = new LinkedHashMap<String, String>();
        extra.put(Attributes.CONTENT, CONTENT_TYPE);
        extra.put(Attributes.XMLNS_XMPP, Attributes.NS_BOSH);
        extra.put(Attributes.XMPP_VERSION, version);
        extra.put(Attributes.HOLD, "1");
        extra.put(Attributes.WAIT, "60");
        extra.put(Attributes.LANG, lang);
        extra.put(Attributes.TO, to);
        if (sid != null) {
            extra.put(Attributes.XMPP_RESTART, "true");
        }
        return emptyBody(rid, sid, extra);
    }

    /**
     * Create a session termination request, carrying unavailable presence.
     *
     * @param rid request ID
     * @param sid session ID, or {@code null} if not yet bound
     * @return session termination body
     */
    public static XMLElement sessionTerminationBody(
            final long rid, final String sid) {
        return emptyBody(rid, sid,
                Collections.singletonMap(Attributes.TYPE, Attributes.TERMINATE))
                .rebuild()
                .addChild(Stanzas.presence("unavailable"))
                .build();
    }

    /**
     * Create a body with no payload, used to poll the connection manager.
     *
     * @param rid request ID
     * @param sid session ID, or {@code null} if not yet bound
     * @return empty body
     */
    public static XMLElement emptyBody(final long rid, final String sid) {
        return emptyBody(rid, sid, Collections.<String, String>emptyMap());
    }

    /**
     * Create a body with no payload and additional attributes.  The common
     * attributes ({@code rid}, {@code xmlns} and, when bound, {@code sid})
     * come first, followed by the extra attributes in iteration order.
     *
     * @param rid request ID
     * @param sid session ID, or {@code null} to omit it
     * @param extraAttrs additional attributes
     * @return body element
     */
    public static XMLElement emptyBody(
            final long rid,
            final String sid,
            final Map<String, String> extraAttrs) {
        XMLElement.Builder builder = XMLElement.builder(Attributes.BODY)
                .setAttribute(Attributes.RID, packRID(rid))
                .setAttribute(Attributes.XMLNS, Attributes.NS_HTTP_BIND)
                .setAttribute(Attributes.SID, sid);
        for (Map.Entry<String, String> entry : extraAttrs.entrySet()) {
            builder.setAttribute(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Serialize a request ID for use on the wire.
     *
     * @param rid request ID
     * @return unsigned decimal representation
     */
    static String packRID(final long rid) {
        return Long.toString(rid);
    }

}
