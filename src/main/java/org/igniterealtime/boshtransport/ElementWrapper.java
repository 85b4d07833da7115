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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates between XMPP stream elements and BOSH {@code <body>} wrappers.
 * All methods are pure functions of their arguments.
 */
final class ElementWrapper {

    /**
     * Target domain requested when the stream start does not name one.
     */
    private static final String DEFAULT_TO = "localhost";

    /**
     * Prevent instantiation.
     */
    private ElementWrapper() {
        // Empty
    }

    /**
     * Wrap an outgoing element into the body which carries it.
     *
     * @param node element to send
     * @param rid request ID of the request that will carry the body
     * @param sid session ID, or {@code null} if not yet bound
     * @return body to transmit
     */
    static XMLElement wrap(
            final XMLNode node, final long rid, final String sid) {
        if (node instanceof StreamStart) {
            StreamStart start = (StreamStart) node;
            return BOSHBodies.sessionCreationBody(
                    valueOr(start.getAttribute(Attributes.VERSION),
                            BOSHBodies.DEFAULT_VERSION),
                    valueOr(start.getAttribute(Attributes.LANG),
                            BOSHBodies.DEFAULT_LANG),
                    rid,
                    valueOr(start.getAttribute(Attributes.TO), DEFAULT_TO),
                    sid);
        }
        if (node instanceof StreamEnd) {
            return BOSHBodies.sessionTerminationBody(rid, sid);
        }
        return BOSHBodies.emptyBody(rid, sid)
                .rebuild()
                .addChild(node)
                .build();
    }

    /**
     * Unwrap a received body into the ordered list of elements it delivers.
     * A synthesized stream start or stream end, if any, comes first and is
     * followed by the body's children.  Whitespace-only character data
     * between elements is dropped.
     *
     * @param body received body
     * @return elements to deliver, in order
     */
    static List<XMLNode> unwrap(final XMLElement body) {
        List<XMLNode> result = new ArrayList<XMLNode>();
        switch (detectType(body)) {
        case STREAM_START:
            Map<String, String> attrs = new LinkedHashMap<String, String>();
            String from = body.getAttribute(Attributes.FROM);
            if (from != null) {
                attrs.put(Attributes.FROM, from);
            }
            attrs.put(Attributes.VERSION,
                    body.getAttribute(Attributes.XMPP_VERSION));
            attrs.put(Attributes.LANG, "en");
            attrs.put(Attributes.XMLNS, Attributes.NS_JABBER_CLIENT);
            attrs.put(Attributes.XMLNS_STREAM, Attributes.NS_XMPP_STREAMS);
            result.add(new StreamStart(attrs));
            break;
        case STREAM_END:
            result.add(Stanzas.streamEnd());
            break;
        default:
            break;
        }
        for (XMLNode child : body.getChildren()) {
            if (child instanceof XMLCData && ((XMLCData) child).isWhitespace()) {
                continue;
            }
            result.add(child);
        }
        return result;
    }

    /**
     * Classify a received body.  Termination takes precedence over a stream
     * (re)start.
     *
     * @param body received body
     * @return body classification
     */
    static BodyType detectType(final XMLElement body) {
        if (Attributes.TERMINATE.equals(body.getAttribute(Attributes.TYPE))) {
            return BodyType.STREAM_END;
        }
        if (body.getAttribute(Attributes.XMPP_VERSION) != null) {
            return BodyType.STREAM_START;
        }
        return BodyType.NORMAL;
    }

    /**
     * Determines if the element list contains a stream end.
     *
     * @param nodes elements to check
     * @return {@code true} if it does, {@code false} otherwise
     */
    static boolean containsStreamEnd(final List<XMLNode> nodes) {
        for (XMLNode node : nodes) {
            if (node instanceof StreamEnd) {
                return true;
            }
        }
        return false;
    }

    private static String valueOr(final String value, final String def) {
        return value == null ? def : value;
    }

}
