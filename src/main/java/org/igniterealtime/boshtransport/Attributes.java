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
 * Qualified names of the attributes and namespaces used on BOSH
 * {@code <body>} wrapper elements and on the synthesized stream elements.
 */
final class Attributes {

    /**
     * Prevent instantiation.
     */
    private Attributes() {
        // Empty
    }

    /**
     * BOSH namespace URI.
     */
    static final String NS_HTTP_BIND = "http://jabber.org/protocol/httpbind";

    /**
     * XMPP over BOSH namespace URI (XEP-0206).
     */
    static final String NS_BOSH = "urn:xmpp:xbosh";

    /**
     * Client stream content namespace.
     */
    static final String NS_JABBER_CLIENT = "jabber:client";

    /**
     * Stream framing namespace.
     */
    static final String NS_XMPP_STREAMS = "http://etherx.jabber.org/streams";

    /**
     * Name of the wrapper element.
     */
    static final String BODY = "body";

    static final String CONTENT = "content";
    static final String FROM = "from";
    static final String HOLD = "hold";
    static final String LANG = "xml:lang";
    static final String RID = "rid";
    static final String SID = "sid";
    static final String TO = "to";
    static final String TYPE = "type";
    static final String VERSION = "version";
    static final String WAIT = "wait";
    static final String XMLNS = "xmlns";
    static final String XMLNS_STREAM = "xmlns:stream";
    static final String XMLNS_XMPP = "xmlns:xmpp";
    static final String XMPP_RESTART = "xmpp:restart";
    static final String XMPP_VERSION = "xmpp:version";

    /**
     * Value of the 'type' attribute used for session termination.
     */
    static final String TERMINATE = "terminate";

}
