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

import java.nio.charset.StandardCharsets;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Response parser tests.
 */
public class DOMStreamParserTest {

    private static byte[] bytes(final String xml) {
        return xml.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void qualifiedNamesAreKeptVerbatim() throws Exception {
        XMLStreamParser parser = DOMStreamParser.newParser();
        XMLElement body = parser.parse(bytes(
                "<body xmlns='http://jabber.org/protocol/httpbind'"
                + " xmlns:xmpp='urn:xmpp:xbosh' xmpp:version='1.0'"
                + " sid='abc123' from='localhost'>"
                + "<stream:features xmlns:stream="
                + "'http://etherx.jabber.org/streams'/>"
                + "</body>"));
        assertEquals("body", body.getName());
        assertEquals("1.0", body.getAttribute("xmpp:version"));
        assertEquals("urn:xmpp:xbosh", body.getAttribute("xmlns:xmpp"));
        assertEquals("http://jabber.org/protocol/httpbind",
                body.getAttribute("xmlns"));
        assertEquals("abc123", body.getAttribute("sid"));
        assertEquals(1, body.getChildren().size());
        assertEquals("stream:features",
                ((XMLElement) body.getChildren().get(0)).getName());
    }

    @Test
    public void nestedContentIsPreserved() throws Exception {
        XMLStreamParser parser = DOMStreamParser.newParser();
        XMLElement body = parser.parse(bytes(
                "<body><message to='bob@localhost'>"
                + "<body>1 &lt; 2</body></message></body>"));
        XMLElement msg = (XMLElement) body.getChildren().get(0);
        assertEquals("bob@localhost", msg.getAttribute("to"));
        assertEquals("<message to='bob@localhost'><body>1 &lt; 2</body>"
                + "</message>", msg.toXML());
    }

    @Test
    public void parserIsReusable() throws Exception {
        XMLStreamParser parser = DOMStreamParser.newParser();
        assertEquals("a", parser.parse(bytes("<a/>")).getName());
        assertEquals("b", parser.parse(bytes("<b/>")).getName());
    }

    @Test(expected = BOSHException.class)
    public void malformedInputIsRejected() throws Exception {
        DOMStreamParser.newParser().parse(bytes("<body><unclosed></body>"));
    }

    @Test(expected = BOSHException.class)
    public void doctypeIsRejected() throws Exception {
        DOMStreamParser.newParser().parse(bytes(
                "<!DOCTYPE body [<!ENTITY x 'y'>]><body>&x;</body>"));
    }

    @Test
    public void resetReplacesParser() throws Exception {
        XMLStreamParser parser = DOMStreamParser.newParser();
        XMLStreamParser fresh = parser.reset();
        assertNotSame(parser, fresh);
        assertEquals("a", fresh.parse(bytes("<a/>")).getName());
        try {
            parser.parse(bytes("<a/>"));
            fail("Replaced parser was still usable");
        } catch (IllegalStateException isx) {
            // Good.
        }
    }

}
