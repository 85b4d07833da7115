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
import java.util.List;
import java.util.Map;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Wrapping and unwrapping of stream elements.
 */
public class ElementWrapperTest {

    private static final String NS_HTTP_BIND =
            "http://jabber.org/protocol/httpbind";

    @Test
    public void bareStreamStartUsesDefaults() {
        StreamStart start = new StreamStart(
                Collections.<String, String>emptyMap());
        XMLElement body = ElementWrapper.wrap(start, 1000L, null);
        assertEquals("1000", body.getAttribute("rid"));
        assertEquals("1.0", body.getAttribute("xmpp:version"));
        assertEquals("en", body.getAttribute("xml:lang"));
        assertEquals("localhost", body.getAttribute("to"));
        assertNull(body.getAttribute("sid"));
        assertNull(body.getAttribute("xmpp:restart"));
    }

    @Test
    public void streamStartAttributesAreCarried() {
        Map<String, String> attrs = new LinkedHashMap<String, String>();
        attrs.put("to", "example.com");
        attrs.put("version", "1.1");
        attrs.put("xml:lang", "de");
        XMLElement body = ElementWrapper.wrap(
                new StreamStart(attrs), 5L, null);
        assertEquals("example.com", body.getAttribute("to"));
        assertEquals("1.1", body.getAttribute("xmpp:version"));
        assertEquals("de", body.getAttribute("xml:lang"));
    }

    @Test
    public void streamStartWithBoundSidIsRestart() {
        XMLElement body = ElementWrapper.wrap(
                Stanzas.streamStart("localhost"), 6L, "abc123");
        assertEquals("abc123", body.getAttribute("sid"));
        assertEquals("true", body.getAttribute("xmpp:restart"));
    }

    @Test
    public void streamEndWrapsIntoTermination() {
        XMLElement body = ElementWrapper.wrap(Stanzas.streamEnd(), 8L, "s1");
        assertEquals(BOSHBodies.sessionTerminationBody(8L, "s1"), body);
    }

    @Test
    public void stanzaIsOnlyChild() {
        XMLElement msg = XMLElement.builder("message")
                .setAttribute("to", "bob@localhost")
                .build();
        XMLElement body = ElementWrapper.wrap(msg, 9L, "s1");
        assertEquals("9", body.getAttribute("rid"));
        assertEquals("s1", body.getAttribute("sid"));
        assertEquals(NS_HTTP_BIND, body.getAttribute("xmlns"));
        assertEquals(Collections.singletonList(msg), body.getChildren());
    }

    @Test
    public void unwrapNormalBodyYieldsChildren() {
        XMLElement msg = XMLElement.builder("message").build();
        XMLElement iq = XMLElement.builder("iq").build();
        XMLElement body = XMLElement.builder("body")
                .setAttribute("xmlns", NS_HTTP_BIND)
                .addText("\n  ")
                .addChild(msg)
                .addText(" ")
                .addChild(iq)
                .build();
        assertEquals(BodyType.NORMAL, ElementWrapper.detectType(body));
        List<XMLNode> nodes = ElementWrapper.unwrap(body);
        assertEquals(2, nodes.size());
        assertSame(msg, nodes.get(0));
        assertSame(iq, nodes.get(1));
    }

    @Test
    public void unwrapStreamStartSynthesizesOpener() {
        XMLElement features = XMLElement.builder("stream:features").build();
        XMLElement body = XMLElement.builder("body")
                .setAttribute("sid", "abc123")
                .setAttribute("from", "localhost")
                .setAttribute("xmpp:version", "1.0")
                .addChild(features)
                .build();
        assertEquals(BodyType.STREAM_START, ElementWrapper.detectType(body));
        List<XMLNode> nodes = ElementWrapper.unwrap(body);
        assertEquals(2, nodes.size());
        StreamStart start = (StreamStart) nodes.get(0);
        assertEquals("stream:stream", start.getName());
        assertEquals("localhost", start.getAttribute("from"));
        assertEquals("1.0", start.getAttribute("version"));
        assertEquals("en", start.getAttribute("xml:lang"));
        assertEquals("jabber:client", start.getAttribute("xmlns"));
        assertEquals("http://etherx.jabber.org/streams",
                start.getAttribute("xmlns:stream"));
        assertSame(features, nodes.get(1));
    }

    @Test
    public void unwrapStreamStartWithoutFrom() {
        XMLElement body = XMLElement.builder("body")
                .setAttribute("xmpp:version", "1.0")
                .build();
        StreamStart start = (StreamStart) ElementWrapper.unwrap(body).get(0);
        assertFalse(start.getAttributes().containsKey("from"));
    }

    @Test
    public void terminationTakesPrecedence() {
        XMLElement body = XMLElement.builder("body")
                .setAttribute("type", "terminate")
                .setAttribute("xmpp:version", "1.0")
                .addChild(Stanzas.presence("unavailable"))
                .build();
        assertEquals(BodyType.STREAM_END, ElementWrapper.detectType(body));
        List<XMLNode> nodes = ElementWrapper.unwrap(body);
        assertEquals(2, nodes.size());
        assertTrue(nodes.get(0) instanceof StreamEnd);
        assertTrue(ElementWrapper.containsStreamEnd(nodes));
    }

    /*
     * The stream start synthesized from the reply to a bare stream start
     * carries the same version and language the request defaulted to.
     */
    @Test
    public void defaultsSurviveRequestReplyCycle() {
        XMLElement request = ElementWrapper.wrap(
                new StreamStart(Collections.<String, String>emptyMap()),
                1L, null);
        XMLElement reply = XMLElement.builder("body")
                .setAttribute("sid", "abc123")
                .setAttribute("from", request.getAttribute("to"))
                .setAttribute("xmpp:version",
                        request.getAttribute("xmpp:version"))
                .build();
        StreamStart start = (StreamStart) ElementWrapper.unwrap(reply).get(0);
        assertEquals("1.0", start.getAttribute("version"));
        assertEquals(request.getAttribute("xml:lang"),
                start.getAttribute("xml:lang"));
        assertEquals("localhost", start.getAttribute("from"));
    }

}
