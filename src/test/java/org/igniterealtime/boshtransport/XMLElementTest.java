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
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Element model tests.
 */
public class XMLElementTest {

    @Test
    public void testImmutableMap() {
        XMLElement elem = XMLElement.builder("message")
                .setAttribute("to", "alice@localhost")
                .build();
        Map<String, String> map = elem.getAttributes();
        try {
            map.put("foo", "bar");
            fail("Attributes map is not write-protected");
        } catch (UnsupportedOperationException uox) {
            // Good.
        }
    }

    @Test
    public void rebuildDoesNotAffectOriginal() {
        XMLElement orig = XMLElement.builder("body")
                .setAttribute("rid", "1")
                .build();
        XMLElement copy = orig.rebuild()
                .setAttribute("sid", "abc")
                .addText("hi")
                .build();
        assertNull(orig.getAttribute("sid"));
        assertTrue(orig.getChildren().isEmpty());
        assertEquals("abc", copy.getAttribute("sid"));
        assertEquals("1", copy.getAttribute("rid"));
        assertEquals(1, copy.getChildren().size());
    }

    @Test
    public void nullValueRemovesAttribute() {
        XMLElement elem = XMLElement.builder("body")
                .setAttribute("sid", "abc")
                .setAttribute("sid", null)
                .build();
        assertFalse(elem.getAttributes().containsKey("sid"));
    }

    @Test
    public void attributesKeepInsertionOrder() {
        XMLElement elem = XMLElement.builder("body")
                .setAttribute("rid", "1")
                .setAttribute("xmlns", "urn:a")
                .setAttribute("hold", "1")
                .build();
        assertEquals("<body rid='1' xmlns='urn:a' hold='1'/>", elem.toXML());
    }

    @Test
    public void serializationEscapesContent() {
        XMLElement elem = XMLElement.builder("message")
                .setAttribute("to", "a'b")
                .addChild(XMLElement.builder("body")
                        .addText("1 < 2 & \"3\"")
                        .build())
                .build();
        assertEquals("<message to='a&apos;b'><body>1 &lt; 2 &amp; "
                + "&quot;3&quot;</body></message>", elem.toXML());
    }

    @Test
    public void streamFramingRendersUnbalancedTags() {
        assertEquals("</stream:stream>", Stanzas.streamEnd().toXML());
        String start = Stanzas.streamStart("localhost").toXML();
        assertTrue(start, start.startsWith("<stream:stream to='localhost'"));
        assertTrue(start, start.endsWith("'>"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyNameRejected() {
        XMLElement.builder("");
    }

}
