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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * {@code XMLStreamParser} implementation backed by the JDK DOM parser.
 * Namespace processing is disabled so that qualified attribute names and
 * namespace declarations are reported exactly as they appear on the wire.
 */
final class DOMStreamParser implements XMLStreamParser {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(DOMStreamParser.class.getName());

    /**
     * Underlying document builder, or {@code null} once freed.
     */
    private DocumentBuilder builder;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent direct construction.
     */
    private DOMStreamParser(final DocumentBuilder docBuilder) {
        builder = docBuilder;
    }

    /**
     * Create a new parser instance.
     *
     * @return parser
     * @throws BOSHException if no suitable parser could be configured
     */
    static DOMStreamParser newParser() throws BOSHException {
        try {
            DocumentBuilderFactory factory =
                    DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(
                    "http://apache.org/xml/features/disallow-doctype-decl",
                    true);
            return new DOMStreamParser(factory.newDocumentBuilder());
        } catch (ParserConfigurationException pcx) {
            throw(new BOSHException("Could not create XML parser", pcx));
        }
    }

    ///////////////////////////////////////////////////////////////////////////
    // XMLStreamParser interface methods:

    /**
     * {@inheritDoc}
     */
    public XMLElement parse(final byte[] data) throws BOSHException {
        if (builder == null) {
            throw(new IllegalStateException("Parser has been freed"));
        }
        try {
            Document doc = builder.parse(new ByteArrayInputStream(data));
            return toElement(doc.getDocumentElement());
        } catch (SAXException saxx) {
            throw(new BOSHException("Could not parse response", saxx));
        } catch (IOException iox) {
            throw(new BOSHException("Could not read response", iox));
        } finally {
            builder.reset();
        }
    }

    /**
     * {@inheritDoc}
     */
    public XMLStreamParser reset() throws BOSHException {
        if (builder == null) {
            throw(new BOSHException("Cannot reset a freed parser"));
        }
        DOMStreamParser replacement = newParser();
        free();
        LOG.log(Level.FINEST, "Parser reset");
        return replacement;
    }

    /**
     * {@inheritDoc}
     */
    public void free() {
        builder = null;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    /**
     * Convert a DOM element into an immutable element tree.
     *
     * @param elem DOM element
     * @return converted element
     */
    private static XMLElement toElement(final Element elem) {
        XMLElement.Builder result = XMLElement.builder(elem.getTagName());
        NamedNodeMap attrs = elem.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            result.setAttribute(attr.getNodeName(), attr.getNodeValue());
        }
        NodeList children = elem.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            switch (child.getNodeType()) {
            case Node.ELEMENT_NODE:
                result.addChild(toElement((Element) child));
                break;
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                result.addText(child.getNodeValue());
                break;
            default:
                // Comments and processing instructions are not delivered
                break;
            }
        }
        return result.build();
    }

}
