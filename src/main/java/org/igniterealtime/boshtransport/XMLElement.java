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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable XML element.  Attributes are kept in insertion order and are
 * addressed by their qualified name exactly as written on the wire (for
 * example {@code xml:lang} or {@code xmlns:xmpp}), including namespace
 * declarations.  Instances are created using the {@code Builder}:
 * <pre>
 * XMLElement presence = XMLElement.builder("presence")
 *     .setAttribute("type", "unavailable")
 *     .build();
 * </pre>
 */
public final class XMLElement extends XMLNode {

    /**
     * Element name.
     */
    private final String name;

    /**
     * Attributes, in document order.
     */
    private final Map<String, String> attrs;

    /**
     * Child nodes, in document order.
     */
    private final List<XMLNode> children;

    ///////////////////////////////////////////////////////////////////////////
    // Classes:

    /**
     * Class instance builder, after the builder pattern.  This allows every
     * {@code XMLElement} instance to be immutable while providing a
     * convenient mechanism for creating them.
     */
    public static final class Builder {
        private String name;
        private Map<String, String> map;
        private List<XMLNode> list;
        private boolean doMapCopy;
        private boolean doListCopy;

        /**
         * Prevent direct construction.
         */
        private Builder() {
            // Empty
        }

        /**
         * Creates a builder which is initialized to the values of the
         * provided {@code XMLElement} instance.
         *
         * @param source existing element to copy data from
         * @return builder instance
         */
        private static Builder fromElement(final XMLElement source) {
            Builder result = new Builder();
            result.name = source.name;
            result.map = source.attrs;
            result.doMapCopy = true;
            result.list = source.children;
            result.doListCopy = true;
            return result;
        }

        /**
         * Set an attribute on the element.  Setting a value of {@code null}
         * removes the attribute.
         *
         * @param attrName qualified attribute name
         * @param value attribute value, or {@code null} to remove
         * @return builder instance
         */
        public Builder setAttribute(
                final String attrName, final String value) {
            if (attrName == null) {
                throw(new IllegalArgumentException(
                        "Attribute name may not be null"));
            }
            if (map == null) {
                map = new LinkedHashMap<String, String>();
            } else if (doMapCopy) {
                map = new LinkedHashMap<String, String>(map);
                doMapCopy = false;
            }
            if (value == null) {
                map.remove(attrName);
            } else {
                map.put(attrName, value);
            }
            return this;
        }

        /**
         * Append a child node.
         *
         * @param child node to append
         * @return builder instance
         */
        public Builder addChild(final XMLNode child) {
            if (child == null) {
                throw(new IllegalArgumentException("Child may not be null"));
            }
            if (list == null) {
                list = new ArrayList<XMLNode>();
            } else if (doListCopy) {
                list = new ArrayList<XMLNode>(list);
                doListCopy = false;
            }
            list.add(child);
            return this;
        }

        /**
         * Append character data as a child node.
         *
         * @param text unescaped text to append
         * @return builder instance
         */
        public Builder addText(final String text) {
            return addChild(new XMLCData(text));
        }

        /**
         * Remove all child nodes.
         *
         * @return builder instance
         */
        public Builder clearChildren() {
            list = null;
            doListCopy = false;
            return this;
        }

        /**
         * Build the immutable element instance.
         *
         * @return new element instance
         */
        public XMLElement build() {
            Map<String, String> attrMap;
            if (map == null) {
                attrMap = Collections.emptyMap();
            } else {
                attrMap = Collections.unmodifiableMap(
                        new LinkedHashMap<String, String>(map));
            }
            List<XMLNode> childList;
            if (list == null) {
                childList = Collections.emptyList();
            } else {
                childList = Collections.unmodifiableList(
                        new ArrayList<XMLNode>(list));
            }
            return new XMLElement(name, attrMap, childList);
        }

    }

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Prevent direct construction.
     */
    private XMLElement(
            final String elemName,
            final Map<String, String> attrMap,
            final List<XMLNode> childList) {
        name = elemName;
        attrs = attrMap;
        children = childList;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Public methods:

    /**
     * Obtain a builder for a new element with the given name.
     *
     * @param elemName qualified element name
     * @return builder instance
     */
    public static Builder builder(final String elemName) {
        if (elemName == null || elemName.length() == 0) {
            throw(new IllegalArgumentException(
                    "Element name may not be empty"));
        }
        Builder result = new Builder();
        result.name = elemName;
        return result;
    }

    /**
     * If this element is to be used as a template for another, this method
     * returns a builder pre-populated with this element's name, attributes
     * and children.
     *
     * @return builder instance
     */
    public Builder rebuild() {
        return Builder.fromElement(this);
    }

    /**
     * Get the qualified name of the element.
     *
     * @return element name
     */
    public String getName() {
        return name;
    }

    /**
     * Get the value of the named attribute.
     *
     * @param attrName qualified attribute name
     * @return attribute value, or {@code null} if not present
     */
    public String getAttribute(final String attrName) {
        return attrs.get(attrName);
    }

    /**
     * Get all attributes in document order.
     *
     * @return unmodifiable attribute map
     */
    public Map<String, String> getAttributes() {
        return attrs;
    }

    /**
     * Get all child nodes in document order.
     *
     * @return unmodifiable list of children
     */
    public List<XMLNode> getChildren() {
        return children;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toXML() {
        StringBuilder builder = new StringBuilder();
        builder.append('<').append(name);
        appendAttributes(builder, attrs);
        if (children.isEmpty()) {
            builder.append("/>");
        } else {
            builder.append('>');
            for (XMLNode child : children) {
                builder.append(child.toXML());
            }
            builder.append("</").append(name).append('>');
        }
        return builder.toString();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof XMLElement)) {
            return false;
        }
        XMLElement other = (XMLElement) obj;
        return name.equals(other.name)
                && attrs.equals(other.attrs)
                && children.equals(other.children);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + attrs.hashCode()) * 31
                + children.hashCode();
    }

}
