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
 * Stream opening tag ({@code <stream:stream ...>}).  Unlike an
 * {@link XMLElement}, a stream start is never closed by itself; the stream
 * it opens is ended by a separate {@link StreamEnd}.
 */
public final class StreamStart extends XMLNode {

    /**
     * Conventional name of the stream element.
     */
    public static final String STREAM_NAME = "stream:stream";

    /**
     * Element name.
     */
    private final String name;

    /**
     * Attributes, in document order.
     */
    private final Map<String, String> attrs;

    /**
     * Create a new stream start using the conventional stream element name.
     *
     * @param attributes attributes of the opening tag, in order
     */
    public StreamStart(final Map<String, String> attributes) {
        this(STREAM_NAME, attributes);
    }

    /**
     * Create a new stream start.
     *
     * @param elemName element name
     * @param attributes attributes of the opening tag, in order
     */
    public StreamStart(
            final String elemName,
            final Map<String, String> attributes) {
        if (elemName == null) {
            throw(new IllegalArgumentException("Name may not be null"));
        }
        name = elemName;
        if (attributes == null) {
            attrs = Collections.emptyMap();
        } else {
            attrs = Collections.unmodifiableMap(
                    new LinkedHashMap<String, String>(attributes));
        }
    }

    /**
     * Get the element name.
     *
     * @return name
     */
    public String getName() {
        return name;
    }

    /**
     * Get the value of the named attribute.
     *
     * @param attrName qualified attribute name
     * @return value, or {@code null} if not present
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
     * {@inheritDoc}
     */
    @Override
    public String toXML() {
        StringBuilder builder = new StringBuilder();
        builder.append('<').append(name);
        appendAttributes(builder, attrs);
        builder.append('>');
        return builder.toString();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof StreamStart)) {
            return false;
        }
        StreamStart other = (StreamStart) obj;
        return name.equals(other.name) && attrs.equals(other.attrs);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return name.hashCode() * 31 + attrs.hashCode();
    }

}
