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

/**
 * A single unit of XML exchanged with the stream owner: an element, a run of
 * character data, or one of the two stream framing markers.
 */
public abstract class XMLNode {

    /**
     * Restrict subclassing to this package.
     */
    XMLNode() {
        // Empty
    }

    /**
     * Render this node as XML text.
     *
     * @return XML representation of the node
     */
    public abstract String toXML();

    /**
     * {@inheritDoc}
     */
    @Override
    public String toString() {
        return toXML();
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Escape a string for use as XML character data.
     *
     * @param str string to escape
     * @return escaped string
     */
    static String escape(final String str) {
        StringBuilder builder = new StringBuilder(str.length());
        for (int i = 0; i < str.length(); i++) {
            char ch = str.charAt(i);
            switch (ch) {
            case '&':
                builder.append("&amp;");
                break;
            case '<':
                builder.append("&lt;");
                break;
            case '>':
                builder.append("&gt;");
                break;
            case '"':
                builder.append("&quot;");
                break;
            case '\'':
                builder.append("&apos;");
                break;
            default:
                builder.append(ch);
            }
        }
        return builder.toString();
    }

    /**
     * Append an attribute list, in order, to the builder provided.
     *
     * @param builder target
     * @param attrs attributes to render
     */
    static void appendAttributes(
            final StringBuilder builder,
            final Map<String, String> attrs) {
        for (Map.Entry<String, String> entry : attrs.entrySet()) {
            builder.append(' ')
                    .append(entry.getKey())
                    .append("='")
                    .append(escape(entry.getValue()))
                    .append('\'');
        }
    }

}
