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
 * Character data appearing as a child of an {@link XMLElement}.
 */
public final class XMLCData extends XMLNode {

    /**
     * Unescaped character content.
     */
    private final String text;

    /**
     * Create a new character data node.
     *
     * @param content unescaped text
     */
    public XMLCData(final String content) {
        if (content == null) {
            throw(new IllegalArgumentException("Content may not be null"));
        }
        text = content;
    }

    /**
     * Get the unescaped character content.
     *
     * @return text
     */
    public String getText() {
        return text;
    }

    /**
     * Determines whether this node holds nothing but whitespace.
     *
     * @return {@code true} if it does, {@code false} otherwise
     */
    public boolean isWhitespace() {
        return text.trim().isEmpty();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toXML() {
        return escape(text);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof XMLCData)) {
            return false;
        }
        return text.equals(((XMLCData) obj).text);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return text.hashCode();
    }

}
