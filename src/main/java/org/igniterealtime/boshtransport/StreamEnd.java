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
 * Stream closing tag ({@code </stream:stream>}).
 */
public final class StreamEnd extends XMLNode {

    /**
     * Element name being closed.
     */
    private final String name;

    /**
     * Create a new stream end for the conventional stream element name.
     */
    public StreamEnd() {
        this(StreamStart.STREAM_NAME);
    }

    /**
     * Create a new stream end.
     *
     * @param elemName name of the element being closed
     */
    public StreamEnd(final String elemName) {
        if (elemName == null) {
            throw(new IllegalArgumentException("Name may not be null"));
        }
        name = elemName;
    }

    /**
     * Get the name of the element being closed.
     *
     * @return name
     */
    public String getName() {
        return name;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public String toXML() {
        return "</" + name + ">";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean equals(final Object obj) {
        return obj instanceof StreamEnd
                && name.equals(((StreamEnd) obj).name);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int hashCode() {
        return name.hashCode();
    }

}
