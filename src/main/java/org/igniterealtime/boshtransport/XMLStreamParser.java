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
 * Parser used by a session to turn connection manager responses into
 * element trees.  A parser instance is owned by exactly one session and is
 * only ever used from that session's processing thread.
 */
interface XMLStreamParser {

    /**
     * Parse a complete response document.
     *
     * @param data raw response bytes
     * @return root element of the document
     * @throws BOSHException if the data is not well-formed XML
     */
    XMLElement parse(byte[] data) throws BOSHException;

    /**
     * Discard this parser and obtain one ready to parse a fresh stream.
     * The instance this method is called on must not be used afterwards.
     *
     * @return replacement parser
     * @throws BOSHException if no replacement parser could be created
     */
    XMLStreamParser reset() throws BOSHException;

    /**
     * Release all resources held by the parser.  The parser may not be used
     * after this method is called.
     */
    void free();

}
