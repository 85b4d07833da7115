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
 * Classification of a {@code <body>} received from the connection manager.
 */
enum BodyType {

    /**
     * The body starts (or restarts) the XMPP stream.
     */
    STREAM_START,

    /**
     * The body terminates the session.
     */
    STREAM_END,

    /**
     * The body only carries stanzas, if anything.
     */
    NORMAL;

}
