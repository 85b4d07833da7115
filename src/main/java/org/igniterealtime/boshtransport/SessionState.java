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
 * Lifecycle states of a {@code BOSHSession}.
 */
enum SessionState {

    /**
     * Session resources are being allocated.
     */
    CONNECTING,

    /**
     * Session is exchanging messages with the connection manager.
     */
    ACTIVE,

    /**
     * Session termination has begun.
     */
    STOPPING,

    /**
     * Session has ended; no further requests are made and late responses are
     * discarded.
     */
    STOPPED;

}
