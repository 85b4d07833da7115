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
 * Outcome of a request to negotiate a stream-level capability over the
 * transport.  BOSH carries plain, uncompressed XML; any TLS protecting the
 * HTTP connection itself is outside of the stream's control.
 */
public enum CapabilityResult {

    /**
     * The capability is not available over this transport.
     */
    NOT_SUPPORTED;

}
