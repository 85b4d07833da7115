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
 * Exception class used by the BOSH transport to indicate a failure to start
 * a session, a failed HTTP exchange with the connection manager, or a
 * connection manager response which could not be processed.
 */
public class BOSHException extends Exception {

    /**
     * Serial version UID.
     */
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception instance with the specified descriptive message.
     *
     * @param msg description of the exceptional condition
     */
    public BOSHException(final String msg) {
        super(msg);
    }

    /**
     * Creates a new exception instance with the specified descriptive
     * message and the underlying root cause of the exceptional condition.
     *
     * @param msg description of the exceptional condition
     * @param cause root cause or instigator of the condition
     */
    public BOSHException(final String msg, final Throwable cause) {
        super(msg, cause);
    }

}
