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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Request ID sequence generator.  The initial value is derived from the wall
 * clock in microseconds so that a restarted client does not reuse request
 * IDs of a previous run.  Initial values handed out within a single JVM are
 * strictly increasing, even when two sequences are created within the same
 * microsecond.
 * <p/>
 * Instances of this class are not thread-safe; a sequence is owned by a
 * single session processing thread.
 */
final class RequestIDSequence {

    /**
     * Microseconds per millisecond.
     */
    private static final long MICROS_PER_MILLI = 1000L;

    /**
     * Highest initial value handed out so far, JVM-wide.
     */
    private static final AtomicLong LAST_SEED = new AtomicLong();

    /**
     * Next request ID to hand out.
     */
    private long nextRID;

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Create a new request ID sequence.
     */
    RequestIDSequence() {
        nextRID = generateInitialValue();
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Obtain the next request ID in the sequence, consuming it.
     *
     * @return request ID
     */
    long getNextRID() {
        return nextRID++;
    }

    /**
     * Get the request ID which the next request will use, without
     * consuming it.
     *
     * @return next request ID
     */
    long peekNextRID() {
        return nextRID;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    /**
     * Generates an initial RID value from the current time.
     *
     * @return initial value to use for the sequence
     */
    private static long generateInitialValue() {
        long now = System.currentTimeMillis() * MICROS_PER_MILLI
                + Math.floorMod(System.nanoTime() / MICROS_PER_MILLI, MICROS_PER_MILLI);
        while (true) {
            long last = LAST_SEED.get();
            long candidate = Math.max(now, last + 1);
            if (LAST_SEED.compareAndSet(last, candidate)) {
                return candidate;
            }
        }
    }

}
