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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@code HTTPSender} which holds every request until the test
 * answers it, allowing the session to be driven one exchange at a time.
 */
public class StubHTTPSender implements HTTPSender {

    private final BlockingQueue<StubHTTPResponse> requests =
            new LinkedBlockingQueue<StubHTTPResponse>();
    private final List<XMLElement> sent = new ArrayList<XMLElement>();
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicInteger destroyCount = new AtomicInteger();
    private volatile BOSHException initFailure;

    ///////////////////////////////////////////////////////////////////////////
    // HTTPSender interface methods:

    public void init(final TransportConfig cfg) throws BOSHException {
        if (initFailure != null) {
            throw(initFailure);
        }
        initialized.set(true);
    }

    public void destroy() {
        destroyCount.incrementAndGet();
    }

    public HTTPResponse send(final XMLElement body) {
        StubHTTPResponse resp = new StubHTTPResponse(body);
        synchronized (sent) {
            sent.add(body);
        }
        requests.add(resp);
        return resp;
    }

    ///////////////////////////////////////////////////////////////////////////
    // Public methods:

    public void failInitWith(final BOSHException cause) {
        initFailure = cause;
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public int getDestroyCount() {
        return destroyCount.get();
    }

    /**
     * Wait for the next request sent by the session.
     *
     * @return request awaiting a response
     */
    public StubHTTPResponse awaitRequest() throws InterruptedException {
        StubHTTPResponse resp = requests.poll(5, TimeUnit.SECONDS);
        if (resp == null) {
            throw(new AssertionError("No request was sent"));
        }
        return resp;
    }

    /**
     * Wait briefly for a request which is not expected to be sent.
     *
     * @param millis time to wait
     * @return request, or {@code null} if none was sent
     */
    public StubHTTPResponse pollRequest(final long millis)
            throws InterruptedException {
        return requests.poll(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Get all bodies sent so far, in order.
     *
     * @return sent bodies
     */
    public List<XMLElement> getSentBodies() {
        synchronized (sent) {
            return new ArrayList<XMLElement>(sent);
        }
    }

}
