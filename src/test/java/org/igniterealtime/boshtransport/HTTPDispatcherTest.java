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

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Request dispatch and sender lifetime.
 */
public class HTTPDispatcherTest {

    private StubHTTPSender sender;
    private HTTPDispatcher dispatcher;
    private final BlockingQueue<HTTPExchange> completed =
            new LinkedBlockingQueue<HTTPExchange>();

    @Before
    public void setup() {
        sender = new StubHTTPSender();
        dispatcher = new HTTPDispatcher(sender,
                new HTTPDispatcher.CompletionHandler() {
                    public void exchangeCompleted(final HTTPExchange exch) {
                        completed.add(exch);
                    }
                }, "HTTPDispatcherTest");
    }

    @Test(timeout=5000)
    public void completedExchangeCarriesResponse() throws Exception {
        HTTPExchange exch = new HTTPExchange(BOSHBodies.emptyBody(42L, "s"));
        assertTrue(dispatcher.dispatch(exch));
        StubHTTPResponse resp = sender.awaitRequest();
        assertEquals(42L, resp.getRequestRID());
        assertEquals(1, dispatcher.getInFlightCount());
        resp.respond(200, "<body/>");

        HTTPExchange done = completed.poll(5, TimeUnit.SECONDS);
        assertSame(exch, done);
        assertNull(done.getFailure());
        assertEquals(200, done.getHTTPStatus());
        assertEquals("<body/>", new String(done.getResponseBody(), "UTF-8"));
        assertEquals("42", done.getRequestRID());
    }

    @Test(timeout=5000)
    public void errorStatusBecomesFailure() throws Exception {
        dispatcher.dispatch(new HTTPExchange(BOSHBodies.emptyBody(1L, null)));
        sender.awaitRequest().respond(404, "");
        HTTPExchange done = completed.poll(5, TimeUnit.SECONDS);
        assertEquals(404, done.getHTTPStatus());
        assertNotNull(done.getFailure());
    }

    @Test(timeout=5000)
    public void transportFailureIsRecorded() throws Exception {
        BOSHException cause = new BOSHException("Connection reset");
        dispatcher.dispatch(new HTTPExchange(BOSHBodies.emptyBody(1L, null)));
        sender.awaitRequest().fail(cause);
        assertSame(cause, completed.poll(5, TimeUnit.SECONDS).getFailure());
    }

    @Test(timeout=5000)
    public void senderDestroyedAfterInFlightDrains() throws Exception {
        dispatcher.dispatch(new HTTPExchange(BOSHBodies.emptyBody(1L, null)));
        StubHTTPResponse resp = sender.awaitRequest();
        dispatcher.shutdown();
        assertEquals(0, sender.getDestroyCount());
        assertFalse(dispatcher.dispatch(
                new HTTPExchange(BOSHBodies.emptyBody(2L, null))));

        resp.respond(200, "<body/>");
        assertNotNull(completed.poll(5, TimeUnit.SECONDS));
        while (dispatcher.getInFlightCount() > 0
                || sender.getDestroyCount() == 0) {
            Thread.sleep(10);
        }
        assertEquals(1, sender.getDestroyCount());
        dispatcher.shutdown();
        assertEquals(1, sender.getDestroyCount());
        assertEquals(1, sender.getSentBodies().size());
    }

    @Test(timeout=5000)
    public void requestsIssuedOnCallingThread() throws Exception {
        for (long rid = 10; rid < 60; rid++) {
            dispatcher.dispatch(new HTTPExchange(BOSHBodies.emptyBody(rid, "s")));
            assertEquals(rid - 9, sender.getSentBodies().size());
        }
        for (long rid = 10; rid < 60; rid++) {
            assertEquals(rid, sender.awaitRequest().getRequestRID());
        }
        assertEquals(50, dispatcher.getInFlightCount());
    }

    @Test(timeout=5000)
    public void senderFailureReportedAsCompletion() throws Exception {
        HTTPDispatcher failing = new HTTPDispatcher(new StubHTTPSender() {
            @Override
            public HTTPResponse send(final XMLElement body) {
                throw(new IllegalStateException("Sender is not initialized"));
            }
        }, new HTTPDispatcher.CompletionHandler() {
            public void exchangeCompleted(final HTTPExchange exch) {
                completed.add(exch);
            }
        }, "failing");
        assertTrue(failing.dispatch(
                new HTTPExchange(BOSHBodies.emptyBody(3L, null))));
        HTTPExchange done = completed.poll(5, TimeUnit.SECONDS);
        assertNotNull(done.getFailure());
        assertTrue(done.getFailure().getCause()
                instanceof IllegalStateException);
    }

    @Test
    public void idleShutdownDestroysImmediately() {
        dispatcher.shutdown();
        assertEquals(1, sender.getDestroyCount());
    }

    @Test(expected = IllegalStateException.class)
    public void responseMaySetOnlyOnce() {
        XMLElement body = BOSHBodies.emptyBody(1L, null);
        HTTPExchange exch = new HTTPExchange(body);
        exch.setHTTPResponse(new StubHTTPResponse(body));
        exch.setHTTPResponse(new StubHTTPResponse(body));
    }

}
