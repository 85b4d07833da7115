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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Issues each request body as an independent HTTP exchange and reports
 * every completion, successful or not, to a {@code CompletionHandler}.
 * Requests are handed to the {@code HTTPSender} on the calling thread, so
 * they are issued in the order {@link #dispatch(HTTPExchange)} is called.
 * Only the wait for the outcome runs on a worker thread, so the caller never
 * blocks on network I/O.
 * <p/>
 * Once shut down, no further exchanges are accepted.  Exchanges already in
 * flight are allowed to finish, after which the underlying
 * {@code HTTPSender} is destroyed.
 */
final class HTTPDispatcher {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(HTTPDispatcher.class.getName());

    /**
     * Receiver of exchange completions.
     */
    interface CompletionHandler {

        /**
         * Called on a worker thread once the exchange has completed.
         *
         * @param exch completed exchange
         */
        void exchangeCompleted(HTTPExchange exch);

    }

    /**
     * Sender used to perform the exchanges.
     */
    private final HTTPSender sender;

    /**
     * Completion receiver.
     */
    private final CompletionHandler handler;

    /**
     * Worker threads.
     */
    private final ExecutorService executor;

    /**
     * Number of exchanges currently in flight.
     */
    private final AtomicInteger inFlight = new AtomicInteger();

    /**
     * Set once no further exchanges are to be accepted.
     */
    private final AtomicBoolean shutdown = new AtomicBoolean();

    /**
     * Set once the sender has been destroyed.
     */
    private final AtomicBoolean destroyed = new AtomicBoolean();

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Create a new dispatcher.
     *
     * @param httpSender initialized sender to use
     * @param completionHandler receiver of completions
     * @param name name prefix for the worker threads
     */
    HTTPDispatcher(
            final HTTPSender httpSender,
            final CompletionHandler completionHandler,
            final String name) {
        sender = httpSender;
        handler = completionHandler;
        executor = Executors.newCachedThreadPool(new ThreadFactory() {
            private final AtomicInteger count = new AtomicInteger();

            public Thread newThread(final Runnable runnable) {
                Thread thread = new Thread(runnable,
                        name + ": HTTP worker " + count.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Issue the exchange's request and await its outcome asynchronously.
     *
     * @param exch exchange to perform
     * @return {@code true} if the exchange was started, {@code false} if the
     *  dispatcher has been shut down
     */
    boolean dispatch(final HTTPExchange exch) {
        if (shutdown.get()) {
            LOG.log(Level.FINE, "Dispatcher shut down; dropping request RID="
                    + exch.getRequestRID());
            return false;
        }
        inFlight.incrementAndGet();
        try {
            exch.setHTTPResponse(sender.send(exch.getRequest()));
        } catch (RuntimeException rtx) {
            LOG.log(Level.FINE, "Could not issue request RID="
                    + exch.getRequestRID(), rtx);
            exch.setFailure(new BOSHException("Could not send request", rtx));
        }
        try {
            executor.execute(new Runnable() {
                public void run() {
                    try {
                        complete(exch);
                    } finally {
                        exchangeFinished();
                    }
                }
            });
            return true;
        } catch (RejectedExecutionException rex) {
            LOG.log(Level.FINE, "Request RID=" + exch.getRequestRID()
                    + " rejected", rex);
            exch.abort();
            exchangeFinished();
            return false;
        }
    }

    /**
     * Stop accepting exchanges.  The sender is destroyed once all exchanges
     * in flight have completed.
     */
    void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            executor.shutdown();
            if (inFlight.get() == 0) {
                destroySender();
            }
        }
    }

    /**
     * Get the number of exchanges currently in flight.
     *
     * @return in-flight count
     */
    int getInFlightCount() {
        return inFlight.get();
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    /**
     * Wait for the outcome of an issued exchange, then report it.
     *
     * @param exch exchange to complete
     */
    private void complete(final HTTPExchange exch) {
        if (exch.getFailure() == null) {
            try {
                exch.awaitOutcome();
            } catch (InterruptedException intx) {
                LOG.log(Level.FINEST, "Interrupted", intx);
                exch.setFailure(new BOSHException(
                        "Interrupted while awaiting response", intx));
                Thread.currentThread().interrupt();
            } catch (RuntimeException rtx) {
                exch.setFailure(new BOSHException(
                        "Could not obtain response", rtx));
            }
        }
        handler.exchangeCompleted(exch);
    }

    /**
     * Account for a finished exchange, destroying the sender if this was the
     * last one after shutdown.
     */
    private void exchangeFinished() {
        if (inFlight.decrementAndGet() == 0 && shutdown.get()) {
            destroySender();
        }
    }

    private void destroySender() {
        if (destroyed.compareAndSet(false, true)) {
            LOG.log(Level.FINEST, "Destroying HTTP sender");
            sender.destroy();
        }
    }

}
