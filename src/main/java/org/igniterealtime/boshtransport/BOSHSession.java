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

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * BOSH session instance.  Each logical stream carried over a connection
 * manager is represented and handled by an instance of this class.
 * <p/>
 * All session state (request ID, session ID, outstanding request count and
 * the response parser) is owned by a single processing thread.  Callers and
 * HTTP worker threads interact with the session only by posting commands
 * to its mailbox, which the processing thread executes in arrival order.
 * No session state is ever mutated outside of that thread, so none of it is
 * locked.
 * <p/>
 * Once the processing thread has exited, commands still waiting in the
 * mailbox (and any posted afterwards) are answered without being executed:
 * queries report the final values, stop requests report
 * {@link StopResult#ALREADY_STOPPED} and sends are dropped.
 */
final class BOSHSession implements HTTPDispatcher.CompletionHandler {

    /**
     * Logger.
     */
    private static final Logger LOG =
            Logger.getLogger(BOSHSession.class.getName());

    /**
     * Session configuration.
     */
    private final TransportConfig cfg;

    /**
     * Owner to deliver received elements to.
     */
    private final TransportListener owner;

    /**
     * Request dispatcher.
     */
    private final HTTPDispatcher dispatcher;

    /**
     * Request ID sequence to use for the session.
     */
    private final RequestIDSequence requestIDSeq = new RequestIDSequence();

    /**
     * Commands awaiting execution by the processing thread.
     */
    private final BlockingQueue<SessionCommand> mailbox =
            new LinkedBlockingQueue<SessionCommand>();

    /**
     * Lock guarding the transition of the mailbox to its closed state.
     */
    private final Lock mailboxLock = new ReentrantLock();

    /**
     * Thread which executes the mailbox commands.
     */
    private final Thread procThread;

    /**
     * Handle given out to the owner and to callers.
     */
    private final Transport transport;

    /**
     * Set once the mailbox no longer accepts commands.  Guarded by
     * {@code mailboxLock}.
     */
    private boolean mailboxClosed;

    /**
     * Current lifecycle state.  Written by the processing thread only;
     * volatile for diagnostic reads.
     */
    private volatile SessionState state = SessionState.CONNECTING;

    /************************************************************
     * The following vars must only be accessed by the processing thread.
     */

    /**
     * Response parser.
     */
    private XMLStreamParser parser;

    /**
     * Session ID assigned by the connection manager, or {@code null} until
     * the first response has been received.
     */
    private String sid;

    /**
     * Number of requests dispatched but not yet completed.
     */
    private int pendingRequests;

    ///////////////////////////////////////////////////////////////////////////
    // Classes:

    /**
     * Unit of work posted to the session mailbox.
     */
    private abstract static class SessionCommand {

        /**
         * Execute the command on the processing thread.
         */
        abstract void execute();

        /**
         * Answer the command without executing it, because the session has
         * ended.  Called either on the processing thread while it drains
         * the mailbox, or on the posting thread once the mailbox is closed.
         */
        abstract void abandon();

    }

    /**
     * Command which computes a value on the processing thread and hands it
     * back to a waiting caller.
     *
     * @param <T> type of the value
     */
    private static final class QueryCommand<T> extends SessionCommand {
        private final FutureTask<T> task;

        QueryCommand(final Callable<T> callable) {
            task = new FutureTask<T>(callable);
        }

        void execute() {
            task.run();
        }

        void abandon() {
            // Session state is final by now; the answer is still valid.
            task.run();
        }

        T awaitResult() {
            boolean interrupted = false;
            try {
                while (true) {
                    try {
                        return task.get();
                    } catch (InterruptedException intx) {
                        interrupted = true;
                    } catch (ExecutionException exx) {
                        Throwable cause = exx.getCause();
                        if (cause instanceof RuntimeException) {
                            throw((RuntimeException) cause);
                        }
                        throw(new IllegalStateException(
                                "Session query failed", cause));
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    ///////////////////////////////////////////////////////////////////////////
    // Constructors:

    /**
     * Create a new session.  The HTTP sender must already be initialized;
     * it is owned and eventually destroyed by the session.
     *
     * @param sessCfg session configuration
     * @param sessOwner owner to deliver received elements to
     * @param httpSender initialized HTTP sender
     * @param sessParser response parser
     */
    BOSHSession(
            final TransportConfig sessCfg,
            final TransportListener sessOwner,
            final HTTPSender httpSender,
            final XMLStreamParser sessParser) {
        if (sessOwner == null) {
            throw(new IllegalArgumentException("Owner may not be null"));
        }
        cfg = sessCfg;
        owner = sessOwner;
        parser = sessParser;
        String name = BOSHSession.class.getSimpleName()
                + "[" + System.identityHashCode(this) + "]";
        dispatcher = new HTTPDispatcher(httpSender, this, name);
        transport = new Transport(cfg.getEndpoint(), this);
        procThread = new Thread(new Runnable() {
            /**
             * Process mailbox commands.
             */
            public void run() {
                processMessages();
            }
        });
        procThread.setDaemon(true);
        procThread.setName(name + ": Processing thread");
    }

    ///////////////////////////////////////////////////////////////////////////
    // Package-private methods:

    /**
     * Create and start a new session.
     *
     * @param sessCfg session configuration
     * @param sessOwner owner to deliver received elements to
     * @param httpSender uninitialized HTTP sender
     * @param sessParser response parser
     * @return started session
     * @throws BOSHException if the session could not be started
     */
    static BOSHSession start(
            final TransportConfig sessCfg,
            final TransportListener sessOwner,
            final HTTPSender httpSender,
            final XMLStreamParser sessParser) throws BOSHException {
        try {
            httpSender.init(sessCfg);
        } catch (BOSHException boshx) {
            sessParser.free();
            throw(boshx);
        }
        BOSHSession session = new BOSHSession(
                sessCfg, sessOwner, httpSender, sessParser);
        session.init();
        return session;
    }

    /**
     * Get the handle of this session.
     *
     * @return transport handle
     */
    Transport getTransport() {
        return transport;
    }

    /**
     * Get the configuration the session was created with.
     *
     * @return configuration
     */
    TransportConfig getConfig() {
        return cfg;
    }

    /**
     * Get the current lifecycle state.
     *
     * @return state
     */
    SessionState getState() {
        return state;
    }

    /**
     * Determines whether the processing thread is still running.
     *
     * @return {@code true} if it is, {@code false} otherwise
     */
    boolean isAlive() {
        return procThread.isAlive();
    }

    /**
     * Wrap and send an element.
     *
     * @param elem element to send
     */
    void send(final XMLNode elem) {
        if (elem == null) {
            throw(new IllegalArgumentException("Element may not be null"));
        }
        post(new SessionCommand() {
            void execute() {
                processSend(elem);
            }

            void abandon() {
                LOG.log(Level.FINE, "Session ended; dropping element: {0}",
                        elem);
            }
        });
    }

    /**
     * Send a caller-built body without wrapping it.
     *
     * @param body complete body to send
     */
    void sendRaw(final XMLElement body) {
        if (body == null) {
            throw(new IllegalArgumentException("Body may not be null"));
        }
        post(new SessionCommand() {
            void execute() {
                processSendRaw(body);
            }

            void abandon() {
                LOG.log(Level.FINE, "Session ended; dropping body: {0}",
                        body);
            }
        });
    }

    /**
     * Replace the response parser with a fresh one.
     */
    void resetParser() {
        post(new SessionCommand() {
            void execute() {
                processResetParser();
            }

            void abandon() {
                LOG.log(Level.FINEST, "Session ended; parser not reset");
            }
        });
    }

    /**
     * Terminate the session, sending a termination request to the
     * connection manager.  Blocks until the processing thread has handled
     * the request.
     *
     * @return {@link StopResult#OK}, or {@link StopResult#ALREADY_STOPPED}
     *  if the session had already ended
     */
    StopResult stop() {
        if (!isAlive()) {
            return StopResult.ALREADY_STOPPED;
        }
        return query(new Callable<StopResult>() {
            public StopResult call() {
                return processStop();
            }
        });
    }

    /**
     * Get the session ID.
     *
     * @return session ID, or {@code null} if not yet assigned
     */
    String getSID() {
        return query(new Callable<String>() {
            public String call() {
                return sid;
            }
        });
    }

    /**
     * Get the request ID which the next request will carry.
     *
     * @return next request ID
     */
    long getRID() {
        return query(new Callable<Long>() {
            public Long call() {
                return requestIDSeq.peekNextRID();
            }
        }).longValue();
    }

    /**
     * Get the number of requests dispatched but not yet completed.
     *
     * @return outstanding request count
     */
    int getPendingRequests() {
        return query(new Callable<Integer>() {
            public Integer call() {
                return pendingRequests;
            }
        }).intValue();
    }

    ///////////////////////////////////////////////////////////////////////////
    // HTTPDispatcher.CompletionHandler interface methods:

    /**
     * {@inheritDoc}
     */
    public void exchangeCompleted(final HTTPExchange exch) {
        post(new SessionCommand() {
            void execute() {
                processExchange(exch);
            }

            void abandon() {
                LOG.log(Level.FINEST, "Session ended; discarding response "
                        + "to RID={0}", exch.getRequestRID());
            }
        });
    }

    ///////////////////////////////////////////////////////////////////////////
    // Private methods:

    /**
     * Start the processing thread.
     *
     * @throws BOSHException if the thread could not be started
     */
    private void init() throws BOSHException {
        state = SessionState.ACTIVE;
        try {
            procThread.start();
        } catch (OutOfMemoryError oomx) {
            state = SessionState.STOPPED;
            parser.free();
            dispatcher.shutdown();
            throw(new BOSHException(
                    "Could not start session processing thread", oomx));
        }
        LOG.log(Level.FINE, "Session started for {0}", cfg.getEndpoint());
    }

    /**
     * Post a command to the mailbox, or answer it immediately if the
     * session has ended.
     *
     * @param cmd command to post
     */
    private void post(final SessionCommand cmd) {
        boolean accepted;
        mailboxLock.lock();
        try {
            accepted = !mailboxClosed;
            if (accepted) {
                mailbox.add(cmd);
            }
        } finally {
            mailboxLock.unlock();
        }
        if (!accepted) {
            cmd.abandon();
        }
    }

    /**
     * Run a query on the processing thread and wait for its answer.
     *
     * @param <T> type of the answer
     * @param callable query to run
     * @return answer
     */
    private <T> T query(final Callable<T> callable) {
        QueryCommand<T> cmd = new QueryCommand<T>(callable);
        if (Thread.currentThread() == procThread) {
            // Called by the owner during delivery
            cmd.execute();
            return cmd.awaitResult();
        }
        post(cmd);
        return cmd.awaitResult();
    }

    /**
     * Execute mailbox commands until the session has stopped.
     *
     * This method is run in the processing thread.
     */
    private void processMessages() {
        LOG.log(Level.FINEST, "Processing thread starting");
        try {
            while (state != SessionState.STOPPED) {
                SessionCommand cmd = mailbox.take();
                try {
                    cmd.execute();
                } catch (RuntimeException rtx) {
                    LOG.log(Level.WARNING, "Unexpected session failure", rtx);
                    fail(new BOSHException("Unexpected session failure", rtx));
                }
            }
        } catch (InterruptedException intx) {
            LOG.log(Level.FINEST, "Interrupted", intx);
            state = SessionState.STOPPED;
        } finally {
            dispose();
            LOG.log(Level.FINEST, "Processing thread exiting");
        }
    }

    /**
     * Release the session resources and answer any commands left in the
     * mailbox.
     *
     * This method is run in the processing thread.
     */
    private void dispose() {
        state = SessionState.STOPPED;
        mailboxLock.lock();
        try {
            mailboxClosed = true;
        } finally {
            mailboxLock.unlock();
        }
        parser.free();
        dispatcher.shutdown();
        SessionCommand cmd;
        while ((cmd = mailbox.poll()) != null) {
            cmd.abandon();
        }
    }

    /**
     * Wrap the element into a body and dispatch it.
     *
     * @param elem element to send
     */
    private void processSend(final XMLNode elem) {
        if (state != SessionState.ACTIVE) {
            LOG.log(Level.FINE, "Session not active; dropping element: {0}",
                    elem);
            return;
        }
        long rid = requestIDSeq.getNextRID();
        dispatch(ElementWrapper.wrap(elem, rid, sid));
    }

    /**
     * Dispatch a caller-built body.  A request ID is consumed just as for a
     * wrapped send, so a caller which builds its bodies using
     * {@link #getRID()} stays in step with the sequence.
     *
     * @param body body to send
     */
    private void processSendRaw(final XMLElement body) {
        if (state != SessionState.ACTIVE) {
            LOG.log(Level.FINE, "Session not active; dropping body: {0}",
                    body);
            return;
        }
        requestIDSeq.getNextRID();
        dispatch(body);
    }

    /**
     * Replace the parser.  Request tracking is not affected.
     */
    private void processResetParser() {
        try {
            parser = parser.reset();
        } catch (BOSHException boshx) {
            LOG.log(Level.WARNING, "Could not reset parser", boshx);
            fail(boshx);
        }
    }

    /**
     * Send the termination body and stop the session.
     *
     * @return outcome of the request
     */
    private StopResult processStop() {
        if (state != SessionState.ACTIVE) {
            return StopResult.ALREADY_STOPPED;
        }
        state = SessionState.STOPPING;
        long rid = requestIDSeq.getNextRID();
        dispatch(ElementWrapper.wrap(Stanzas.streamEnd(), rid, sid));
        state = SessionState.STOPPED;
        LOG.log(Level.FINE, "Session stopped by owner");
        return StopResult.OK;
    }

    /**
     * Hand the body to the dispatcher and account for it as outstanding.
     *
     * @param body body to send
     */
    private void dispatch(final XMLElement body) {
        HTTPExchange exch = new HTTPExchange(body);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Sending request: " + body.toXML());
        }
        if (dispatcher.dispatch(exch)) {
            pendingRequests++;
        }
    }

    /**
     * Process a completed exchange: bind the session ID if needed, deliver
     * the unwrapped elements and keep a poll outstanding.
     *
     * @param exch completed exchange
     */
    private void processExchange(final HTTPExchange exch) {
        pendingRequests--;
        BOSHException failure = exch.getFailure();
        if (failure != null) {
            LOG.log(Level.WARNING, "Request RID=" + exch.getRequestRID()
                    + " failed", failure);
            fail(failure);
            return;
        }

        XMLElement body;
        try {
            body = parser.parse(exch.getResponseBody());
        } catch (BOSHException boshx) {
            LOG.log(Level.WARNING, "Could not parse response to RID="
                    + exch.getRequestRID(), boshx);
            fail(boshx);
            return;
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Received response: " + body.toXML());
        }

        if (sid == null) {
            sid = body.getAttribute(Attributes.SID);
            if (sid != null) {
                LOG.log(Level.FINE, "Session ID bound: {0}", sid);
            }
        }

        List<XMLNode> elements = ElementWrapper.unwrap(body);
        for (XMLNode element : elements) {
            fireStanzaReceived(element);
        }

        if (ElementWrapper.containsStreamEnd(elements)) {
            state = SessionState.STOPPING;
            LOG.log(Level.FINE, "Stream ended by connection manager");
            state = SessionState.STOPPED;
            return;
        }

        if (pendingRequests == 0 && state == SessionState.ACTIVE) {
            sendPoll();
        }
    }

    /**
     * Send an empty body so that the connection manager always holds a
     * request it can respond to with pushed data.
     */
    private void sendPoll() {
        long rid = requestIDSeq.getNextRID();
        dispatch(BOSHBodies.emptyBody(rid, sid));
    }

    /**
     * Stop the session because of the failure provided, notifying the owner.
     *
     * @param cause reason for the failure
     */
    private void fail(final Throwable cause) {
        if (state == SessionState.STOPPED) {
            return;
        }
        state = SessionState.STOPPED;
        try {
            owner.sessionFailed(transport, cause);
        } catch (RuntimeException rtx) {
            LOG.log(Level.WARNING, "Owner failed to process session failure",
                    rtx);
        }
    }

    /**
     * Deliver an element to the owner.
     *
     * @param element element to deliver
     */
    private void fireStanzaReceived(final XMLNode element) {
        try {
            owner.stanzaReceived(transport, element);
        } catch (RuntimeException rtx) {
            LOG.log(Level.WARNING, "Owner failed to process element", rtx);
        }
    }

}
