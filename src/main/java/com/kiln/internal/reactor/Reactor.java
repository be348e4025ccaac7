/**
 * MIT License
 *
 * Copyright (c) 2022 Elliot Barlas
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.kiln.internal.reactor;

import com.kiln.OutboundFailureReason;
import com.kiln.OutboundRequestException;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A single-threaded, non-blocking event loop. One selector multiplexes listening sockets, inbound
 * connections and outbound client connections; one thread services them all.
 * <p>
 * Work from other threads enters through {@link #execute(Runnable)}, which enqueues the task and wakes the
 * selector. Timeouts are tracked by a {@link Scheduler} polled once per loop iteration; the selector never waits
 * past the next deadline, nor longer than {@link ReactorOptions#resolution()}.
 * <p>
 * A failure while servicing one channel closes that channel only and is reported to the {@link ReactorListener}.
 * <p>
 * Host names of outbound requests are resolved on a small pool of resolver threads owned by the reactor, never on
 * the reactor thread itself.
 */
public class Reactor {

    private static final Logger logger = Logger.getLogger(Reactor.class.getName());

    private final ReactorOptions options;
    private final ReactorListener listener;
    private final Selector selector;
    private final Scheduler scheduler;
    private final Queue<Runnable> taskQueue;
    private final ByteBuffer readBuffer;
    private final Thread thread;
    private final AtomicBoolean started;
    private final AtomicBoolean stop;
    private final AtomicBoolean terminated;
    private final AtomicInteger connectionCount;
    private final AtomicLong connectionCounter;
    private final List<Listener> listeners;
    private final ThreadPoolExecutor resolver;

    public Reactor(ReactorOptions options, ReactorListener listener) throws IOException {
        this.options = options;
        this.listener = listener == null ? ReactorListener.NOOP : listener;

        selector = Selector.open();
        scheduler = new Scheduler();
        taskQueue = new ConcurrentLinkedQueue<>();
        readBuffer = ByteBuffer.allocateDirect(options.readBufferSize());
        thread = new Thread(this::run, options.threadName());
        started = new AtomicBoolean();
        stop = new AtomicBoolean();
        terminated = new AtomicBoolean();
        connectionCount = new AtomicInteger();
        connectionCounter = new AtomicLong();
        listeners = new CopyOnWriteArrayList<>();
        AtomicInteger resolverThreadCount = new AtomicInteger();
        resolver = new ThreadPoolExecutor(options.resolverThreads(), options.resolverThreads(), 30, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), runnable -> {
                    Thread resolverThread = new Thread(runnable,
                            options.threadName() + "-resolver-" + resolverThreadCount.incrementAndGet());
                    resolverThread.setDaemon(true);
                    return resolverThread;
                });
        resolver.allowCoreThreadTimeOut(true);
    }

    /**
     * Binds a listening socket whose connections are served by {@code handler}. Must be called before
     * {@link #start()}.
     *
     * @param address   the address to bind; port 0 picks a free port
     * @param reusePort whether to set {@code SO_REUSEPORT} so sibling processes can bind the same port
     * @param handler   receives parsed requests
     * @return the bound address
     * @throws IOException if binding fails
     */
    public InetSocketAddress listen(InetSocketAddress address, boolean reusePort, RequestHandler handler) throws IOException {
        if (started.get()) {
            throw new IllegalStateException("Listeners must be added before the reactor starts");
        }
        Listener listener = new Listener(this, address, reusePort, handler);
        listeners.add(listener);
        return listener.localAddress();
    }

    public List<InetSocketAddress> listenAddresses() {
        List<InetSocketAddress> addresses = new ArrayList<>(listeners.size());
        for (Listener listener : listeners) {
            addresses.add(listener.localAddress());
        }
        return addresses;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Reactor already started");
        }
        thread.start();
    }

    /**
     * Asks the loop to exit. Open channels are closed on the reactor thread; pending outbound requests fail with
     * {@link OutboundFailureReason#REACTOR_STOPPED}.
     */
    public void stop() {
        stop.set(true);
        selector.wakeup();
        if (!started.get() && terminated.compareAndSet(false, true)) {
            for (Listener listener : listeners) {
                listener.failSafeClose();
            }
            closeQuietly(selector);
            resolver.shutdownNow();
            runTasks();
        }
    }

    public void join() throws InterruptedException {
        if (started.get()) {
            thread.join();
        }
    }

    public boolean join(Duration timeout) throws InterruptedException {
        if (started.get()) {
            thread.join(Math.max(1, timeout.toMillis()));
            return !thread.isAlive();
        }
        return true;
    }

    public boolean isRunning() {
        return started.get() && !terminated.get();
    }

    public boolean inReactorThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Runs {@code task} on the reactor thread. Once the reactor has terminated, tasks run on the calling thread so
     * that they can observe the shutdown and fail fast.
     */
    public void execute(Runnable task) {
        taskQueue.add(task);
        if (terminated.get()) {
            runTasks();
            return;
        }
        // selector wakeup is not necessary if invoked within the event loop thread
        // since tasks are processed at the end of every event loop iteration
        if (Thread.currentThread() != thread) {
            selector.wakeup();
        }
    }

    /**
     * Opens a client connection to {@code address}, writes {@code requestBytes} and parses one response.
     * An unresolved address is resolved on a resolver thread; {@code timeout} covers resolution too.
     * Exactly one of the handler's methods is invoked, on the reactor thread, or on the calling thread if the reactor
     * has already terminated.
     */
    public void connect(InetSocketAddress address, byte[] requestBytes, boolean headRequest, Duration timeout,
                        ClientResponseHandler handler) {
        execute(() -> {
            if (stop.get()) {
                handler.onFailure(new OutboundRequestException(OutboundFailureReason.REACTOR_STOPPED,
                        "Reactor stopped before the request could be sent"));
                return;
            }
            new ClientConnection(this, address, requestBytes, headRequest, timeout, handler).start();
        });
    }

    /**
     * Runs a blocking name lookup on a resolver thread.
     *
     * @throws RejectedExecutionException if the reactor has terminated
     */
    void resolve(Runnable lookup) {
        resolver.execute(lookup);
    }

    ReactorOptions options() {
        return options;
    }

    ReactorListener listener() {
        return listener;
    }

    Selector selector() {
        return selector;
    }

    ByteBuffer readBuffer() {
        return readBuffer;
    }

    boolean isStopping() {
        return stop.get();
    }

    Cancellable schedule(Runnable task, Duration duration) {
        return scheduler.schedule(task, duration);
    }

    String nextConnectionId() {
        return Long.toString(connectionCounter.getAndIncrement());
    }

    int numConnections() {
        return connectionCount.get();
    }

    void connectionOpened(InetSocketAddress remoteAddress) {
        connectionCount.incrementAndGet();
        try {
            listener.didAcceptConnection(remoteAddress);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Reactor listener failed on accept", e);
        }
    }

    void connectionClosed(InetSocketAddress remoteAddress) {
        connectionCount.decrementAndGet();
        try {
            listener.didCloseConnection(remoteAddress);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Reactor listener failed on close", e);
        }
    }

    private void run() {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            listener.didFailUnexpectedly("Reactor terminated", e);
            stop.set(true); // stop the world on critical error
        } finally {
            for (SelectionKey selKey : new ArrayList<>(selector.keys())) {
                Object attachment = selKey.attachment();
                if (attachment instanceof ReactorChannel channel) {
                    channel.failSafeClose();
                }
            }
            closeQuietly(selector);
            resolver.shutdownNow();
            terminated.set(true);
            runTasks();
        }
    }

    private void doRun() throws IOException {
        while (!stop.get()) {
            select();
            Iterator<SelectionKey> it = selector.selectedKeys().iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                it.remove();
                ReactorChannel channel = (ReactorChannel) selKey.attachment();
                try {
                    if (!selKey.isValid()) {
                        continue;
                    }
                    if (selKey.isAcceptable()) {
                        channel.onAcceptable();
                    } else if (selKey.isConnectable()) {
                        channel.onConnectable();
                    } else if (selKey.isReadable()) {
                        channel.onReadable();
                    } else if (selKey.isWritable()) {
                        channel.onWritable();
                    }
                } catch (CancelledKeyException e) {
                    channel.failSafeClose();
                } catch (RuntimeException e) {
                    listener.didFailUnexpectedly("Unexpected error while servicing " + channel, e);
                    channel.failSafeClose();
                }
            }
            for (Runnable task : scheduler.expired()) {
                runSafely(task);
            }
            runTasks();
        }
    }

    private void select() throws IOException {
        long timeoutMillis = Math.max(1, options.resolution().toMillis());
        long nanosUntilDeadline = scheduler.nanosUntilNextDeadline();
        if (nanosUntilDeadline == 0) {
            selector.selectNow();
            return;
        }
        if (nanosUntilDeadline > 0) {
            timeoutMillis = Math.min(timeoutMillis, TimeUnit.NANOSECONDS.toMillis(nanosUntilDeadline) + 1);
        }
        selector.select(timeoutMillis);
    }

    private void runTasks() {
        Runnable task;
        while ((task = taskQueue.poll()) != null) {
            runSafely(task);
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            listener.didFailUnexpectedly("Reactor task failed", e);
        }
    }

    static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            logger.log(Level.FINE, "Failed to close " + closeable, e);
        }
    }
}
