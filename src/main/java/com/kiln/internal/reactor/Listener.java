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

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A bound, non-blocking server socket registered for {@code OP_ACCEPT}. Each accepted socket becomes a
 * {@link ServerConnection} on the same reactor.
 */
class Listener implements ReactorChannel {

    private static final Logger logger = Logger.getLogger(Listener.class.getName());

    private final Reactor reactor;
    private final RequestHandler handler;
    private final ServerSocketChannel serverSocketChannel;
    private final InetSocketAddress localAddress;
    private final SelectionKey selectionKey;

    Listener(Reactor reactor, InetSocketAddress address, boolean reusePort, RequestHandler handler) throws IOException {
        this.reactor = reactor;
        this.handler = handler;

        serverSocketChannel = ServerSocketChannel.open();
        try {
            serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            if (reusePort) {
                if (!serverSocketChannel.supportedOptions().contains(StandardSocketOptions.SO_REUSEPORT)) {
                    throw new IOException("SO_REUSEPORT is not supported on this platform, so workers cannot share " + address);
                }
                serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEPORT, true);
            }
            serverSocketChannel.configureBlocking(false);
            serverSocketChannel.bind(address, reactor.options().acceptLength());
            localAddress = (InetSocketAddress) serverSocketChannel.getLocalAddress();
            selectionKey = serverSocketChannel.register(reactor.selector(), SelectionKey.OP_ACCEPT, this);
        } catch (IOException | RuntimeException e) {
            Reactor.closeQuietly(serverSocketChannel);
            throw e;
        }
    }

    InetSocketAddress localAddress() {
        return localAddress;
    }

    @Override
    public void onAcceptable() {
        SocketChannel socketChannel;
        try {
            socketChannel = serverSocketChannel.accept();
        } catch (IOException e) {
            logger.log(Level.FINE, "Accept failed on " + localAddress, e);
            return;
        }
        if (socketChannel == null) {
            return;
        }
        InetSocketAddress remoteAddress = null;
        try {
            SocketAddress socketAddress = socketChannel.getRemoteAddress();
            if (socketAddress instanceof InetSocketAddress inetSocketAddress) {
                remoteAddress = inetSocketAddress;
            }
        } catch (IOException ignored) {
            // Best effort
        }
        int maxConnections = reactor.options().maxConnections();
        if (maxConnections > 0 && reactor.numConnections() >= maxConnections) {
            logger.log(Level.FINE, "Rejecting connection from " + remoteAddress + ": limit of " + maxConnections + " reached");
            reactor.listener().didRejectConnection(remoteAddress);
            Reactor.closeQuietly(socketChannel);
            return;
        }
        try {
            socketChannel.configureBlocking(false);
            socketChannel.setOption(StandardSocketOptions.TCP_NODELAY, true);
            new ServerConnection(reactor, socketChannel, remoteAddress, handler);
        } catch (IOException e) {
            logger.log(Level.FINE, "Failed to register connection from " + remoteAddress, e);
            Reactor.closeQuietly(socketChannel);
            return;
        }
        reactor.connectionOpened(remoteAddress);
    }

    @Override
    public void failSafeClose() {
        selectionKey.cancel();
        Reactor.closeQuietly(serverSocketChannel);
    }

    @Override
    public String toString() {
        return "Listener{" + localAddress + "}";
    }
}
