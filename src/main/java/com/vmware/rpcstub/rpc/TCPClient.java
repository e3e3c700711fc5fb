/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;

public class TCPClient extends RPCClient {
    public static final int NO_TIMEOUT = 0;

    final String host;
    final int port;
    final int connectTimeoutMs;
    final int readTimeoutMs;
    final long maxFrameLength;
    Socket socket = null;
    FrameChannel channel = null;
    private static final Logger LOG = LogManager.getLogger(TCPClient.class);

    public TCPClient(final String host, final int port) {
        this(host, port, NO_TIMEOUT, NO_TIMEOUT, FrameChannel.UNLIMITED);
    }

    public TCPClient(final InetAddress ip, final int port) {
        this(ip.getHostAddress(), port);
    }

    /**
     * @param host             server host name or address, resolved on each connect
     * @param port             server port
     * @param connectTimeoutMs connect deadline in milliseconds, {@link #NO_TIMEOUT} to wait forever
     * @param readTimeoutMs    deadline for each blocking read, {@link #NO_TIMEOUT} to wait forever
     * @param maxFrameLength   largest reply body accepted, {@link FrameChannel#UNLIMITED} for none
     */
    public TCPClient(final String host, final int port, final int connectTimeoutMs, final int readTimeoutMs,
            final long maxFrameLength) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (connectTimeoutMs < 0 || readTimeoutMs < 0) {
            throw new IllegalArgumentException("Timeouts must not be negative");
        }
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public void connect() throws ConnectionException {
        if (this.isConnected()) {
            return;
        }
        final Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(this.host, this.port), this.connectTimeoutMs);
            s.setSoTimeout(this.readTimeoutMs);
            s.setTcpNoDelay(true);
            this.channel = new FrameChannel(s.getInputStream(), s.getOutputStream(), this.maxFrameLength);
            this.socket = s;
            LOG.info("Connected to {}:{} from {}", this.host, this.port, s.getLocalSocketAddress());
        } catch (final IOException e) {
            this.channel = null;
            closeQuietly(s);
            throw this.handleSocketError(e, ConnectionException.PHASE_CONNECT);
        }
    }

    @Override
    public void disconnect() {
        if (!this.isConnected()) {
            return;
        }
        try {
            this.socket.shutdownOutput();
            this.socket.shutdownInput();
        } catch (final IOException e) {
            LOG.debug("Ignoring error during socket shutdown: {}", e.toString());
        } finally {
            closeQuietly(this.socket);
            this.socket = null;
            this.channel = null;
        }
        LOG.info("Disconnected from {}:{}", this.host, this.port);
    }

    @Override
    public boolean isConnected() {
        return this.socket != null;
    }

    @Override
    public JsonNode call(final String function, final Object... args) throws RPCException {
        if (!this.isConnected()) {
            throw new ConnectionException("Not connected");
        }

        final RPCRequest req = RPCRequest.of(function, args);
        final RPCMessage msg = new RPCMessage(req.toBytes());
        LOG.debug("TCPClient sending: {}", req);

        final RPCResponse res = new RPCResponse(this.exchange(msg).payload());
        LOG.debug("TCPClient received: {}", res);
        if (res.isSuccess()) {
            return res.result();
        }
        throw res.toException();
    }

    private RPCMessage exchange(final RPCMessage msg) throws RPCException {
        try {
            this.channel.send(msg);
        } catch (final IOException e) {
            throw this.handleSocketError(e, ConnectionException.PHASE_SEND);
        }
        try {
            return this.channel.receive();
        } catch (final ProtocolException e) {
            // The body was never read, so the stream is no longer on a frame boundary
            LOG.error("Dropping connection to {}:{}: {}", this.host, this.port, e.getMessage());
            this.disconnect();
            throw e;
        } catch (final IOException e) {
            throw this.handleSocketError(e, ConnectionException.PHASE_RECV);
        }
    }

    /// Force Disconnected and wrap the fault. The caller throws the result.
    private ConnectionException handleSocketError(final IOException e, final String phase) {
        LOG.warn("Socket error during {} with {}:{}: {}", phase, this.host, this.port, e.toString());
        this.disconnect();
        return new ConnectionException(phase, e);
    }

    private static void closeQuietly(final Socket s) {
        try {
            s.close();
        } catch (final IOException e) {
            LOG.debug("Ignoring error while closing socket: {}", e.toString());
        }
    }

    @Override
    public String toString() {
        return String.format("TCPClient(%s:%d, %s)", this.host, this.port,
                this.isConnected() ? "connected" : "disconnected");
    }
}
