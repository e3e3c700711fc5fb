/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Length-prefixed framing over an ordered byte stream.
 *
 * <p>Each frame is a 4-byte unsigned big-endian body length followed by exactly that many
 * bytes. Reads loop until the declared count is satisfied, however the transport splits the
 * data, and end-of-stream inside a frame is reported as an {@link EOFException} rather than a
 * short frame.
 *
 * <p>The protocol itself places no limit on the declared length. With {@link #UNLIMITED} the
 * only cap is the largest array the JVM can allocate, so a hostile peer can make the client
 * allocate up to ~2 GB per frame. Pass a ceiling to bound that.
 *
 * <p>Not thread safe. One request/response exchange at a time.
 */
public class FrameChannel {
    public static final long UNLIMITED = -1;
    // Largest array length the JVM reliably allocates
    static final long MAX_ARRAY_LEN = Integer.MAX_VALUE - 8;

    private static final Logger LOG = LogManager.getLogger(FrameChannel.class);

    private final InputStream in;
    private final OutputStream out;
    private final long maxFrameLength;
    private final byte[] hdrBuff = new byte[RPCHeader.BYTE_LEN];

    public FrameChannel(final InputStream in, final OutputStream out) {
        this(in, out, UNLIMITED);
    }

    /**
     * @param in             stream frames are read from
     * @param out            stream frames are written to
     * @param maxFrameLength largest body length accepted on receive, or {@link #UNLIMITED}
     */
    public FrameChannel(final InputStream in, final OutputStream out, final long maxFrameLength) {
        if (maxFrameLength != UNLIMITED && maxFrameLength < 0) {
            throw new IllegalArgumentException("maxFrameLength must be >= 0 or UNLIMITED: " + maxFrameLength);
        }
        this.in = in;
        this.out = out;
        this.maxFrameLength = maxFrameLength;
    }

    public void send(final byte[] payload) throws IOException {
        this.send(new RPCMessage(payload));
    }

    /// Write header and payload as one buffer and flush. Blocks until the transport took all of it.
    public void send(final RPCMessage msg) throws IOException {
        final byte[] hdr = msg.hdr().toBytes();
        final byte[] frame = new byte[hdr.length + msg.payload().length];
        System.arraycopy(hdr, 0, frame, 0, hdr.length);
        System.arraycopy(msg.payload(), 0, frame, hdr.length, msg.payload().length);
        this.out.write(frame);
        this.out.flush();
        LOG.debug("Sent frame: {}", msg);
    }

    public RPCMessage receive() throws IOException {
        // Read in entire header
        this.readFully(this.hdrBuff, RPCHeader.BYTE_LEN, "header");
        final RPCHeader hdr = new RPCHeader(this.hdrBuff);
        LOG.debug("Received header: {}", hdr);

        if (this.maxFrameLength != UNLIMITED && hdr.msgLen > this.maxFrameLength) {
            throw new ProtocolException(String.format("Declared frame length %d exceeds limit of %d bytes",
                    hdr.msgLen, this.maxFrameLength));
        }
        if (hdr.msgLen > MAX_ARRAY_LEN) {
            throw new ProtocolException(String.format("Declared frame length %d is larger than a single buffer",
                    hdr.msgLen));
        }

        // Read in entire payload
        final byte[] payload = new byte[(int) hdr.msgLen];
        this.readFully(payload, payload.length, "payload");
        return new RPCMessage(hdr, payload);
    }

    private void readFully(final byte[] buff, final int len, final String part) throws IOException {
        int bytesRead = 0;
        while (bytesRead < len) {
            final int ret = this.in.read(buff, bytesRead, len - bytesRead);
            if (ret < 0) {
                throw new EOFException(String.format("Connection closed by peer after %d of %d %s bytes",
                        bytesRead, len, part));
            }
            bytesRead += ret;
        }
    }
}
