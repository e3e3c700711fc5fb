/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// Frame header: the body length as an unsigned 32-bit big-endian integer.
/// There is no version, checksum or request id on the wire.
public class RPCHeader {
    public static final int BYTE_LEN = 4;
    public final long msgLen;       // 4 bytes, unsigned

    public RPCHeader(final long msgLen) {
        if (msgLen < 0 || msgLen > Utils.MAX_UINT32) {
            throw new IllegalArgumentException("Frame length out of range: " + msgLen);
        }
        this.msgLen = msgLen;
    }

    public RPCHeader(final byte[] data) {
        assert (data.length == RPCHeader.BYTE_LEN);
        this.msgLen = Utils.bytesToUint(data, 0);
    }

    public byte[] toBytes() {
        final byte[] buff = new byte[RPCHeader.BYTE_LEN];
        Utils.uintToBytes(this.msgLen, buff, 0);
        return buff;
    }

    @Override
    public String toString() {
        return String.format("RPCHdr(len=%d)", this.msgLen);
    }
}
