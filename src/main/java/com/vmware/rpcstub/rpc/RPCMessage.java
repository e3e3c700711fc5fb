/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// One frame: header plus exactly hdr.msgLen bytes of UTF-8 JSON
public record RPCMessage(RPCHeader hdr, byte[] payload) {

    public RPCMessage(final byte[] payload) {
        this(new RPCHeader(payload.length), payload);
    }

    @Override
    public String toString() {
        return String.format("RPCMessage(%s, payload=%d bytes)", this.hdr, this.payload.length);
    }
}
