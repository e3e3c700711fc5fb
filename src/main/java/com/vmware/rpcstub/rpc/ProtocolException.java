/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// The server's reply is not a well-formed response (bad UTF-8, bad JSON,
/// wrong shape, or a declared length the client will not read).
public class ProtocolException extends RPCException {
    private static final long serialVersionUID = 1L;

    public ProtocolException(final String message) {
        super(message);
    }

    public ProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
