/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// The socket is not open, or connect/send/recv failed. The client is always
/// Disconnected by the time this is thrown.
public class ConnectionException extends RPCException {
    private static final long serialVersionUID = 1L;

    public static final String PHASE_CONNECT = "connect";
    public static final String PHASE_SEND = "send";
    public static final String PHASE_RECV = "recv";

    private final String phase;

    public ConnectionException(final String message) {
        super(message);
        this.phase = null;
    }

    public ConnectionException(final String phase, final Throwable cause) {
        super(String.format("Socket error during %s: %s", phase, describe(cause)), cause);
        this.phase = phase;
    }

    /// The I/O phase that failed, or null when no I/O was attempted
    public String phase() {
        return this.phase;
    }

    private static String describe(final Throwable cause) {
        if (cause.getMessage() == null) {
            return cause.getClass().getSimpleName();
        }
        return cause.getMessage();
    }
}
