/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import java.io.IOException;

/// Root of every failure a call can report. Also used directly for server
/// errors that match no more specific kind.
public class RPCException extends IOException {
    private static final long serialVersionUID = 1L;

    public RPCException(final String message) {
        super(message);
    }

    public RPCException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
