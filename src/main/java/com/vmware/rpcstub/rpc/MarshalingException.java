/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// An argument has no JSON representation. Raised before any bytes are sent.
public class MarshalingException extends RPCException {
    private static final long serialVersionUID = 1L;

    public MarshalingException(final String message) {
        super(message);
    }

    public MarshalingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
