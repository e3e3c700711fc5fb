/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// The server found the function but it failed while running (bad arguments,
/// runtime fault)
public class RPCExecutionException extends RPCException {
    private static final long serialVersionUID = 1L;

    public RPCExecutionException(final String message) {
        super(message);
    }
}
