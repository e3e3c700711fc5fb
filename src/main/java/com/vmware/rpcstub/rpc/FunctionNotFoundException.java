/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

/// The server has no function registered under the requested name
public class FunctionNotFoundException extends RPCException {
    private static final long serialVersionUID = 1L;

    public FunctionNotFoundException(final String message) {
        super(message);
    }
}
