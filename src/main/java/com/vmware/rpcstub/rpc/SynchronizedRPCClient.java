/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/// Serializes every operation of a client so several threads can share one connection.
/// Calls run one after another; there is no pipelining.
public class SynchronizedRPCClient extends RPCClient {
    private final RPCClient delegate;
    private final Object lock = new Object();

    public SynchronizedRPCClient(final RPCClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public void connect() throws ConnectionException {
        synchronized (this.lock) {
            this.delegate.connect();
        }
    }

    @Override
    public void disconnect() {
        synchronized (this.lock) {
            this.delegate.disconnect();
        }
    }

    @Override
    public boolean isConnected() {
        synchronized (this.lock) {
            return this.delegate.isConnected();
        }
    }

    @Override
    public JsonNode call(final String function, final Object... args) throws RPCException {
        synchronized (this.lock) {
            return this.delegate.call(function, args);
        }
    }
}
