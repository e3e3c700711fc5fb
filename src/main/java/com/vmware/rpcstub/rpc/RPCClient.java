/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/// RPC client operations. One connection, one call in flight, not thread safe.
public abstract class RPCClient implements AutoCloseable {
    /// Connect with the server. No-op if already connected.
    public abstract void connect() throws ConnectionException;

    /// Tear the connection down. No-op if not connected, never throws.
    public abstract void disconnect();

    public abstract boolean isConnected();

    /**
     * Invoke a remote function and wait for its reply.
     *
     * @param function name registered on the server
     * @param args     arguments in the JSON value model, see {@link JsonValues#toNode(Object)}
     * @return the result tree, or {@link RPCResponse#NO_RETURN_VALUE} if the function returned nothing
     * @throws ConnectionException        not connected, or the transport failed (client is now disconnected)
     * @throws MarshalingException        an argument has no JSON form; nothing was sent
     * @throws ProtocolException          the reply was not valid UTF-8 JSON of the expected shape
     * @throws FunctionNotFoundException  the server does not know the function
     * @throws RPCExecutionException      the function failed on the server
     * @throws RPCException               any other error the server reported
     */
    public abstract JsonNode call(String function, Object... args) throws RPCException;

    /// Like {@link #call(String, Object...)} but reads the result as resultType. No return value reads as null.
    public <T> T callAs(final Class<T> resultType, final String function, final Object... args)
            throws RPCException {
        return JsonValues.convert(this.call(function, args), resultType);
    }

    /// Connect and hand back this client, for use in try-with-resources
    public RPCClient open() throws ConnectionException {
        this.connect();
        return this;
    }

    @Override
    public void close() {
        this.disconnect();
    }
}
