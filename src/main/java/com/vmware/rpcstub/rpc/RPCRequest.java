/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Request body: {"function": "<name>", "args": [ ... ]}
public class RPCRequest {
    public static final String FUNCTION_FIELD = "function";
    public static final String ARGS_FIELD = "args";

    final String function;
    final List<JsonNode> args;

    private RPCRequest(final String function, final List<JsonNode> args) {
        this.function = function;
        this.args = Collections.unmodifiableList(args);
    }

    /**
     * Build a request, converting every argument into the JSON value model.
     *
     * @throws MarshalingException if the name is null or an argument has no JSON form
     */
    public static RPCRequest of(final String function, final Object... args) throws MarshalingException {
        if (function == null) {
            throw new MarshalingException("Function name must not be null");
        }
        final List<JsonNode> nodes = new ArrayList<>();
        if (args != null) {
            for (int i = 0; i < args.length; i++) {
                try {
                    nodes.add(JsonValues.toNode(args[i]));
                } catch (final MarshalingException e) {
                    throw new MarshalingException(String.format("Argument %d of %s: %s", i, function, e.getMessage()), e);
                }
            }
        }
        return new RPCRequest(function, nodes);
    }

    public RPCRequest(final byte[] data) throws ProtocolException {
        final JsonNode root = RPCResponse.parse(data);
        final JsonNode fn = root.get(FUNCTION_FIELD);
        final JsonNode argList = root.get(ARGS_FIELD);
        if (fn == null || !fn.isTextual() || argList == null || !argList.isArray()) {
            throw new ProtocolException("Missing 'function' or 'args' field");
        }
        final List<JsonNode> nodes = new ArrayList<>();
        argList.forEach(nodes::add);
        this.function = fn.textValue();
        this.args = Collections.unmodifiableList(nodes);
    }

    public String function() {
        return this.function;
    }

    public List<JsonNode> args() {
        return this.args;
    }

    public byte[] toBytes() throws MarshalingException {
        final ObjectNode root = JsonValues.MAPPER.createObjectNode();
        root.put(FUNCTION_FIELD, this.function);
        final ArrayNode argList = root.putArray(ARGS_FIELD);
        argList.addAll(this.args);
        try {
            return JsonValues.MAPPER.writeValueAsBytes(root);
        } catch (final JsonProcessingException e) {
            throw new MarshalingException("JSON encoding failed: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "RPCRequest(function=" + this.function + ", args=" + this.args + ")";
    }
}
