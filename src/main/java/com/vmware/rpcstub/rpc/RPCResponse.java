/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Response body, one of:
 * <pre>
 * {"status": "success", "result": &lt;value-or-absent&gt;}
 * {"status": "error", "message": "&lt;text&gt;"}
 * </pre>
 *
 * <p>Any status other than "success" is treated as an error.
 */
public class RPCResponse {
    public static final String STATUS_FIELD = "status";
    public static final String RESULT_FIELD = "result";
    public static final String MESSAGE_FIELD = "message";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";
    public static final String DEFAULT_ERROR_MESSAGE = "Unknown error";

    /// Result of a function that returned nothing. Never equal to a JSON null argument.
    public static final JsonNode NO_RETURN_VALUE = MissingNode.getInstance();

    // Servers report no error code, only prose. These substrings are the whole contract.
    static final String FUNCTION_NOT_FOUND_MARKER = "Function not found";
    static final String EXECUTION_ERROR_MARKER = "Execution error";

    final boolean isSuccess;
    final JsonNode result;
    final String message;

    private RPCResponse(final boolean isSuccess, final JsonNode result, final String message) {
        this.isSuccess = isSuccess;
        this.result = result;
        this.message = message;
    }

    public static RPCResponse success(final JsonNode result) {
        return new RPCResponse(true, result == null || result.isNull() ? NO_RETURN_VALUE : result, null);
    }

    public static RPCResponse error(final String message) {
        return new RPCResponse(false, NO_RETURN_VALUE, message == null ? DEFAULT_ERROR_MESSAGE : message);
    }

    public RPCResponse(final byte[] data) throws ProtocolException {
        final JsonNode root = parse(data);
        final JsonNode status = root.get(STATUS_FIELD);
        this.isSuccess = status != null && STATUS_SUCCESS.equals(status.textValue());
        if (this.isSuccess) {
            final JsonNode res = root.get(RESULT_FIELD);
            this.result = res == null || res.isNull() ? NO_RETURN_VALUE : res;
            this.message = null;
        } else {
            final JsonNode msg = root.get(MESSAGE_FIELD);
            this.result = NO_RETURN_VALUE;
            if (msg == null || msg.isNull()) {
                this.message = DEFAULT_ERROR_MESSAGE;
            } else {
                this.message = msg.isTextual() ? msg.textValue() : msg.toString();
            }
        }
    }

    /// Strict UTF-8 decode followed by a JSON parse that must yield exactly one object
    static ObjectNode parse(final byte[] data) throws ProtocolException {
        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (final CharacterCodingException e) {
            throw new ProtocolException("Invalid UTF-8 in message body", e);
        }

        final JsonNode root;
        try {
            root = JsonValues.MAPPER.readTree(text);
        } catch (final JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Message body is not a JSON object: " + text);
        }
        return (ObjectNode) root;
    }

    public boolean isSuccess() {
        return this.isSuccess;
    }

    /// The returned value, or {@link #NO_RETURN_VALUE}
    public JsonNode result() {
        return this.result;
    }

    public String message() {
        return this.message;
    }

    /// Map the server's error message onto the failure kind it denotes
    public RPCException toException() {
        return classify(this.message);
    }

    /**
     * Classify a server error message by substring. A custom message that happens to contain
     * one of the markers is misclassified; servers give no better signal.
     */
    public static RPCException classify(final String message) {
        if (message.contains(FUNCTION_NOT_FOUND_MARKER)) {
            return new FunctionNotFoundException(message);
        } else if (message.contains(EXECUTION_ERROR_MARKER)) {
            return new RPCExecutionException(message);
        }
        return new RPCException(message);
    }

    public byte[] toBytes() {
        final ObjectNode root = JsonValues.MAPPER.createObjectNode();
        if (this.isSuccess) {
            root.put(STATUS_FIELD, STATUS_SUCCESS);
            root.set(RESULT_FIELD, this.result.isMissingNode() ? root.nullNode() : this.result);
        } else {
            root.put(STATUS_FIELD, STATUS_ERROR);
            root.put(MESSAGE_FIELD, this.message);
        }
        return root.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        if (this.isSuccess) {
            return "RPCResponse(success, result=" + this.result + ")";
        }
        return "RPCResponse(error, message=" + this.message + ")";
    }
}
