/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The value model carried by requests and responses: integers, floats, booleans, null, text,
 * ordered lists and string-keyed maps. Converts plain Java values into Jackson trees and
 * rejects anything without a JSON form.
 */
public final class JsonValues {
    // The frame length is the only size limit on a reply, so lift Jackson's default read limits
    private static final StreamReadConstraints UNBOUNDED_READS = StreamReadConstraints.builder()
            .maxStringLength(Integer.MAX_VALUE)
            .maxNumberLength(Integer.MAX_VALUE)
            .maxNestingDepth(Integer.MAX_VALUE)
            .build();
    static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
                .streamReadConstraints(UNBOUNDED_READS)
                .build())
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() { }

    /**
     * Convert a Java value into a JSON tree.
     *
     * @param value null, Boolean, String, Character, a boxed integral type, BigInteger,
     *              BigDecimal, a finite Float or Double, a Collection or array of such values,
     *              a Map with String keys, or a JsonNode
     * @return the equivalent tree
     * @throws MarshalingException if the value, or anything nested in it, has no JSON form
     */
    public static JsonNode toNode(final Object value) throws MarshalingException {
        return toNode(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static JsonNode toNode(final Object value, final Set<Object> path) throws MarshalingException {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof JsonNode) {
            checkNode((JsonNode) value, path);
            return (JsonNode) value;
        }
        if (value instanceof Boolean) {
            return NODES.booleanNode((Boolean) value);
        }
        if (value instanceof String) {
            return NODES.textNode((String) value);
        }
        if (value instanceof Character) {
            return NODES.textNode(value.toString());
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return NODES.numberNode(((Number) value).intValue());
        }
        if (value instanceof Long) {
            return NODES.numberNode((Long) value);
        }
        if (value instanceof BigInteger) {
            return NODES.numberNode((BigInteger) value);
        }
        if (value instanceof BigDecimal) {
            return NODES.numberNode((BigDecimal) value);
        }
        if (value instanceof Float || value instanceof Double) {
            requireFinite(((Number) value).doubleValue());
            // Float keeps its own shortest decimal form on the wire
            return value instanceof Float ? NODES.numberNode((Float) value) : NODES.numberNode((Double) value);
        }
        if (value instanceof Map || value instanceof Collection || value.getClass().isArray()) {
            if (!path.add(value)) {
                throw new MarshalingException("Circular reference in argument of type "
                        + value.getClass().getName());
            }
            final JsonNode container = containerToNode(value, path);
            path.remove(value);
            return container;
        }
        throw new MarshalingException("Value of type " + value.getClass().getName()
                + " is not representable as JSON");
    }

    /// Walk a caller-built tree, rejecting whatever Jackson would not write as a JSON value
    private static void checkNode(final JsonNode node, final Set<Object> path) throws MarshalingException {
        if (node.isMissingNode() || node.isPojo()) {
            throw new MarshalingException("JSON node of type " + node.getNodeType() + " is not a value");
        }
        if (node.isDouble() || node.isFloat()) {
            requireFinite(node.doubleValue());
        }
        if (node.isContainerNode()) {
            if (!path.add(node)) {
                throw new MarshalingException("Circular reference in JSON node argument");
            }
            for (final JsonNode child : node) {
                checkNode(child, path);
            }
            path.remove(node);
        }
    }

    private static void requireFinite(final double d) throws MarshalingException {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new MarshalingException("Non-finite number " + d + " has no JSON representation");
        }
    }

    private static JsonNode containerToNode(final Object value, final Set<Object> path) throws MarshalingException {
        if (value instanceof Map) {
            final ObjectNode obj = NODES.objectNode();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new MarshalingException("Map key " + entry.getKey() + " is not a string");
                }
                obj.set((String) entry.getKey(), toNode(entry.getValue(), path));
            }
            return obj;
        }
        final ArrayNode arr = NODES.arrayNode();
        if (value instanceof Collection) {
            for (final Object item : (Collection<?>) value) {
                arr.add(toNode(item, path));
            }
        } else {
            final int len = Array.getLength(value);
            for (int i = 0; i < len; i++) {
                arr.add(toNode(Array.get(value, i), path));
            }
        }
        return arr;
    }

    /**
     * Read a result tree as a Java type. "No return value" reads as null.
     *
     * @throws ProtocolException if the tree does not fit the requested type
     */
    public static <T> T convert(final JsonNode node, final Class<T> type) throws ProtocolException {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            return MAPPER.treeToValue(node, type);
        } catch (final JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException(String.format("Result %s cannot be read as %s", node, type.getSimpleName()), e);
        }
    }
}
