/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.vmware.rpcstub.rpc.ConnectionException;
import com.vmware.rpcstub.rpc.FunctionNotFoundException;
import com.vmware.rpcstub.rpc.RPCClient;
import com.vmware.rpcstub.rpc.RPCException;
import com.vmware.rpcstub.rpc.RPCExecutionException;
import com.vmware.rpcstub.rpc.TCPClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/// Checks a live server against the expected results of the standard functions.
/// Exits non-zero if any check fails.
public class FunctionalCheckRunner {
    private static final Logger LOG = LogManager.getLogger(FunctionalCheckRunner.class);

    @FunctionalInterface
    interface Check {
        /// @return null on success, otherwise a description of what went wrong
        String run(RPCClient client) throws RPCException;
    }

    private final RunnerOptions opts;
    int passed = 0;
    int failed = 0;

    FunctionalCheckRunner(final RunnerOptions opts) {
        this.opts = opts;
    }

    public static void main(final String[] args) {
        final RunnerOptions opts = RunnerOptions.parse(FunctionalCheckRunner.class.getName(), args);
        if (opts == null) {
            System.exit(1);
        }

        final FunctionalCheckRunner runner = new FunctionalCheckRunner(opts);
        try {
            runner.runAll();
        } catch (final ConnectionException e) {
            System.out.println("Checks aborted: could not connect to server: " + e.getMessage());
            System.exit(2);
        } catch (final RPCException e) {
            System.out.println("Checks aborted with unexpected error: " + e.getMessage());
            System.exit(2);
        }
        System.out.println(String.format("%d passed, %d failed", runner.passed, runner.failed));
        System.exit(runner.failed == 0 ? 0 : 1);
    }

    void runAll() throws RPCException {
        this.basicFunctionality();
        this.argumentValidation();
        this.errorHandling();
        this.reconnection();
        this.complexData();
    }

    void basicFunctionality() throws RPCException {
        System.out.println("=== Basic Functionality ===");
        try (RPCClient client = this.opts.newClient().open()) {
            this.check(client, "integer addition", c -> expect(c.call("add", 42, 58).asInt(), 100));
            this.check(client, "string operation",
                c -> expect(c.callAs(String.class, "greet", "World"), "Hello, World!"));
            this.check(client, "boolean return", c -> {
                final String pos = expect(c.callAs(Boolean.class, "is_positive", 5), true);
                return pos != null ? pos : expect(c.callAs(Boolean.class, "is_positive", -5), false);
            });
            this.check(client, "void function", c -> {
                final JsonNode res = c.call("no_return");
                return res.isMissingNode() ? null : "expected no return value, got " + res;
            });
        }
    }

    void argumentValidation() throws RPCException {
        System.out.println("=== Argument Validation ===");
        try (RPCClient client = this.opts.newClient().open()) {
            this.check(client, "too many arguments", c -> expectExecutionError(c, "add", 1, 2, 3, 4, 5));
            this.check(client, "missing arguments", c -> expectExecutionError(c, "add"));
            this.check(client, "wrong argument types", c -> expectExecutionError(c, "add", "string", true));
            this.check(client, "negative is_positive",
                c -> expect(c.callAs(Boolean.class, "is_positive", -10), false));
            this.check(client, "float arguments for add", c -> {
                try {
                    c.call("add", 1.5, 2.5);
                } catch (final RPCExecutionException e) {
                    LOG.info("Server rejected float arguments: {}", e.getMessage());
                }
                return null;
            });
        }
    }

    void errorHandling() throws RPCException {
        System.out.println("=== Error Handling ===");
        try (RPCClient client = this.opts.newClient().open()) {
            this.check(client, "function not found", c -> {
                try {
                    c.call("non_existent_function");
                    return "call succeeded";
                } catch (final FunctionNotFoundException e) {
                    return null;
                }
            });
            this.check(client, "invalid argument", c -> expectExecutionError(c, "add", "not_a_number", 5));
            this.check(client, "division by zero", c -> expectExecutionError(c, "divide", 10, 0));
        }
    }

    void reconnection() throws RPCException {
        System.out.println("=== Reconnection ===");
        final TCPClient client = this.opts.newClient();
        client.connect();
        try {
            this.check(client, "first connection", c -> expect(c.call("add", 5, 7).asInt(), 12));
            client.disconnect();
            this.check(client, "call while disconnected", c -> {
                try {
                    c.call("add", 1, 2);
                    return "call succeeded when disconnected";
                } catch (final ConnectionException e) {
                    return null;
                }
            });
            client.connect();
            this.check(client, "reconnected", c -> expect(c.call("add", 10, 20).asInt(), 30));
        } finally {
            client.disconnect();
        }
    }

    void complexData() throws RPCException {
        System.out.println("=== Complex Data ===");
        try (RPCClient client = this.opts.newClient().open()) {
            this.check(client, "array handling",
                c -> expect(c.call("sum_array", Arrays.asList(1, 2, 3, 4, 5)).asInt(), 15));
            this.check(client, "object handling", c -> {
                final Map<String, Object> person = new LinkedHashMap<>();
                person.put("name", "Test User");
                person.put("age", 30);
                person.put("is_student", true);
                final String res = c.callAs(String.class, "process_person", person);
                if (res == null || !res.contains("Test User") || !res.contains("30")) {
                    return "unexpected description: " + res;
                }
                return null;
            });
            this.check(client, "complex return", c -> {
                final JsonNode res = c.call("get_greetings", Arrays.asList("Alice", "Bob", "Charlie"));
                if (!res.isArray() || res.size() != 3) {
                    return "expected 3 greetings, got " + res;
                }
                return res.get(0).asText().equals("Hello, Alice!") ? null : "missing greeting for Alice in " + res;
            });
        }
    }

    private void check(final RPCClient client, final String name, final Check check) throws ConnectionException {
        String failure;
        try {
            failure = check.run(client);
        } catch (final ConnectionException e) {
            throw e;
        } catch (final RPCException e) {
            failure = e.getClass().getSimpleName() + ": " + e.getMessage();
        }
        if (failure == null) {
            this.passed++;
            System.out.println("  PASS " + name);
        } else {
            this.failed++;
            System.out.println("  FAIL " + name + ": " + failure);
            LOG.error("Check '{}' failed: {}", name, failure);
        }
    }

    private static String expect(final Object actual, final Object expected) {
        return expected.equals(actual) ? null : String.format("expected %s, got %s", expected, actual);
    }

    private static String expectExecutionError(final RPCClient client, final String function, final Object... args)
            throws RPCException {
        try {
            final JsonNode res = client.call(function, args);
            return "expected an execution error, got " + res;
        } catch (final RPCExecutionException e) {
            return null;
        }
    }
}
