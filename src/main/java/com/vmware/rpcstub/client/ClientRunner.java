/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.client;

import com.vmware.rpcstub.rpc.ConnectionException;
import com.vmware.rpcstub.rpc.FunctionNotFoundException;
import com.vmware.rpcstub.rpc.RPCClient;
import com.vmware.rpcstub.rpc.RPCException;
import com.vmware.rpcstub.rpc.RPCExecutionException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Walks through the basic and complex calls a server is expected to offer
public class ClientRunner {

    public static void main(final String[] args) {
        final RunnerOptions opts = RunnerOptions.parse(ClientRunner.class.getName(), args);
        if (opts == null) {
            System.exit(1);
        }

        try (RPCClient client = opts.newClient().open()) {
            run(client);
        } catch (final ConnectionException e) {
            System.out.println("Connection error: " + e.getMessage());
        } catch (final RPCException e) {
            System.out.println("RPC error: " + e.getMessage());
        }
    }

    static void run(final RPCClient client) throws RPCException {
        // --- Basic Data Types ---
        System.out.println("add(10, 5) = " + client.call("add", 10, 5));
        System.out.println("greet('World') = " + client.call("greet", "World"));
        System.out.println("is_positive(-2.5) = " + client.call("is_positive", -2.5));
        System.out.println("echo(...) = " + client.call("echo", "This is a test string."));
        System.out.println("no_return() = " + client.callAs(Object.class, "no_return"));

        try {
            client.call("nonexistent_function", 1, 2, 3);
        } catch (final FunctionNotFoundException e) {
            System.out.println("Expected error: " + e.getMessage());
        }

        try {
            client.call("divide", 10, 0);
        } catch (final RPCExecutionException e) {
            System.out.println("Expected error: " + e.getMessage());
        }

        // --- Complex Data Types ---
        System.out.println();
        System.out.println("--- Complex Types ---");
        try {
            final List<Integer> numbers = Arrays.asList(1, 2, 3, 4, 5, -1);
            System.out.println("sum_array(" + numbers + ") = " + client.call("sum_array", numbers));

            final Map<String, Object> person = new LinkedHashMap<>();
            person.put("name", "Alice");
            person.put("age", 30);
            person.put("is_student", false);
            System.out.println("process_person(" + person + ") = " + client.call("process_person", person));

            final List<String> names = Arrays.asList("Bob", "Charlie");
            System.out.println("get_greetings(" + names + ") = " + client.call("get_greetings", names));
        } catch (final ConnectionException e) {
            throw e;
        } catch (final RPCException e) {
            System.out.println("Error during complex calls: " + e.getMessage());
        }
    }
}
