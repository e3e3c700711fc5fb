/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

public class TestSynchronizedRPCClient {

    @Test
    public void testConcurrentCallersShareOneConnection() throws Exception {
        final int numThreads = 8;
        final int callsPerThread = 50;

        try (StubServer server = new StubServer();
             RPCClient client = new SynchronizedRPCClient(new TCPClient(server.host(), server.port())).open()) {
            final ExecutorService pool = Executors.newFixedThreadPool(numThreads);
            try {
                final List<Future<Integer>> results = new ArrayList<>();
                for (int t = 0; t < numThreads; t++) {
                    final int base = t * 1000;
                    results.add(pool.submit(() -> {
                        int correct = 0;
                        for (int i = 0; i < callsPerThread; i++) {
                            if (client.call("add", base, i).intValue() == base + i) {
                                correct++;
                            }
                        }
                        return correct;
                    }));
                }
                for (final Future<Integer> f : results) {
                    assertEquals(callsPerThread, f.get());
                }
            } finally {
                pool.shutdown();
            }
            assertEquals(numThreads * callsPerThread, server.requestsReceived());
            assertEquals(1, server.clientsAccepted());
        }
    }

    @Test
    public void testDelegatesLifecycle() throws Exception {
        try (StubServer server = new StubServer()) {
            final TCPClient inner = new TCPClient(server.host(), server.port());
            final RPCClient client = new SynchronizedRPCClient(inner);
            assertFalse(client.isConnected());
            client.connect();
            assertTrue(inner.isConnected());
            assertEquals("Hello, Ann!", client.callAs(String.class, "greet", "Ann"));
            client.close();
            assertFalse(inner.isConnected());
        }
    }
}
