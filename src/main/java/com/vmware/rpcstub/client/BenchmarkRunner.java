/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.vmware.rpcstub.rpc.ConnectionException;
import com.vmware.rpcstub.rpc.RPCClient;
import com.vmware.rpcstub.rpc.RPCException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/// Latency, payload scaling and throughput measurements against a live server
public class BenchmarkRunner {
    private static final Logger LOG = LogManager.getLogger(BenchmarkRunner.class);

    static final int WARMUP_CALLS = 10;
    static final int LATENCY_ITERATIONS = 25;
    static final int[] ECHO_SIZES = {10, 100, 500, 1000, 5000, 10000, 50000, 100000, 500000, 1000000};
    static final int THROUGHPUT_ADD_CALLS = 1000;
    static final int THROUGHPUT_ECHO_CALLS = 500;
    static final int THROUGHPUT_ECHO_BYTES = 1000;

    /// One benchmarked call
    static class Case {
        final String label;
        final String function;
        final Object[] args;

        Case(final String label, final String function, final Object... args) {
            this.label = label;
            this.function = function;
            this.args = args;
        }
    }

    static List<Case> latencyCases() {
        return Arrays.asList(
            new Case("No args/results", "no_return"),
            new Case("1 arg/result", "is_positive", 5),
            new Case("2 args/1 result", "add", 5, 10),
            new Case("4-byte payload", "echo", repeat(4)),
            new Case("40-byte payload", "echo", repeat(40)),
            new Case("100-byte payload", "echo", repeat(100)),
            new Case("1000-byte payload", "echo", repeat(1000)),
            new Case("1 word array", "sum_array", range(1, 2)),
            new Case("4 word array", "sum_array", range(1, 5)),
            new Case("10 word array", "sum_array", range(0, 10)),
            new Case("40 word array", "sum_array", range(0, 40)),
            new Case("100 word array", "sum_array", range(0, 100)));
    }

    public static void main(final String[] args) {
        final RunnerOptions opts = RunnerOptions.parse(BenchmarkRunner.class.getName(), args);
        if (opts == null) {
            System.exit(1);
        }

        System.out.println("Starting RPC Performance Benchmark");
        try (RPCClient client = opts.newClient().open()) {
            latency(client, latencyCases(), LATENCY_ITERATIONS);
            scaling(client, ECHO_SIZES);
            throughput(client);
            System.out.println("All benchmarks completed");
        } catch (final ConnectionException e) {
            System.out.println("Benchmark failed: could not connect to server: " + e.getMessage());
            System.out.println(String.format("Make sure the server is running on %s:%d", opts.host, opts.port));
            System.exit(1);
        } catch (final RPCException e) {
            LOG.error("Benchmark failed with unexpected error", e);
            System.exit(1);
        }
    }

    /// Per-case latency table. Returns the statistics in case order.
    static List<DescriptiveStatistics> latency(final RPCClient client, final List<Case> cases, final int iterations)
            throws RPCException {
        System.out.println("=== Latency ===");
        for (int i = 0; i < WARMUP_CALLS; i++) {
            client.call("add", 1, 1);
        }

        System.out.println(String.format("%-25s %-10s %-10s %-10s %-10s",
                "Test Case", "Min (ms)", "Median (ms)", "Avg (ms)", "Max (ms)"));
        final List<DescriptiveStatistics> all = new ArrayList<>();
        for (final Case c : cases) {
            final DescriptiveStatistics stats = new DescriptiveStatistics();
            for (int i = 0; i < iterations; i++) {
                final long start = System.nanoTime();
                client.call(c.function, c.args);
                stats.addValue((System.nanoTime() - start) / 1e6);
            }
            System.out.println(String.format("%-25s %-10.2f %-10.2f %-10.2f %-10.2f",
                    c.label, stats.getMin(), stats.getPercentile(50), stats.getMean(), stats.getMax()));
            all.add(stats);
        }
        return all;
    }

    /// Echo latency as the payload grows. Fewer iterations for larger payloads.
    static void scaling(final RPCClient client, final int[] sizes) throws RPCException {
        System.out.println("=== Data Size Scaling ===");
        for (int i = 0; i < 5; i++) {
            client.call("echo", "warmup");
        }

        System.out.println(String.format("%-15s %-15s %-15s %-15s", "Size (bytes)", "Min (ms)", "Median (ms)",
                "Max (ms)"));
        for (final int size : sizes) {
            final String data = repeat(size);
            final int iterations = Math.max(3, Math.min(20, 10000 / Math.max(size, 1)));
            final DescriptiveStatistics stats = new DescriptiveStatistics();
            for (int i = 0; i < iterations; i++) {
                final long start = System.nanoTime();
                final JsonNode res = client.call("echo", data);
                stats.addValue((System.nanoTime() - start) / 1e6);
                if (res.asText().length() != size) {
                    LOG.warn("Result size mismatch: {} != {}", res.asText().length(), size);
                }
            }
            System.out.println(String.format("%-15d %-15.2f %-15.2f %-15.2f",
                    size, stats.getMin(), stats.getPercentile(50), stats.getMax()));
        }
    }

    static void throughput(final RPCClient client) throws ConnectionException {
        System.out.println("=== Throughput ===");

        int success = 0;
        long start = System.nanoTime();
        for (int i = 0; i < THROUGHPUT_ADD_CALLS; i++) {
            try {
                if (client.call("add", i, i).asInt() == i * 2) {
                    success++;
                }
            } catch (final ConnectionException e) {
                throw e;
            } catch (final RPCException e) {
                LOG.debug("add({}, {}) failed: {}", i, i, e.getMessage());
            }
        }
        report("Small Payload (add)", success, THROUGHPUT_ADD_CALLS, System.nanoTime() - start);

        final String payload = repeat(THROUGHPUT_ECHO_BYTES);
        success = 0;
        start = System.nanoTime();
        for (int i = 0; i < THROUGHPUT_ECHO_CALLS; i++) {
            try {
                if (client.call("echo", payload).asText().length() == THROUGHPUT_ECHO_BYTES) {
                    success++;
                }
            } catch (final ConnectionException e) {
                throw e;
            } catch (final RPCException e) {
                LOG.debug("echo failed: {}", e.getMessage());
            }
        }
        report("Medium Payload (1KB echo)", success, THROUGHPUT_ECHO_CALLS, System.nanoTime() - start);
    }

    private static void report(final String label, final int success, final int total, final long elapsedNanos) {
        final double seconds = elapsedNanos / 1e9;
        System.out.println(String.format("%s: completed %d/%d calls successfully in %.2f seconds",
                label, success, total, seconds));
        System.out.println(String.format("Throughput: %.2f calls/second", success / seconds));
    }

    static String repeat(final int n) {
        return String.join("", Collections.nCopies(n, "x"));
    }

    static List<Integer> range(final int from, final int to) {
        return IntStream.range(from, to).boxed().collect(Collectors.toList());
    }
}
