/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.client;

import com.vmware.rpcstub.rpc.FrameChannel;
import com.vmware.rpcstub.rpc.TCPClient;

import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/// Command line shared by the client programs: [options] <host> <port>
public class RunnerOptions {
    private static final String CONNECT_TIMEOUT_OPTION = "connectTimeout";
    private static final int CONNECT_TIMEOUT_DEFAULT = TCPClient.NO_TIMEOUT; // in milliseconds
    private static final String READ_TIMEOUT_OPTION = "readTimeout";
    private static final int READ_TIMEOUT_DEFAULT = TCPClient.NO_TIMEOUT; // in milliseconds
    private static final String MAX_FRAME_OPTION = "maxFrame";

    final String host;
    final int port;
    final int connectTimeoutMs;
    final int readTimeoutMs;
    final long maxFrameLength;

    RunnerOptions(final String host, final int port, final int connectTimeoutMs, final int readTimeoutMs,
            final long maxFrameLength) {
        this.host = host;
        this.port = port;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.maxFrameLength = maxFrameLength;
    }

    public TCPClient newClient() {
        return new TCPClient(this.host, this.port, this.connectTimeoutMs, this.readTimeoutMs, this.maxFrameLength);
    }

    /**
     * Parse the command line.
     *
     * @param program name printed in the usage line
     * @param args    raw arguments
     * @return the parsed options, or null if help was printed or the arguments were invalid
     */
    public static RunnerOptions parse(final String program, final String[] args) {
        final Options options = new Options();

        final Option helpOption = Option.builder("h")
                .longOpt("help").argName("h")
                .hasArg(false)
                .desc("print help message")
                .build();
        final Option connectTimeoutOption = Option.builder("c")
                .longOpt(CONNECT_TIMEOUT_OPTION).argName(CONNECT_TIMEOUT_OPTION)
                .hasArg()
                .desc(String.format("connect timeout in milliseconds, 0 waits forever.%nDefault: %d",
                        CONNECT_TIMEOUT_DEFAULT))
                .type(Integer.class)
                .build();
        final Option readTimeoutOption = Option.builder("r")
                .longOpt(READ_TIMEOUT_OPTION).argName(READ_TIMEOUT_OPTION)
                .hasArg()
                .desc(String.format("timeout for each socket read in milliseconds, 0 waits forever.%nDefault: %d",
                        READ_TIMEOUT_DEFAULT))
                .type(Integer.class)
                .build();
        final Option maxFrameOption = Option.builder("m")
                .longOpt(MAX_FRAME_OPTION).argName(MAX_FRAME_OPTION)
                .hasArg()
                .desc("largest response body in bytes the client will read.\nDefault: unlimited")
                .type(Long.class)
                .build();

        options.addOption(helpOption);
        options.addOption(connectTimeoutOption);
        options.addOption(readTimeoutOption);
        options.addOption(maxFrameOption);

        final String usage = String.format("java -cp target/rpc-stub-1.0-SNAPSHOT-jar-with-dependencies.jar %s "
                + "[options] <host> <port>", program);
        final CommandLineParser parser = new DefaultParser();
        try {
            final CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("h")) {
                // automatically generate the help statement
                final HelpFormatter formatter = new HelpFormatter();
                formatter.printHelp(usage, options);
                return null;
            }

            final List<String> positional = cmd.getArgList();
            if (positional.size() != 2) {
                System.out.println("Usage: " + usage);
                return null;
            }
            final int port;
            try {
                port = Integer.parseInt(positional.get(1));
            } catch (final NumberFormatException e) {
                System.out.println("Invalid port number.");
                return null;
            }
            if (port < 0 || port > 65535) {
                System.out.println("Invalid port number.");
                return null;
            }

            int connectTimeoutMs = CONNECT_TIMEOUT_DEFAULT;
            int readTimeoutMs = READ_TIMEOUT_DEFAULT;
            long maxFrameLength = FrameChannel.UNLIMITED;
            if (cmd.hasOption(CONNECT_TIMEOUT_OPTION)) {
                connectTimeoutMs = Integer.parseInt(cmd.getOptionValue(CONNECT_TIMEOUT_OPTION));
            }
            if (cmd.hasOption(READ_TIMEOUT_OPTION)) {
                readTimeoutMs = Integer.parseInt(cmd.getOptionValue(READ_TIMEOUT_OPTION));
            }
            if (cmd.hasOption(MAX_FRAME_OPTION)) {
                maxFrameLength = Long.parseLong(cmd.getOptionValue(MAX_FRAME_OPTION));
            }
            if (connectTimeoutMs < 0 || readTimeoutMs < 0 || (maxFrameLength < 0 && maxFrameLength != FrameChannel.UNLIMITED)) {
                System.out.println("Timeouts and frame limit must not be negative.");
                return null;
            }
            return new RunnerOptions(positional.get(0), port, connectTimeoutMs, readTimeoutMs, maxFrameLength);
        } catch (final ParseException | NumberFormatException e) {
            System.out.println("Failed to parse command line: " + e.getMessage());
            return null;
        }
    }
}
