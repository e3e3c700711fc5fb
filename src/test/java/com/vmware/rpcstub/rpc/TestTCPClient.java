/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestTCPClient {
    private StubServer server;
    private TCPClient client;

    @BeforeEach
    public void setUp() throws IOException {
        this.server = new StubServer();
        this.client = new TCPClient(this.server.host(), this.server.port());
    }

    @AfterEach
    public void tearDown() throws IOException {
        this.client.disconnect();
        this.server.close();
    }

    @Test
    public void testBasicCalls() throws RPCException {
        this.client.connect();
        assertTrue(this.client.isConnected());

        assertEquals(15, this.client.call("add", 10, 5).intValue());
        assertEquals("hello", this.client.call("echo", "hello").textValue());
        assertEquals(14, this.client.call("sum_array", Arrays.asList(1, 2, 3, 4, 5, -1)).intValue());
        assertEquals("Hello, World!", this.client.callAs(String.class, "greet", "World"));
        assertEquals(Boolean.FALSE, this.client.callAs(Boolean.class, "is_positive", -2.5));
    }

    @Test
    public void testComplexValues() throws RPCException {
        this.client.connect();

        final Map<String, Object> person = new LinkedHashMap<>();
        person.put("name", "Alice");
        person.put("age", 30);
        person.put("is_student", false);
        assertEquals("Processed person: Alice, age 30, is not a student.",
                this.client.callAs(String.class, "process_person", person));

        final JsonNode greetings = this.client.call("get_greetings", Arrays.asList("Bob", "Charlie"));
        assertEquals(2, greetings.size());
        assertEquals("Hello, Bob!", greetings.get(0).textValue());
        assertEquals("Hello, Charlie!", greetings.get(1).textValue());

        final List<?> echoed = this.client.callAs(List.class, "echo", Arrays.asList(1, "two", null, true));
        assertEquals(Arrays.asList(1, "two", null, true), echoed);
    }

    @Test
    public void testNoReturnValue() throws RPCException {
        this.client.connect();
        final JsonNode res = this.client.call("no_return");
        assertTrue(res.isMissingNode());
        assertNull(this.client.callAs(Object.class, "no_return"));
    }

    @Test
    public void testPayloadFidelity() throws RPCException {
        this.client.connect();
        final String text = "quotes \" backslash \\ newline \n unicode ü 😀";
        assertEquals(text, this.client.call("echo", text).textValue());

        final char[] big = new char[100000];
        Arrays.fill(big, 'x');
        assertEquals(big.length, this.client.call("echo", new String(big)).textValue().length());
    }

    @Test
    public void testCallBeforeConnect() {
        final ConnectionException e = assertThrows(ConnectionException.class, () -> this.client.call("add", 1, 2));
        assertNull(e.phase());
        assertFalse(this.client.isConnected());
        assertEquals(0, this.server.clientsAccepted());
        assertEquals(0, this.server.requestsReceived());
    }

    @Test
    public void testConnectIsIdempotent() throws Exception {
        this.client.connect();
        this.client.connect();
        assertEquals(3, this.client.call("add", 1, 2).intValue());
        assertEquals(1, this.server.clientsAccepted());
    }

    @Test
    public void testDisconnectIsIdempotent() {
        // Never opened
        this.client.disconnect();
        this.client.disconnect();
        assertFalse(this.client.isConnected());

        assertDoesNotThrow(() -> this.client.connect());
        this.client.disconnect();
        this.client.disconnect();
        assertFalse(this.client.isConnected());
    }

    @Test
    public void testServerErrors() throws RPCException {
        this.client.connect();

        final FunctionNotFoundException nf = assertThrows(FunctionNotFoundException.class,
            () -> this.client.call("nonexistent_function", 1, 2, 3));
        assertTrue(nf.getMessage().contains("nonexistent_function"));

        final RPCExecutionException ex = assertThrows(RPCExecutionException.class,
            () -> this.client.call("divide", 10, 0));
        assertTrue(ex.getMessage().contains("Division by zero"));

        assertThrows(RPCExecutionException.class, () -> this.client.call("add", 1, 2, 3, 4, 5));
        assertThrows(RPCExecutionException.class, () -> this.client.call("add"));
        assertThrows(RPCExecutionException.class, () -> this.client.call("add", "string", true));

        this.server.scriptBody("{\"status\":\"error\",\"message\":\"Server busy\"}".getBytes(StandardCharsets.UTF_8));
        final RPCException other = assertThrows(RPCException.class, () -> this.client.call("add", 1, 1));
        assertEquals(RPCException.class, other.getClass());

        // Server errors leave the connection usable
        assertTrue(this.client.isConnected());
        assertEquals(2, this.client.call("add", 1, 1).intValue());
    }

    @Test
    public void testMarshalingFailureSendsNothing() throws Exception {
        this.client.connect();
        assertThrows(MarshalingException.class, () -> this.client.call("echo", new Object()));
        assertTrue(this.client.isConnected());

        assertEquals("ok", this.client.call("echo", "ok").textValue());
        assertEquals(1, this.server.requestsReceived());
    }

    @Test
    public void testProtocolViolationKeepsConnection() throws RPCException {
        this.client.connect();
        this.server.scriptBody("this is not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(ProtocolException.class, () -> this.client.call("add", 1, 2));

        this.server.scriptBody(new byte[] {(byte) 0xFF, (byte) 0xFE});
        assertThrows(ProtocolException.class, () -> this.client.call("add", 1, 2));

        assertTrue(this.client.isConnected());
        assertEquals(3, this.client.call("add", 1, 2).intValue());
    }

    @Test
    public void testPeerClosesMidFrame() throws RPCException {
        this.client.connect();
        this.server.scriptRawAndClose(new byte[] {0, 0, 0, 20, '{', '"'});

        final ConnectionException e = assertThrows(ConnectionException.class, () -> this.client.call("add", 1, 2));
        assertEquals(ConnectionException.PHASE_RECV, e.phase());
        assertTrue(e.getMessage().startsWith("Socket error during recv"));
        assertFalse(this.client.isConnected());

        // Calls fail fast until the caller reconnects
        assertThrows(ConnectionException.class, () -> this.client.call("add", 1, 2));

        this.client.connect();
        assertEquals(30, this.client.call("add", 10, 20).intValue());
        assertEquals(2, this.server.clientsAccepted());
    }

    @Test
    public void testPeerClosesBeforeReply() throws RPCException {
        this.client.connect();
        this.server.scriptRawAndClose(new byte[0]);

        assertThrows(ConnectionException.class, () -> this.client.call("echo", "x"));
        assertFalse(this.client.isConnected());
    }

    @Test
    public void testOversizedReplyDisconnects() throws Exception {
        final TCPClient limited = new TCPClient(this.server.host(), this.server.port(),
                TCPClient.NO_TIMEOUT, TCPClient.NO_TIMEOUT, 64);
        limited.connect();
        try {
            assertEquals("short", limited.call("echo", "short").textValue());

            final char[] big = new char[64];
            Arrays.fill(big, 'y');
            assertThrows(ProtocolException.class, () -> limited.call("echo", new String(big)));
            assertFalse(limited.isConnected());
        } finally {
            limited.disconnect();
        }
    }

    @Test
    public void testReadTimeout() throws Exception {
        final TCPClient impatient = new TCPClient(this.server.host(), this.server.port(),
                TCPClient.NO_TIMEOUT, 200, FrameChannel.UNLIMITED);
        impatient.connect();
        this.server.script(out -> {
            try {
                Thread.sleep(1000);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return false;
        });
        final ConnectionException e = assertThrows(ConnectionException.class, () -> impatient.call("add", 1, 2));
        assertEquals(ConnectionException.PHASE_RECV, e.phase());
        assertFalse(impatient.isConnected());
    }

    @Test
    public void testConnectFailure() throws IOException {
        final int port;
        try (ServerSocket unused = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = unused.getLocalPort();
        }
        final TCPClient nobody = new TCPClient(InetAddress.getLoopbackAddress(), port);

        final ConnectionException e = assertThrows(ConnectionException.class, nobody::connect);
        assertEquals(ConnectionException.PHASE_CONNECT, e.phase());
        assertNotNull(e.getCause());
        assertFalse(nobody.isConnected());
        nobody.disconnect();
    }

    @Test
    public void testScopedAcquisition() throws RPCException {
        final TCPClient scoped = new TCPClient(this.server.host(), this.server.port());
        try (RPCClient c = scoped.open()) {
            assertTrue(scoped.isConnected());
            assertEquals(15, c.call("add", 10, 5).intValue());
        }
        assertFalse(scoped.isConnected());

        assertThrows(FunctionNotFoundException.class, () -> {
            try (RPCClient c = scoped.open()) {
                c.call("missing");
            }
        });
        assertFalse(scoped.isConnected());
    }

    @Test
    public void testInvalidPort() {
        assertThrows(IllegalArgumentException.class, () -> new TCPClient("localhost", 70000));
        assertThrows(IllegalArgumentException.class, () -> new TCPClient("localhost", -1));
    }
}
