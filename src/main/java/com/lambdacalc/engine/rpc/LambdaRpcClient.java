package com.lambdacalc.engine.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.*;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lambda RPC client.
 *
 * - reconnect-per-request transport
 * - responses returned as-is ({"id","ok","result"|"error"})
 */
public final class LambdaRpcClient {

    private static final ObjectMapper om = new ObjectMapper();

    private final String host;
    private final int port;
    private final AtomicLong nextId = new AtomicLong(1);
    private int timeoutMs = 30_000;

    public LambdaRpcClient(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }

    public boolean ping() throws IOException {
        JsonNode resp = call("ping", null);
        return resp.path("ok").asBoolean(false) && "pong".equals(resp.path("result").asText());
    }

    /** @param maxSteps 0 to use the server's own limit */
    public JsonNode evaluate(String expression, int maxSteps) throws IOException {
        ObjectNode args = om.createObjectNode();
        args.put("expression", expression);
        if (maxSteps > 0) args.put("maxSteps", maxSteps);
        return call("evaluate", args);
    }

    public JsonNode examples() throws IOException {
        return call("examples", null);
    }

    public JsonNode definitions() throws IOException {
        return call("definitions", null);
    }

    public JsonNode call(String method, JsonNode args) throws IOException {
        ObjectNode req = om.createObjectNode();
        req.put("id", nextId.getAndIncrement());
        req.put("method", method);
        if (args != null) req.set("args", args);

        try (Socket socket = new Socket(host, port);
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {

            socket.setTcpNoDelay(true);
            socket.setSoTimeout(timeoutMs);

            Frames.write(out, om.writeValueAsBytes(req));
            out.flush();

            byte[] payload = Frames.read(in);
            if (payload == null) throw new EOFException("server closed connection without a response");
            return om.readTree(payload);
        }
    }
}
