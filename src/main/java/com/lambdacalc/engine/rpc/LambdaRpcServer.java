package com.lambdacalc.engine.rpc;

import com.lambdacalc.debug.Debug;
import com.lambdacalc.engine.EvaluationResult;
import com.lambdacalc.engine.EvaluationStep;
import com.lambdacalc.engine.EvaluatorConfig;
import com.lambdacalc.engine.LambdaEngine;
import com.lambdacalc.engine.format.PrintOptions;
import com.lambdacalc.engine.format.TermFormatter;
import com.lambdacalc.engine.parser.ParseError;
import com.lambdacalc.engine.reduce.Definitions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.*;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Framed-JSON RPC front end for the evaluator:
 * Frame = uint32_be length + UTF-8 JSON payload
 *
 * Supports:
 *  - {"id":..,"method":"evaluate","args":{"expression":"+ 2 3","maxSteps":100}}
 *    Response: {"ok":true,"result":{"steps":[...],"final_expression":..,"abstracted":..,...}}
 *  - examples, definitions, ping
 *
 * Every connection is served on the pool; evaluation shares nothing but the
 * immutable definitions table.
 */
public final class LambdaRpcServer implements Closeable {

    private static final String TAG = Debug.RPC;

    private final ObjectMapper om = new ObjectMapper();
    private final int port;
    private final ExecutorService pool;
    private final EvaluatorConfig config;
    private final LambdaEngine engine;
    private final TermFormatter formatter = new TermFormatter(PrintOptions.PLAIN);
    private volatile boolean running = true;
    private ServerSocket serverSocket;

    public LambdaRpcServer(int port, int threads, EvaluatorConfig config) {
        this.port = port;
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        this.config = config == null ? EvaluatorConfig.defaults() : config;
        this.engine = new LambdaEngine(this.config.buildDefinitions());
    }

    /** Binds the listening socket and returns the actual port (useful with port 0). */
    public int bind() throws IOException {
        serverSocket = new ServerSocket(port);
        Debug.get().i(TAG, "RPC listening on port " + serverSocket.getLocalPort());
        return serverSocket.getLocalPort();
    }

    public int getLocalPort() {
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    /** Accept loop; returns once {@link #close()} is called. */
    public void serve() throws IOException {
        if (serverSocket == null) bind();
        while (running) {
            Socket s;
            try {
                s = serverSocket.accept();
            } catch (SocketException e) {
                if (!running) return;
                throw e;
            }
            s.setTcpNoDelay(true);
            pool.submit(() -> handleClient(s));
        }
    }

    public void start() throws IOException {
        bind();
        serve();
    }

    private void handleClient(Socket s) {
        String peer = String.valueOf(s.getRemoteSocketAddress());
        Debug.get().d(TAG, "client connected: " + peer);

        try (Socket socket = s;
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {

            while (running) {
                byte[] payload = Frames.read(in);
                if (payload == null) break; // EOF

                JsonNode req = om.readTree(payload);
                ObjectNode resp = process(req);

                Frames.write(out, om.writeValueAsBytes(resp));
                out.flush();
            }

        } catch (IOException e) {
            Debug.get().w(TAG, "client error " + peer + " : " + e.getMessage());
        } finally {
            Debug.get().d(TAG, "client disconnected: " + peer);
        }
    }

    ObjectNode process(JsonNode req) {
        ObjectNode resp = om.createObjectNode();
        JsonNode id = req == null ? null : req.get("id");
        if (id != null) resp.set("id", id);

        if (req == null || !req.isObject()) {
            resp.put("ok", false);
            resp.put("error", "Request must be a JSON object");
            return resp;
        }

        String method = req.path("method").asText("");

        // Support both "args" and "params"
        JsonNode args = req.has("args") ? req.get("args") : req.get("params");

        try {
            switch (method) {
                case "evaluate":
                    return evaluate(resp, args);

                case "examples":
                    resp.put("ok", true);
                    resp.set("result", examples());
                    break;

                case "definitions": {
                    ObjectNode defs = om.createObjectNode();
                    Definitions table = engine.definitions();
                    for (String name : table.names()) {
                        defs.put(name, formatter.format(table.lookup(name)));
                    }
                    resp.put("ok", true);
                    resp.set("result", defs);
                    break;
                }

                case "ping":
                    resp.put("ok", true);
                    resp.put("result", "pong");
                    break;

                default:
                    resp.put("ok", false);
                    resp.put("error", "Unknown method: " + method);
                    break;
            }
        } catch (StackOverflowError e) {
            Debug.get().w(TAG, method + ": term nests too deeply");
            resp.put("ok", false);
            resp.put("error", "Evaluation error: term nests too deeply");
        } catch (RuntimeException e) {
            Debug.get().e(TAG, method + " failed", e);
            resp.put("ok", false);
            resp.put("error", "Evaluation error: " + e);
        }

        return resp;
    }

    private ObjectNode evaluate(ObjectNode resp, JsonNode args) {
        String expression = (args != null && args.hasNonNull("expression"))
                ? args.get("expression").asText("").trim()
                : "";
        if (expression.isEmpty()) {
            resp.put("ok", false);
            resp.put("error", "Please enter a lambda expression");
            return resp;
        }

        int limit = config.maxSteps;
        int requested = args.path("maxSteps").asInt(0);
        if (requested > 0) limit = limit > 0 ? Math.min(limit, requested) : requested;

        EvaluationResult result;
        try {
            result = engine.evaluate(expression, limit);
        } catch (ParseError e) {
            resp.put("ok", false);
            resp.put("error", "Parse error: " + e.getMessage());
            resp.put("position", e.position());
            return resp;
        }

        ObjectNode out = om.createObjectNode();
        out.put("input", expression);

        ArrayNode steps = out.putArray("steps");
        for (EvaluationStep step : result.steps()) {
            ObjectNode s = steps.addObject();
            s.put("step", step.index());
            s.put("expression", formatter.format(step.term()));
            s.put("type", step.typeLabel());
        }

        out.put("final_expression", formatter.format(result.finalTerm()));
        if (config.abstractNumerals) out.put("abstracted", formatter.format(result.abstracted()));
        else out.putNull("abstracted");
        out.put("total_steps", result.totalSteps());
        out.put("beta_steps", result.betaSteps());
        out.put("delta_steps", result.deltaSteps());
        out.put("normal_form", result.normalForm());

        resp.put("ok", true);
        resp.set("result", out);
        return resp;
    }

    private ArrayNode examples() {
        ArrayNode list = om.createArrayNode();
        addExample(list, "Identity Function", "(λx.x) (λy.y)", "Applies the identity function to another identity function");
        addExample(list, "Simple Arithmetic", "+ 2 3", "Addition of Church numerals 2 and 3");
        addExample(list, "Multiplication", "* 2 3", "Multiplication of Church numerals 2 and 3");
        addExample(list, "Subtraction", "- 5 2", "Truncated subtraction of Church numerals");
        addExample(list, "Boolean True", "⊤ 5 7", "Boolean true chooses the first argument");
        addExample(list, "Boolean False", "⊥ 5 7", "Boolean false chooses the second argument");
        addExample(list, "Comparison", "≤ 2 5", "Less-or-equal on Church numerals yields a boolean");
        addExample(list, "Pairs", "pair 1 2 ⊤", "Builds a pair and selects its first component");
        return list;
    }

    private void addExample(ArrayNode list, String name, String expression, String description) {
        ObjectNode ex = list.addObject();
        ex.put("name", name);
        ex.put("expression", expression);
        ex.put("description", description);
    }

    @Override
    public void close() throws IOException {
        running = false;
        if (serverSocket != null) serverSocket.close();
        pool.shutdownNow();
    }

    public static void main(String[] args) throws Exception {
        Debug.useSlf4j();

        Map<String, String> flags = parseArgs(args);
        int port = Integer.parseInt(flags.getOrDefault("port", "7777"));
        int threads = Integer.parseInt(flags.getOrDefault("threads", "4"));

        EvaluatorConfig config = flags.containsKey("config")
                ? EvaluatorConfig.load(Path.of(flags.get("config")), new ObjectMapper())
                : EvaluatorConfig.defaults();
        if (flags.containsKey("maxSteps")) config.applyFlag("maxSteps", flags.get("maxSteps"));

        try (LambdaRpcServer server = new LambdaRpcServer(port, threads, config)) {
            server.start();
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        for (String a : args) {
            if (!a.startsWith("--")) continue;
            int eq = a.indexOf('=');
            if (eq < 0) m.put(a.substring(2), "true");
            else m.put(a.substring(2, eq), a.substring(eq + 1));
        }
        return m;
    }
}
