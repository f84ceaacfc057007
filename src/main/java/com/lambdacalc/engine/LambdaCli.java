package com.lambdacalc.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lambdacalc.debug.Debug;
import com.lambdacalc.engine.format.TermFormatter;
import com.lambdacalc.engine.parser.ParseError;
import com.lambdacalc.engine.reduce.Definitions;

/**
 * Command-line front end.
 *
 * <pre>
 *   LambdaCli [--config=path] [--key=value ...] [expression words ...]
 * </pre>
 *
 * With an expression, prints its reduction trace and exits. Without one, reads
 * expressions line by line ({@code :defs} lists definitions, {@code :quit} exits).
 * Exit status: 0 ok, 1 parse/evaluation error, 2 usage or config error.
 */
public final class LambdaCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String TAG = Debug.CLI;
    private static final String PROMPT = "λ‑expr> ";

    private final EvaluatorConfig config;
    private final LambdaEngine engine;
    private final TermFormatter formatter;
    private final PrintStream out;
    private final PrintStream err;

    LambdaCli(EvaluatorConfig config, LambdaEngine engine, PrintStream out, PrintStream err) {
        this.config = config;
        this.engine = engine;
        this.formatter = new TermFormatter(config.printOptions());
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        Debug.useSlf4j();
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        String configPath = null;
        List<String[]> flags = new ArrayList<>();
        List<String> words = new ArrayList<>();

        for (String arg : args) {
            if (arg.startsWith("--")) {
                String body = arg.substring(2);
                int eq = body.indexOf('=');
                String key = eq >= 0 ? body.substring(0, eq) : body;
                String value = eq >= 0 ? body.substring(eq + 1) : "";
                if (key.equals("help")) {
                    printUsage(out);
                    return EXIT_OK;
                }
                if (key.equals("config")) configPath = value;
                else flags.add(new String[] { key, value });
            } else {
                words.add(arg);
            }
        }

        EvaluatorConfig config;
        Definitions definitions;
        try {
            config = configPath != null
                    ? EvaluatorConfig.load(Path.of(configPath), new ObjectMapper())
                    : EvaluatorConfig.defaults();
            for (String[] f : flags) config.applyFlag(f[0], f[1]);
            config.validate();
            definitions = config.buildDefinitions();
        } catch (IOException e) {
            err.println("Failed to read config file: " + configPath + " (" + e.getMessage() + ")");
            return EXIT_USAGE;
        } catch (ParseError e) {
            err.println("Parse error in definitions: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println(e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        LambdaCli cli = new LambdaCli(config, new LambdaEngine(definitions), out, err);
        if (!words.isEmpty()) {
            return cli.evaluateOnStack(String.join(" ", words));
        }
        return cli.interactive(in);
    }

    private static void printUsage(PrintStream ps) {
        ps.println("Usage: LambdaCli [--config=file.json] [--maxSteps=N] [--compact=bool] [--colorParens=bool]");
        ps.println("                 [--colorDiff=bool] [--showStepType=bool] [--abstractNumerals=bool]");
        ps.println("                 [--stackSizeMb=N] [--define=name=source ...] [expression]");
    }

    // -----------------------------
    // Modes
    // -----------------------------

    int interactive(InputStream in) {
        BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print(PROMPT);
            out.flush();

            String line;
            try {
                line = br.readLine();
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return EXIT_ERROR;
            }
            if (line == null) {
                out.println();
                return EXIT_OK;
            }

            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.equals(":quit") || line.equals(":q")) return EXIT_OK;
            if (line.equals(":defs")) {
                printDefinitions();
                continue;
            }
            evaluateOnStack(line);
        }
    }

    private void printDefinitions() {
        Definitions defs = engine.definitions();
        for (String name : defs.names()) {
            out.println(name + " = " + formatter.format(defs.lookup(name)));
        }
    }

    /**
     * Evaluates on a dedicated thread so the configured stack size, not the
     * main thread's, bounds how deep a term may nest.
     */
    int evaluateOnStack(String source) {
        AtomicInteger status = new AtomicInteger(EXIT_ERROR);
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread worker = new Thread(null, () -> {
            try {
                status.set(evaluateAndPrint(source));
            } catch (StackOverflowError e) {
                err.println("Evaluation error: term nests too deeply for a " + config.stackSizeMb
                        + " MB stack (raise --stackSizeMb)");
            } catch (RuntimeException e) {
                failure.set(e);
            }
        }, "lambda-eval", config.stackSizeMb * 1024L * 1024L);

        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.interrupt();
            return EXIT_ERROR;
        }

        if (failure.get() != null) {
            Debug.get().e(TAG, "Evaluation failed", failure.get());
            err.println("Evaluation error: " + failure.get());
            return EXIT_ERROR;
        }
        return status.get();
    }

    private int evaluateAndPrint(String source) {
        final String[] previous = new String[1];
        EvaluationResult result;
        try {
            result = engine.evaluate(source, config.maxSteps, step -> {
                String rendered = formatter.format(step.term());
                if (step.isInitial()) {
                    out.println("Step 0: " + rendered);
                } else {
                    rendered = formatter.highlightDiff(previous[0], rendered);
                    out.println("Step " + step.index() + formatter.stepLabel(step.kind()) + ": " + rendered);
                }
                previous[0] = rendered;
            });
        } catch (ParseError e) {
            out.println("Parse error: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (result.normalForm()) {
            out.println("→ normal form reached.");
        } else {
            out.println("→ step limit reached after " + result.totalSteps() + " steps.");
        }

        if (config.abstractNumerals) {
            out.println();
            out.println("δ‑abstracted: " + formatter.format(result.abstracted()));
            out.println();
        }
        return EXIT_OK;
    }
}
