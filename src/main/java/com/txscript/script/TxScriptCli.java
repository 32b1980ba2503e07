package com.txscript.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.txscript.bus.LoggingCanBus;
import com.txscript.debug.Debug;
import com.txscript.script.error.ScriptError;
import com.txscript.script.error.ScriptErrorLog;
import com.txscript.script.parser.ParseResult;
import com.txscript.script.runtime.ExecutionState;
import com.txscript.script.runtime.ScriptExecutor;
import com.txscript.script.runtime.ScriptLogEntry;
import com.txscript.script.time.EventLoopScheduler;
import com.txscript.script.time.SystemMonotonicClock;

/**
 * Command line front end.
 *
 * <pre>
 *   TxScriptCli check &lt;file&gt; [--json]
 *   TxScriptCli run &lt;file&gt; [--ports 1,2] [--config options.json] [--duration ms]
 * </pre>
 *
 * {@code run} sends to a bus that only logs, which is enough to dry-run a script.
 */
public final class TxScriptCli {

    private static final String USAGE =
            "Usage: TxScriptCli check <file> [--json]\n"
          + "       TxScriptCli run <file> [--ports 1,2] [--config options.json] [--duration ms]";

    public static void main(String[] args) {
        Debug.useSysOut();
        System.exit(execute(args));
    }

    /** Run the CLI and return the process exit code. */
    static int execute(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            return 2;
        }
        String command = args[0];
        if (!command.equals("check") && !command.equals("run")) {
            System.err.println("Unknown command: " + command);
            System.err.println(USAGE);
            return 2;
        }
        Path scriptPath = Path.of(args[1]);

        boolean json = false;
        List<Integer> ports = null;
        Path config = null;
        long durationMillis = 0;
        try {
            for (int i = 2; i < args.length; i++) {
                switch (args[i]) {
                    case "--json":
                        json = true;
                        break;
                    case "--ports":
                        ports = parsePorts(requireValue(args, ++i, "--ports"));
                        break;
                    case "--config":
                        config = Path.of(requireValue(args, ++i, "--config"));
                        break;
                    case "--duration":
                        durationMillis = Long.parseLong(requireValue(args, ++i, "--duration"));
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 2;
        }

        final String source;
        final TxScriptOptions options;
        try {
            source = Files.readString(scriptPath, StandardCharsets.UTF_8);
            options = (config == null) ? new TxScriptOptions() : TxScriptOptions.load(config);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Failed to read input: " + e.getMessage());
            return 3;
        }

        TxScript engine = new TxScript(options);
        return command.equals("check") ? check(engine, source, json) : run(engine, source, ports, durationMillis);
    }

    private static int check(TxScript engine, String source, boolean json) {
        ParseResult result = engine.parse(source);
        if (json) {
            System.out.println(ScriptErrorLog.toJson(result.errors()));
        } else if (!result.hasErrors()) {
            System.out.println("OK");
        } else {
            for (ScriptError e : result.errors()) {
                System.out.println(e);
            }
        }
        return result.hasErrors() ? 1 : 0;
    }

    private static int run(TxScript engine, String source, List<Integer> ports, long durationMillis) {
        LoggingCanBus bus = new LoggingCanBus();
        try (EventLoopScheduler scheduler = new EventLoopScheduler("txscript-loop")) {
            ScriptExecutor executor = engine.newExecutor(bus, scheduler, SystemMonotonicClock.INSTANCE);
            CountDownLatch finished = new CountDownLatch(1);
            ScriptExecutor.StateListener onEnd = (previous, current) -> {
                if (current != ExecutionState.RUNNING && current != ExecutionState.PAUSED) finished.countDown();
            };
            Consumer<ScriptLogEntry> printer = entry -> System.out.println(entry);
            executor.addStateListener(onEnd);
            executor.log().addListener(printer);
            try {
                if (!executor.start(source, ports)) {
                    return 1;
                }
                try {
                    if (durationMillis > 0) {
                        finished.await(durationMillis, TimeUnit.MILLISECONDS);
                    } else {
                        finished.await();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                executor.stop();
                return executor.errors().isEmpty() ? 0 : 1;
            } finally {
                executor.log().removeListener(printer);
                executor.removeStateListener(onEnd);
            }
        }
    }

    private static String requireValue(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException(option + " needs a value");
        return args[i];
    }

    private static List<Integer> parsePorts(String csv) {
        List<Integer> out = new ArrayList<>();
        for (String part : csv.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            out.add(Integer.parseInt(p));
        }
        if (out.isEmpty()) throw new IllegalArgumentException("--ports needs at least one port");
        return out;
    }

    private TxScriptCli() {}
}
