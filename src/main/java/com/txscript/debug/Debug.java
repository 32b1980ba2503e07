package com.txscript.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all TxScript components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Defaults to SLF4J; setSink(null) silences output
 */
public final class Debug {

    private static final Debug INSTANCE = new Debug();

    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(new Slf4jDebugSink());

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Route everything to stdout/stderr, for command line tools without a logging backend. */
    public static void useSysOut() {
        INSTANCE.setSink((level, tag, message, error) -> {
            java.io.PrintStream out = (level == DebugLevel.WARN || level == DebugLevel.ERROR) ? System.err : System.out;
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        });
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
