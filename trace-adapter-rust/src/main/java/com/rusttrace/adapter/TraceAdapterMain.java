package com.rusttrace.adapter;

import com.rusttrace.adapter.config.TraceConfig;
import com.rusttrace.adapter.config.TraceConfigReader;
import com.rusttrace.adapter.ir.LobsterModel;
import com.rusttrace.adapter.ir.LobsterSerializer;
import com.rusttrace.adapter.ir.TraceFlattener;
import com.rusttrace.adapter.static_analysis.StaticAnalyzer;
import com.rusttrace.adapter.static_analysis.StaticTrace;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the trace-adapter-rust command line tool.
 *
 * Usage:
 *   java -jar trace-adapter-rust.jar [dir] [out] \
 *     [--lib] [--only-tagged-functions] [--activity] [--config <file>]
 *
 * {@code dir} defaults to ./src/ and {@code out} to rust.lobster. Values given on the command
 * line win over the ones from the config file.
 */
public class TraceAdapterMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[trace-adapter] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar trace-adapter-rust.jar [dir] [out] " +
                               "[--lib] [--only-tagged-functions] [--config <file>]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[trace-adapter] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        Options options = parseArgs(args);

        // 1. Static analysis
        Path sourceDir = Paths.get(options.sourceDir());
        System.err.println("[trace-adapter] Analysing " + sourceDir
                + (options.lib() ? " (library crate)" : ""));
        StaticTrace trace = new StaticAnalyzer().analyze(sourceDir, options.lib());
        System.err.println("[trace-adapter] Static analysis complete: "
                + trace.modules().size() + " source files");

        // 2. Flatten
        LobsterModel.LobsterDocument document =
                new TraceFlattener(options.onlyTaggedFunctions()).flatten(trace);

        // 3. Serialize
        new LobsterSerializer().write(document, Paths.get(options.output()));

        System.err.println("[trace-adapter] Done.");
    }

    /** Effective settings after merging the command line with the optional config file. */
    record Options(String sourceDir, String output, boolean lib, boolean onlyTaggedFunctions) {}

    static Options parseArgs(String[] args) {
        String sourceDir = null;
        String output = null;
        boolean lib = false;
        boolean onlyTagged = false;
        String configPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--lib", "-l"              -> lib = true;
                case "--only-tagged-functions" -> onlyTagged = true;
                case "--activity"              ->
                        throw new UsageException("Activity traces are not supported, only implementation traces");
                case "--config"                -> configPath = requireNext(args, i++, "--config");
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    } else if (sourceDir == null) {
                        sourceDir = args[i];
                    } else if (output == null) {
                        output = args[i];
                    } else {
                        throw new UsageException("Unexpected argument: " + args[i]);
                    }
                }
            }
        }

        TraceConfig config = configPath != null
                ? new TraceConfigReader().read(Paths.get(configPath))
                : new TraceConfig();

        return new Options(
                sourceDir != null ? sourceDir : config.getSourceDir(),
                output != null ? output : config.getOutput(),
                lib || config.isLib(),
                onlyTagged || config.isOnlyTaggedFunctions()
        );
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
