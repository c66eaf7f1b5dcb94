package com.rusttrace.adapter.static_analysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Orchestrates the full static analysis pass.
 * Produces a StaticTrace from the crate's entry file and every module file reachable from it.
 */
public class StaticAnalyzer {

    static final String MAIN_FILE = "main.rs";
    static final String LIB_FILE = "lib.rs";

    /**
     * Analyses the crate rooted at {@code sourceDir}, starting from main.rs, or lib.rs when
     * {@code lib} is set.
     *
     * @throws AnalysisException if the entry file cannot be read or its tree is inconsistent
     */
    public StaticTrace analyze(Path sourceDir, boolean lib) {
        return analyzeFile(sourceDir.resolve(lib ? LIB_FILE : MAIN_FILE));
    }

    /**
     * Analyses a single entry file and the module files it declares.
     */
    public StaticTrace analyzeFile(Path entryFile) {
        TraceExtractor extractor = new TraceExtractor(entryFile, NamespaceContext.EMPTY);
        try {
            extractor.parseFile();
        } catch (IOException | UncheckedIOException e) {
            throw new AnalysisException("Could not read entry file " + entryFile + ": " + e.getMessage(), e);
        }
        return new StaticTrace(extractor.takeTraceableNodes());
    }
}
