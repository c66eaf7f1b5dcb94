package com.rusttrace.adapter.static_analysis;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts trace references and exclusion justifications from comment text.
 *
 * <pre>
 *   // lobster-trace: Parser.tokens      -> ref "req Parser.tokens"
 *   // lobster-exclude: generated_code   -> justification "generated_code"
 * </pre>
 */
public class AnnotationScanner {

    static final String REF_PREFIX = "req ";

    private static final Pattern TRACE = Pattern.compile("lobster-trace: (?<ref>[A-Za-z0-9._-]+)");
    private static final Pattern EXCLUDE = Pattern.compile("lobster-exclude: (?<just>[A-Za-z0-9._-]+)");

    /**
     * Appends every match in {@code commentText} to {@code target}. Both markers are checked,
     * so one comment can contribute a reference and a justification.
     */
    public void scan(String commentText, TraceableNode target) {
        Matcher trace = TRACE.matcher(commentText);
        while (trace.find()) {
            target.addRef(REF_PREFIX + trace.group("ref"));
        }
        Matcher exclude = EXCLUDE.matcher(commentText);
        while (exclude.find()) {
            target.addJustification(exclude.group("just"));
        }
    }
}
