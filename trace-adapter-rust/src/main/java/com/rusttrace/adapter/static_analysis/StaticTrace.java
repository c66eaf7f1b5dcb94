package com.rusttrace.adapter.static_analysis;

import java.util.List;

/**
 * Result of the static analysis pass: one SOURCE root per analysed file,
 * the entry file first, then module files in declaration order.
 */
public record StaticTrace(List<TraceableNode> modules) {
}
