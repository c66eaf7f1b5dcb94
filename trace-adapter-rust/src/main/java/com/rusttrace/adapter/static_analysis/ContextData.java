package com.rusttrace.adapter.static_analysis;

/**
 * Scoping information carried by CONTEXT nodes (inline modules and impl blocks).
 *
 * @param namespace        namespace segments contributed to enclosed items
 * @param traitImplemented trait name for {@code impl Trait for Type} blocks, otherwise null.
 *                         Kept for diagnostics only; it is not part of the output.
 */
public record ContextData(NamespaceContext namespace, String traitImplemented) {
}
