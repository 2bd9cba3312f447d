package com.zenlib.expression.intern;

/**
 * Result of {@link InternTable#getOrCreate}: the canonical {@code instance} and whether this call created it.
 */
public record Interned<V>(boolean isNew, V instance) {}
