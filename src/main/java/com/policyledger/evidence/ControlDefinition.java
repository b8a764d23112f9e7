package com.policyledger.evidence;

/**
 * A compliance control evidence is collected for, e.g. {@code CC6.1} in category
 * "Logical Access".
 */
public record ControlDefinition(String controlId, String name, String category) {}
