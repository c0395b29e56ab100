package net.tickstore.core.model;

/**
 * Wire form of a 128-bit job identifier as the scheduler engine exchanges it:
 * two 64-bit halves, {@code id1} carrying the most significant bytes.
 */
public record JobUuid(long id1, long id2) {
}
