/**
 * The {@code kind} package abstracts over the floating-point types the
 * wrappers may hold.
 */
package uk.co.farowl.ordfloat.kind;
