/** Parsing of floating-point literals. */
package uk.co.farowl.ordfloat.stringlib;
