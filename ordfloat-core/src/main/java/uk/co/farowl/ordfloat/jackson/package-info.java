/**
 * Serialisation of the wrappers by Jackson databind. Classes other than
 * {@link uk.co.farowl.ordfloat.jackson.OrderedFloatModule} are internal.
 */
package uk.co.farowl.ordfloat.jackson;
