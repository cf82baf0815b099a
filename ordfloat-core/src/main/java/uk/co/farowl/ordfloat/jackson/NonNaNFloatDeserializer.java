// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import uk.co.farowl.ordfloat.FloatIsNaNException;
import uk.co.farowl.ordfloat.NonNaNFloat;
import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * Deserialiser of {@link NonNaNFloat}, which checks the number it reads
 * is not NaN. A NaN is reported as an invalid value through
 * {@link DeserializationContext#weirdNumberException(Number, Class, String)},
 * rather than as a {@link FloatIsNaNException}.
 *
 * @param <T> boxed type of the wrapped value
 */
class NonNaNFloatDeserializer<T extends Number>
        extends StdScalarDeserializer<NonNaNFloat<T>> {
    private static final long serialVersionUID = 1L;

    /** What we expected, for the message when we get NaN. */
    static final String EXPECTED = "float (but not NaN)";

    private final FloatKind<T> kind;

    NonNaNFloatDeserializer(FloatKind<T> kind) {
        super(NonNaNFloat.class);
        this.kind = kind;
    }

    @Override
    public NonNaNFloat<T> deserialize(JsonParser p,
            DeserializationContext ctxt) throws IOException {
        T v = ctxt.readValue(p, kind.type());
        try {
            return NonNaNFloat.of(kind, v);
        } catch (FloatIsNaNException e) {
            throw ctxt.weirdNumberException(v, handledType(), EXPECTED);
        }
    }
}
