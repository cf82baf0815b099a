// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import uk.co.farowl.ordfloat.TotalOrderFloat;
import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * Deserialiser of {@link TotalOrderFloat}, which wraps whatever number
 * it reads, without validation. The number is read as Jackson reads a
 * {@code Float} or {@code Double}, so the textual forms Jackson accepts
 * for NaN and the infinities are accepted too.
 *
 * @param <T> boxed type of the wrapped value
 */
class TotalOrderFloatDeserializer<T extends Number>
        extends StdScalarDeserializer<TotalOrderFloat<T>> {
    private static final long serialVersionUID = 1L;

    private final FloatKind<T> kind;

    TotalOrderFloatDeserializer(FloatKind<T> kind) {
        super(TotalOrderFloat.class);
        this.kind = kind;
    }

    @Override
    public TotalOrderFloat<T> deserialize(JsonParser p,
            DeserializationContext ctxt) throws IOException {
        T v = ctxt.readValue(p, kind.type());
        return TotalOrderFloat.of(kind, v);
    }
}
