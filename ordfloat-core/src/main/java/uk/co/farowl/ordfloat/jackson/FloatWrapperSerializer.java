// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

import uk.co.farowl.ordfloat.NonNaNFloat;
import uk.co.farowl.ordfloat.TotalOrderFloat;

/**
 * Serialiser for both wrapper types, writing the wrapped value as a
 * plain number, without any framing. A {@code float} is written as a
 * {@code float}, so that it is not widened in the text. A NaN is
 * written as the generator writes any NaN.
 */
class FloatWrapperSerializer extends StdScalarSerializer<Number> {
    private static final long serialVersionUID = 1L;

    FloatWrapperSerializer() { super(Number.class); }

    @Override
    public void serialize(Number wrapper, JsonGenerator gen,
            SerializerProvider provider) throws IOException {
        Number v = unwrap(wrapper);
        if (v instanceof Float)
            gen.writeNumber(v.floatValue());
        else
            gen.writeNumber(v.doubleValue());
    }

    /**
     * Get the value from either kind of wrapper.
     *
     * @param wrapper to unwrap
     * @return the wrapped value
     */
    private static Number unwrap(Number wrapper) {
        if (wrapper instanceof TotalOrderFloat)
            return ((TotalOrderFloat<?>)wrapper).value();
        else if (wrapper instanceof NonNaNFloat)
            return ((NonNaNFloat<?>)wrapper).value();
        else
            return wrapper;
    }
}
