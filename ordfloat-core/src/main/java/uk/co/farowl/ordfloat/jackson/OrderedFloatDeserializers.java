// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.jackson;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.deser.Deserializers;

import uk.co.farowl.ordfloat.NonNaNFloat;
import uk.co.farowl.ordfloat.TotalOrderFloat;
import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * Look-up of deserialisers for the wrapper types, choosing the
 * {@link FloatKind} from the type argument: {@code Float} gives
 * {@link FloatKind#FLOAT32}, and anything else (including a raw or
 * wildcard type) gives {@link FloatKind#FLOAT64}.
 */
class OrderedFloatDeserializers extends Deserializers.Base {

    @Override
    public JsonDeserializer<?> findBeanDeserializer(JavaType type,
            DeserializationConfig config, BeanDescription beanDesc) {
        if (type.hasRawClass(TotalOrderFloat.class))
            return totalOrder(kindOf(type));
        else if (type.hasRawClass(NonNaNFloat.class))
            return nonNaN(kindOf(type));
        else
            return null;
    }

    private static <T extends Number> JsonDeserializer<?> totalOrder(
            FloatKind<T> kind) {
        return new TotalOrderFloatDeserializer<T>(kind);
    }

    private static <T extends Number> JsonDeserializer<?> nonNaN(
            FloatKind<T> kind) {
        return new NonNaNFloatDeserializer<T>(kind);
    }

    /**
     * Choose the kind from the first type argument of a wrapper type.
     *
     * @param type of the wrapper
     * @return kind for the type argument
     */
    static FloatKind<?> kindOf(JavaType type) {
        JavaType arg = type.containedTypeOrUnknown(0);
        if (arg.hasRawClass(Float.class))
            return FloatKind.FLOAT32;
        else
            return FloatKind.FLOAT64;
    }
}
