// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.jackson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

import uk.co.farowl.ordfloat.NonNaNFloat;
import uk.co.farowl.ordfloat.TotalOrderFloat;

/**
 * A Jackson module that serialises {@link TotalOrderFloat} and
 * {@link NonNaNFloat} as the bare number they wrap, and deserialises
 * them from a number. Register it with an {@code ObjectMapper}:
 *
 * <pre>
 * ObjectMapper mapper = new ObjectMapper()
 *         .registerModule(new OrderedFloatModule());
 * </pre>
 *
 * Deserialisation of a {@code NonNaNFloat} fails with an
 * {@link com.fasterxml.jackson.databind.exc.InvalidFormatException} if
 * the number is NaN.
 */
public class OrderedFloatModule extends SimpleModule {
    private static final long serialVersionUID = 1L;

    /** Logger for the module. */
    static final Logger logger =
            LoggerFactory.getLogger(OrderedFloatModule.class);

    /** Name under which the module registers. */
    public static final String NAME = "OrderedFloatModule";

    /** Construct the module. */
    public OrderedFloatModule() {
        super(NAME, Version.unknownVersion());
        FloatWrapperSerializer serializer = new FloatWrapperSerializer();
        addSerializer(TotalOrderFloat.class, serializer);
        addSerializer(NonNaNFloat.class, serializer);
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);
        // Deserialisers depend on the type argument, so are found late
        context.addDeserializers(new OrderedFloatDeserializers());
        logger.atDebug().log("{} registered", NAME);
    }
}
