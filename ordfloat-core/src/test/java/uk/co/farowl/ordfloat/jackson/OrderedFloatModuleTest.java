// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.jackson;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import uk.co.farowl.ordfloat.NonNaNFloat;
import uk.co.farowl.ordfloat.TotalOrderFloat;
import uk.co.farowl.ordfloat.kind.FloatKind;

/** Test JSON serialisation of the wrapper types. */
class OrderedFloatModuleTest {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().registerModule(new OrderedFloatModule());

    /** A bean with wrapper-typed properties. */
    static class Holder {
        public TotalOrderFloat<Float> single;
        public NonNaNFloat<Double> bounded;
    }

    @Nested
    @DisplayName("Serialise")
    class Serialise {

        @Test
        void asBareNumber() throws JsonProcessingException {
            assertEquals("1.5",
                    MAPPER.writeValueAsString(TotalOrderFloat.of(1.5)));
            assertEquals("-3.0",
                    MAPPER.writeValueAsString(NonNaNFloat.from(-3.0)));
        }

        @Test
        void floatNotWidened() throws JsonProcessingException {
            assertEquals("0.1",
                    MAPPER.writeValueAsString(TotalOrderFloat.of(0.1f)));
        }

        @Test
        void nanAsJacksonWritesIt() throws JsonProcessingException {
            assertEquals("\"NaN\"",
                    MAPPER.writeValueAsString(TotalOrderFloat.of(Double.NaN)));
        }
    }

    @Nested
    @DisplayName("Deserialise")
    class Deserialise {

        @Test
        void totalOrderDouble() throws JsonProcessingException {
            TotalOrderFloat<Double> x = MAPPER.readValue("2.25",
                    new TypeReference<TotalOrderFloat<Double>>() {});
            assertEquals(TotalOrderFloat.of(2.25), x);
            assertSame(FloatKind.FLOAT64, x.kind());
        }

        @Test
        void totalOrderFloat() throws JsonProcessingException {
            TotalOrderFloat<Float> x = MAPPER.readValue("0.1",
                    new TypeReference<TotalOrderFloat<Float>>() {});
            assertEquals(0.1f, x.value());
            assertSame(FloatKind.FLOAT32, x.kind());
        }

        @Test
        void totalOrderAcceptsNaN() throws JsonProcessingException {
            TotalOrderFloat<Double> x = MAPPER.readValue("\"NaN\"",
                    new TypeReference<TotalOrderFloat<Double>>() {});
            assertTrue(x.isNaN());
        }

        @Test
        void nonNaN() throws JsonProcessingException {
            NonNaNFloat<Double> x = MAPPER.readValue("-7",
                    new TypeReference<NonNaNFloat<Double>>() {});
            assertEquals(NonNaNFloat.from(-7.0), x);
        }

        @Test
        void nonNaNRejectsNaN() {
            InvalidFormatException e = assertThrows(
                    InvalidFormatException.class,
                    () -> MAPPER.readValue("\"NaN\"",
                            new TypeReference<NonNaNFloat<Double>>() {}));
            assertThat(e.getMessage(), containsString("NaN"));
            assertThat(e.getMessage(),
                    containsString(NonNaNFloatDeserializer.EXPECTED));
        }

        @Test
        void nonNaNRejectsText() {
            assertThrows(JsonProcessingException.class,
                    () -> MAPPER.readValue("\"x\"",
                            new TypeReference<NonNaNFloat<Float>>() {}));
        }
    }

    @Test
    @DisplayName("A bean round-trips")
    void beanRoundTrip() throws JsonProcessingException {
        Holder h = new Holder();
        h.single = TotalOrderFloat.of(0.5f);
        h.bounded = NonNaNFloat.from(Double.NEGATIVE_INFINITY);
        String json = MAPPER.writeValueAsString(h);
        assertThat(json, containsString("\"single\":0.5"));
        assertThat(json, containsString("\"bounded\":\"-Infinity\""));

        Holder back = MAPPER.readValue(json, Holder.class);
        assertEquals(h.single, back.single);
        assertSame(FloatKind.FLOAT32, back.single.kind());
        assertEquals(h.bounded, back.bounded);
    }
}
