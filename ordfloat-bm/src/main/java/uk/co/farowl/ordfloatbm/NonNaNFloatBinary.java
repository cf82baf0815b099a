package uk.co.farowl.ordfloatbm;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.ordfloat.NonNaNFloat;

/**
 * This is a JMH benchmark for the guarded binary operations on
 * {@link NonNaNFloat}. Comparison is with the time for an in-line use
 * in Java of the same operation on {@code double}, so that the cost of
 * boxing and of the NaN checks may be seen.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class NonNaNFloatBinary {

    double v = 1.01 * 6, w = 1.01 * 7;
    NonNaNFloat<Double> nv = NonNaNFloat.from(v), nw = NonNaNFloat.from(w);

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public double add_java() { return v + w; }

    @Benchmark
    public Object add() { return nv.add(nw); }

    @Benchmark
    public Object add_raw() { return nv.add(w); }

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public double mul_java() { return v * w; }

    @Benchmark
    public Object mul() { return nv.multiply(nw); }

    @Benchmark
    @Fork(4)  // Needs a lot of iterations to resolve short times
    @Measurement(iterations = 50)
    public double div_java() { return v / w; }

    @Benchmark
    public Object div() { return nv.divide(nw); }
}
