package uk.co.farowl.ordfloatbm;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import uk.co.farowl.ordfloat.CanonicalBits;
import uk.co.farowl.ordfloat.TotalOrderFloat;

/**
 * This is a JMH benchmark for comparison, hashing and sorting of
 * {@link TotalOrderFloat}, against the built-in {@code Double}
 * equivalents (which order {@code -0.0} before {@code 0.0}).
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)

@Fork(2)
@Warmup(iterations = 20, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 10, time = 1, timeUnit = TimeUnit.SECONDS)

@State(Scope.Thread)
public class TotalOrderFloatCompare {

    static final int N = 1000;

    double v = 42.0, w = Double.NaN;
    TotalOrderFloat<Double> tv = TotalOrderFloat.of(v),
            tw = TotalOrderFloat.of(w);
    Double dv = v, dw = w;

    TotalOrderFloat<Double>[] wrapped;
    Double[] boxed;

    @SuppressWarnings("unchecked")
    @Setup
    public void setup() {
        Random r = new Random(1234L);
        wrapped = new TotalOrderFloat[N];
        boxed = new Double[N];
        for (int i = 0; i < N; i++) {
            // One in ten is NaN
            double x = i % 10 == 0 ? Double.NaN : r.nextGaussian();
            wrapped[i] = TotalOrderFloat.of(x);
            boxed[i] = x;
        }
    }

    @Benchmark
    public int compare_java() { return dv.compareTo(dw); }

    @Benchmark
    public int compare() { return tv.compareTo(tw); }

    @Benchmark
    public int hash_java() { return dv.hashCode(); }

    @Benchmark
    public int hash() { return tv.hashCode(); }

    @Benchmark
    public long canonicalBits() { return CanonicalBits.of(v); }

    @Benchmark
    public Object sort_java() {
        Double[] a = boxed.clone();
        Arrays.sort(a);
        return a;
    }

    @Benchmark
    public Object sort() {
        TotalOrderFloat<Double>[] a = wrapped.clone();
        Arrays.sort(a);
        return a;
    }
}
