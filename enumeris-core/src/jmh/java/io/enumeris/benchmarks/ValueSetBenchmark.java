package io.enumeris.benchmarks;

import io.enumeris.core.EnumerisConfiguration;
import io.enumeris.core.NameSource;
import io.enumeris.registry.EnumValue;
import io.enumeris.registry.Enumeration;
import io.enumeris.registry.Registration;
import io.enumeris.registry.ValueSet;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ValueSetBenchmark {

    public static final class Flag extends EnumValue<Flag> {
        Flag(Registration<Flag> registration) {
            super(registration);
        }
    }

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"64", "1024"})
        public int size;

        private Enumeration<Flag> flags;
        private ValueSet<Flag> evens;
        private ValueSet<Flag> odds;
        private List<Flag> all;
        private long[] mask;

        @Setup(Level.Trial)
        public void setUp() {
            flags = Enumeration.of(Flag.class, EnumerisConfiguration.builder()
                    .name("Flags")
                    .nameSource(NameSource.none())
                    .build());
            all = new ArrayList<>(size);
            for (var i = 0; i < size; i++) {
                all.add(flags.declare("F" + i, Flag::new));
            }
            evens = flags.values().filter(f -> f.id() % 2 == 0);
            odds = flags.values().filter(f -> f.id() % 2 == 1);
            mask = evens.toBitMask();
        }
    }

    @Benchmark
    public int union(BenchmarkState state) {
        return state.evens.union(state.odds).size();
    }

    @Benchmark
    public int intersect(BenchmarkState state) {
        return state.evens.intersect(state.odds).size();
    }

    @Benchmark
    public boolean contains(BenchmarkState state) {
        return state.evens.contains(state.all.get(state.size / 2));
    }

    @Benchmark
    public int iterate(BenchmarkState state) {
        var sum = 0;
        for (Flag flag : state.evens) {
            sum += flag.id();
        }
        return sum;
    }

    @Benchmark
    public int fromBitMask(BenchmarkState state) {
        return state.flags.fromBitMask(state.mask).size();
    }

    @Benchmark
    public Flag valueByName(BenchmarkState state) {
        return state.flags.valueByName("F" + (state.size - 1));
    }

    @Benchmark
    public int values(BenchmarkState state) {
        return state.flags.values().size();
    }
}
