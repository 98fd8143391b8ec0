package com.ethnicthv.flux.benchmark;

import com.ethnicthv.flux.Flux;
import com.ethnicthv.flux.core.properties.ComputedProperty;
import com.ethnicthv.flux.core.properties.ReactiveProperty;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Cost of a property write as the subscriber count grows, and of a lazy computed read
 * after its source changed.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class ReactivePropertyBenchmark {

    @State(Scope.Thread)
    public static class WriteState {
        @Param({"0", "1", "16"})
        public int subscribers;

        public Flux flux;
        public ReactiveProperty<Integer> property;
        public int next;

        @Setup(Level.Trial)
        public void setup(Blackhole bh) {
            flux = Flux.builder().immediateThreading().noConverterDiscovery().build();
            property = flux.getProperties().getOrCreateProperty("bench.value", 0);
            for (int i = 0; i < subscribers; i++) {
                property.subscribe(v -> bh.consume(v));
            }
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            flux.close();
        }
    }

    @State(Scope.Thread)
    public static class ComputedState {
        public ReactiveProperty<Integer> a;
        public ReactiveProperty<Integer> b;
        public ComputedProperty<Integer> sum;
        public int next;

        @Setup(Level.Trial)
        public void setup() {
            a = new ReactiveProperty<>(Integer.class, 1);
            b = new ReactiveProperty<>(Integer.class, 2);
            sum = new ComputedProperty<>(Integer.class, () -> a.getValue() + b.getValue()).dependsOn(a, b);
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            sum.dispose();
        }
    }

    @Benchmark
    public void setValue(WriteState state) {
        state.property.setValue(++state.next);
    }

    @Benchmark
    public void setSameValue(WriteState state) {
        state.property.setValue(state.next);
    }

    @Benchmark
    public int readComputedAfterChange(ComputedState state) {
        state.a.setValue(++state.next);
        return state.sum.getValue();
    }

    @Benchmark
    public int readComputedCached(ComputedState state) {
        return state.sum.getValue();
    }
}
