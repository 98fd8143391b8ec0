package com.ethnicthv.flux.benchmark;

import com.ethnicthv.flux.core.events.EventBus;
import com.ethnicthv.flux.core.events.FluxEventBase;
import com.ethnicthv.flux.core.threading.ImmediateThreadMarshaller;
import com.ethnicthv.flux.core.threading.MainThreadMarshaller;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Publish cost on the main thread, and enqueue cost for events published off the main thread.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class EventBusPublishBenchmark {

    public static final class Tick extends FluxEventBase {
        final int frame;

        Tick(int frame) {
            this.frame = frame;
        }
    }

    @State(Scope.Thread)
    public static class InlineState {
        @Param({"1", "8", "64"})
        public int handlers;

        public EventBus bus;
        public Tick event;

        @Setup(Level.Trial)
        public void setup(Blackhole bh) {
            bus = new EventBus(new ImmediateThreadMarshaller(), 1000);
            for (int i = 0; i < handlers; i++) {
                bus.subscribe(Tick.class, e -> bh.consume(e.frame), i % 4);
            }
            event = new Tick(1);
        }
    }

    @State(Scope.Thread)
    public static class QueuedState {
        @Param({"1", "8"})
        public int handlers;

        public MainThreadMarshaller marshaller;
        public EventBus bus;
        public Tick event;

        @Setup(Level.Trial)
        public void setup(Blackhole bh) throws InterruptedException {
            // Owned by a thread other than the benchmark thread so publishes are queued.
            Thread owner = new Thread(() -> marshaller = new MainThreadMarshaller(1000));
            owner.start();
            owner.join();
            bus = new EventBus(marshaller, 1000);
            for (int i = 0; i < handlers; i++) {
                bus.subscribe(Tick.class, e -> bh.consume(e.frame));
            }
            event = new Tick(1);
        }
    }

    @Benchmark
    public void publishInline(InlineState state) {
        state.bus.publish(state.event);
    }

    @Benchmark
    public int publishQueued(QueuedState state) {
        state.bus.publish(state.event);
        return state.marshaller.clearQueue();
    }
}
