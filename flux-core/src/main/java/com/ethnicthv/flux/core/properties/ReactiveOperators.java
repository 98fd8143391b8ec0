package com.ethnicthv.flux.core.properties;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Operators deriving new cells from existing ones.
 * <p>
 * Every derived cell owns its upstream subscriptions as dependent subscriptions: disposing the
 * derived cell detaches it from its sources. Derived cells are plain {@link ReactiveProperty}s
 * and can be registered in a {@link PropertyStore} like any other.
 */
public final class ReactiveOperators {

    private ReactiveOperators() {
    }

    /**
     * Cell holding {@code mapper(source)}, updated whenever {@code source} changes.
     */
    public static <S, R> ReactiveProperty<R> transform(IReactiveProperty<S> source,
                                                       Class<R> targetType,
                                                       Function<? super S, ? extends R> mapper) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mapper, "mapper");
        ReactiveProperty<R> target = new ReactiveProperty<>(targetType, mapper.apply(source.getValue()));
        target.addDependentSubscription(source.subscribe(value -> target.setValue(mapper.apply(value))));
        return target;
    }

    /**
     * Cell holding {@code combiner(first, second)}, updated whenever either input changes.
     */
    public static <A, B, R> ReactiveProperty<R> combine(IReactiveProperty<A> first,
                                                        IReactiveProperty<B> second,
                                                        Class<R> resultType,
                                                        BiFunction<? super A, ? super B, ? extends R> combiner) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        Objects.requireNonNull(combiner, "combiner");
        ReactiveProperty<R> result = new ReactiveProperty<>(resultType, combiner.apply(first.getValue(), second.getValue()));
        result.addDependentSubscription(first.subscribe(a -> result.setValue(combiner.apply(a, second.getValue()))));
        result.addDependentSubscription(second.subscribe(b -> result.setValue(combiner.apply(first.getValue(), b))));
        return result;
    }

    /**
     * Cell starting at the current source value and afterwards only taking the source values
     * accepted by {@code filter}.
     */
    public static <T> ReactiveProperty<T> filter(IReactiveProperty<T> source, Predicate<? super T> filter) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(filter, "filter");
        ReactiveProperty<T> filtered = new ReactiveProperty<>(source.getValueType(), source.getValue());
        filtered.addDependentSubscription(source.subscribe(value -> {
            if (filter.test(value)) {
                filtered.setValue(value);
            }
        }));
        return filtered;
    }

    /**
     * Mirror of {@code source} that drops forced notifications of unchanged values.
     */
    public static <T> ReactiveProperty<T> distinctUntilChanged(IReactiveProperty<T> source) {
        Objects.requireNonNull(source, "source");
        ReactiveProperty<T> distinct = new ReactiveProperty<>(source.getValueType(), source.getValue());
        distinct.addDependentSubscription(source.subscribe(value -> distinct.setValue(value)));
        return distinct;
    }
}
