package com.ethnicthv.flux.core.convert;

/**
 * Two-way conversion between a property value type and a presentation type, used by
 * bindings to display a value and to write edits back.
 *
 * @param <S> source (property) type
 * @param <D> destination (presentation) type
 */
public interface IValueConverter<S, D> {

    D convert(S value);

    S convertBack(D value);

    Class<S> getSourceType();

    Class<D> getTargetType();

    /**
     * Untyped {@link #convert} for callers holding a boxed value.
     *
     * @throws ClassCastException if {@code value} is not a {@link #getSourceType()}
     */
    default Object convertObject(Object value) {
        return convert(getSourceType().cast(value));
    }

    /**
     * Untyped {@link #convertBack}.
     *
     * @throws ClassCastException if {@code value} is not a {@link #getTargetType()}
     */
    default Object convertBackObject(Object value) {
        return convertBack(getTargetType().cast(value));
    }
}
