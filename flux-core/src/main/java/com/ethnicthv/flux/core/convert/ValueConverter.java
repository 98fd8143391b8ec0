package com.ethnicthv.flux.core.convert;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an {@link IValueConverter} implementation for compile-time registration.
 * <p>
 * The annotation processor emits, per package, a {@code GeneratedConverterIndex} that registers
 * every marked converter with the {@link ConverterRegistry}. Marked classes must be public,
 * concrete and have a public no-arg constructor.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface ValueConverter {
}
