package com.ethnicthv.flux.core.convert.builtin;

import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.convert.ValueConverter;

import java.util.Locale;

/**
 * Double to text with two decimals. Unparseable text converts back to {@code 0}.
 */
@ValueConverter
public class DoubleToStringConverter implements IValueConverter<Double, String> {

    @Override
    public String convert(Double value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.2f", value);
    }

    @Override
    public Double convertBack(String value) {
        if (value == null) {
            return 0d;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0d;
        }
    }

    @Override
    public Class<Double> getSourceType() {
        return Double.class;
    }

    @Override
    public Class<String> getTargetType() {
        return String.class;
    }
}
