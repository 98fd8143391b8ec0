package com.ethnicthv.flux.core.convert.builtin;

import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.convert.ValueConverter;

import java.util.Locale;

/**
 * Float to text rounded to whole units (e.g. {@code 12.6f -> "13"}), the usual HUD display.
 * Unparseable text converts back to {@code 0}.
 */
@ValueConverter
public class FloatToStringConverter implements IValueConverter<Float, String> {

    @Override
    public String convert(Float value) {
        return value == null ? "" : String.format(Locale.ROOT, "%.0f", value);
    }

    @Override
    public Float convertBack(String value) {
        if (value == null) {
            return 0f;
        }
        try {
            return Float.parseFloat(value.trim());
        } catch (NumberFormatException e) {
            return 0f;
        }
    }

    @Override
    public Class<Float> getSourceType() {
        return Float.class;
    }

    @Override
    public Class<String> getTargetType() {
        return String.class;
    }
}
