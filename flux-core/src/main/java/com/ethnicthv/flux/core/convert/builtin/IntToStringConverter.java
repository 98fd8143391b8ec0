package com.ethnicthv.flux.core.convert.builtin;

import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.convert.ValueConverter;

/**
 * Integer to decimal text. Unparseable text converts back to {@code 0}.
 */
@ValueConverter
public class IntToStringConverter implements IValueConverter<Integer, String> {

    @Override
    public String convert(Integer value) {
        return value == null ? "" : value.toString();
    }

    @Override
    public Integer convertBack(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public Class<Integer> getSourceType() {
        return Integer.class;
    }

    @Override
    public Class<String> getTargetType() {
        return String.class;
    }
}
