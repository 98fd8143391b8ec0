package com.ethnicthv.flux.core.convert.builtin;

import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.convert.ValueConverter;

@ValueConverter
public class BoolToStringConverter implements IValueConverter<Boolean, String> {

    @Override
    public String convert(Boolean value) {
        return value == null ? "" : value.toString();
    }

    @Override
    public Boolean convertBack(String value) {
        return value != null && Boolean.parseBoolean(value.trim());
    }

    @Override
    public Class<Boolean> getSourceType() {
        return Boolean.class;
    }

    @Override
    public Class<String> getTargetType() {
        return String.class;
    }
}
