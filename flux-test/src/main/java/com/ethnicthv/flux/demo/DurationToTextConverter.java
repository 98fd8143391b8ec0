package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.convert.ValueConverter;

import java.time.Duration;

/**
 * Formats a {@link Duration} as {@code m:ss} and parses it back. Malformed text yields zero.
 */
@ValueConverter
public class DurationToTextConverter implements IValueConverter<Duration, String> {

    @Override
    public String convert(Duration value) {
        if (value == null) {
            return "0:00";
        }
        long seconds = Math.max(0, value.getSeconds());
        return String.format("%d:%02d", seconds / 60, seconds % 60);
    }

    @Override
    public Duration convertBack(String value) {
        if (value == null) {
            return Duration.ZERO;
        }
        String[] parts = value.trim().split(":");
        if (parts.length != 2) {
            return Duration.ZERO;
        }
        try {
            long minutes = Long.parseLong(parts[0]);
            long seconds = Long.parseLong(parts[1]);
            if (minutes < 0 || seconds < 0 || seconds > 59) {
                return Duration.ZERO;
            }
            return Duration.ofSeconds(minutes * 60 + seconds);
        } catch (NumberFormatException e) {
            return Duration.ZERO;
        }
    }

    @Override
    public Class<Duration> getSourceType() {
        return Duration.class;
    }

    @Override
    public Class<String> getTargetType() {
        return String.class;
    }
}
