package com.eainde.verifier.config;

import com.eainde.verifier.search.ExponentRange;
import org.springframework.core.convert.converter.Converter;

/**
 * Binds {@code "a..b"} property values to {@link ExponentRange}.
 */
public class ExponentRangeConverter implements Converter<String, ExponentRange> {

    @Override
    public ExponentRange convert(String source) {
        return ExponentRange.parse(source);
    }
}
