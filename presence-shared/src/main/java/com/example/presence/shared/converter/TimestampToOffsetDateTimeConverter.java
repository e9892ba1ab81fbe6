package com.example.presence.shared.converter;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Reads timestamptz columns back as UTC {@link OffsetDateTime} values so that
 * expiry and retry comparisons never depend on the JVM default zone.
 */
@ReadingConverter
public class TimestampToOffsetDateTimeConverter implements Converter<Timestamp, OffsetDateTime> {

    @Override
    public OffsetDateTime convert(Timestamp source) {
        return source.toInstant().atOffset(ZoneOffset.UTC);
    }
}
