package com.example.presence.shared.converter;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.sql.Timestamp;
import java.time.OffsetDateTime;

@WritingConverter
public class OffsetDateTimeToTimestampConverter implements Converter<OffsetDateTime, Timestamp> {

    @Override
    public Timestamp convert(OffsetDateTime source) {
        return Timestamp.from(source.toInstant());
    }
}
