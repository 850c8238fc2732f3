package com.registry.api.rest;

import com.registry.core.exception.ValidationFailedException;
import com.registry.core.schema.SchemaViolation;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Reads request timestamps: ISO instants, offset date-times, or plain dates
 * (taken as start of day UTC).
 */
final class TemporalParser {

    private static final int DATE_LENGTH = "yyyy-MM-dd".length();

    private TemporalParser() {
    }

    static Instant parse(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (text.length() == DATE_LENGTH) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            // 'Z' is an offset too, so this also covers plain instants
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw ValidationFailedException.of(field, SchemaViolation.FORMAT,
                "must be an ISO-8601 instant, offset date-time or date");
        }
    }
}
