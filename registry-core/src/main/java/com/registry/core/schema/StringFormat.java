package com.registry.core.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Named string formats understood by the schema validator.
 */
public enum StringFormat {
    EMAIL("email") {
        @Override
        public boolean matches(String value) {
            return EMAIL_PATTERN.matcher(value).matches();
        }
    },
    DATE_TIME("date-time") {
        @Override
        public boolean matches(String value) {
            try {
                OffsetDateTime.parse(value);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    },
    DATE("date") {
        @Override
        public boolean matches(String value) {
            try {
                LocalDate.parse(value);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    },
    UUID_FORMAT("uuid") {
        @Override
        public boolean matches(String value) {
            if (value.length() != 36) {
                return false;
            }
            try {
                UUID.fromString(value);
                return true;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
    },
    URI_FORMAT("uri") {
        @Override
        public boolean matches(String value) {
            try {
                return new URI(value).isAbsolute();
            } catch (URISyntaxException e) {
                return false;
            }
        }
    };

    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$");

    private final String wireName;

    StringFormat(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public abstract boolean matches(String value);

    @JsonCreator
    public static StringFormat fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StringFormat format : values()) {
            if (format.wireName.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown string format '" + value + "'");
    }
}
