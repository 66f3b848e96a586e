package com.fxanalytics.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fxanalytics.exception.DomainException;
import java.util.Locale;

/** European vanilla FX option side. A call on the base currency is a put on the quote currency. */
public enum OptionType {
    CALL,
    PUT;

    public boolean isCall() {
        return this == CALL;
    }

    @JsonCreator
    public static OptionType fromString(String value) {
        if (value == null) {
            throw new DomainException("Option type is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "call", "c" -> CALL;
            case "put", "p" -> PUT;
            default -> throw new DomainException("Unknown option type: " + value);
        };
    }
}
