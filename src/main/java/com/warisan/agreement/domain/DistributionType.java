package com.warisan.agreement.domain;

import io.vavr.control.Option;
import io.vavr.control.Try;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * How the assets of an agreement are distributed.
 */
public enum DistributionType {
    FARAID,
    HIBAH,
    WASIYYAH,
    WAKAF;

    /**
     * Parse an external code, empty when the code is not one of the known types.
     */
    public static Option<DistributionType> parse(String code) {
        if (code == null) {
            return Option.none();
        }
        return Try.of(() -> valueOf(code)).toOption();
    }

    public static String allowedValues() {
        return Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));
    }
}
