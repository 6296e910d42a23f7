package com.warisan.agreement.faraid;

import org.apache.commons.math3.fraction.Fraction;
import org.apache.commons.math3.fraction.FractionConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Renders estate shares as simplest fractions ("1/6") and share labels ("1/6 (16.7%)").
 */
public final class ShareFormatter {

    private static final Logger log = LoggerFactory.getLogger(ShareFormatter.class);

    static final double EPSILON = 1e-9;
    private static final int MAX_ITERATIONS = 100;
    private static final int FALLBACK_MAX_DENOMINATOR = 1_000_000_000;

    // Exact hits return the canonical Faraid fraction instead of a long convergent.
    private static final List<Fraction> COMMON_FRACTIONS = List.of(
        new Fraction(1, 2),
        new Fraction(1, 3),
        new Fraction(2, 3),
        new Fraction(1, 4),
        new Fraction(1, 8),
        new Fraction(1, 6),
        new Fraction(3, 4)
    );

    private ShareFormatter() {
    }

    /**
     * Simplest fraction within {@value #EPSILON} of the value, "0" for zero.
     */
    public static String formatFraction(double value) {
        if (Math.abs(value) < EPSILON) {
            return "0";
        }
        return COMMON_FRACTIONS.stream()
            .filter(f -> Math.abs(f.doubleValue() - value) < EPSILON)
            .findFirst()
            .map(ShareFormatter::render)
            .orElseGet(() -> render(toFraction(value)));
    }

    /**
     * Fraction followed by the percentage to one decimal, e.g. "1/8 (12.5%)".
     */
    public static String formatShare(double value) {
        return formatFraction(value) + " (" + String.format(Locale.ROOT, "%.1f", value * 100) + "%)";
    }

    static Fraction toFraction(double value) {
        try {
            return new Fraction(value, EPSILON, MAX_ITERATIONS);
        } catch (FractionConversionException e) {
            log.debug("Continued fraction for {} did not converge within epsilon: {}", value, e.getMessage());
            return new Fraction(value, FALLBACK_MAX_DENOMINATOR);
        }
    }

    private static String render(Fraction fraction) {
        if (fraction.getDenominator() == 1) {
            return Integer.toString(fraction.getNumerator());
        }
        return fraction.getNumerator() + "/" + fraction.getDenominator();
    }
}
