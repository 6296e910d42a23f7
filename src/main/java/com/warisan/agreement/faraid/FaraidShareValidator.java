package com.warisan.agreement.faraid;

import com.warisan.agreement.config.WarisanProperties;
import com.warisan.agreement.domain.FaraidContext;
import com.warisan.agreement.domain.ProposedShare;
import com.warisan.agreement.domain.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks a manually entered share breakdown against the Faraid rules.
 *
 * <p>Used when an admin overrides an automatic distribution. Fixed-share relations must match
 * the expected share within tolerance; residuary relations entered as flat percentages only
 * produce warnings.
 */
@Service
public class FaraidShareValidator {

    private static final Logger log = LoggerFactory.getLogger(FaraidShareValidator.class);

    private final FaraidCalculator calculator;
    private final WarisanProperties properties;

    public FaraidShareValidator(FaraidCalculator calculator, WarisanProperties properties) {
        this.calculator = calculator;
        this.properties = properties;
    }

    public ValidationResult validate(List<ProposedShare> proposed) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        var tolerances = properties.faraid();

        double total = proposed.stream().mapToDouble(ProposedShare::sharePercentage).sum();
        if (Math.abs(total - 100) > tolerances.totalTolerance()) {
            errors.add(String.format(Locale.ROOT, "Total shares must equal 100%%. Current total: %.2f%%", total));
        }

        // Expected shares come from the relations actually proposed, not from caller-supplied flags.
        var heirCase = HeirCase.fromRelations(proposed.stream().map(ProposedShare::relation).toList());
        var context = FaraidContext.of(
            heirCase.hasDescendant(),
            heirCase.hasSpouse(),
            heirCase.hasParent(),
            heirCase.hasMaleDescendant()
        );
        var distribution = calculator.calculate(heirCase.toDescriptors(), context);

        for (ProposedShare share : proposed) {
            distribution.shareOf(share.relation())
                .filter(expected -> expected > 0)
                .map(expected -> expected * 100)
                .filter(expectedPct -> Math.abs(share.sharePercentage() - expectedPct) > tolerances.fixedShareTolerance())
                .ifPresent(expectedPct -> errors.add(String.format(Locale.ROOT,
                    "%s: Expected %.2f%% per Faraid rules, got %s%%",
                    share.relation(), expectedPct, plain(share.sharePercentage()))));
        }

        for (ProposedShare share : proposed) {
            if (distribution.isResiduary(share.relation())) {
                warnings.add(share.relation()
                    + " should receive residuary portion (remaining after fixed shares), not a fixed percentage");
            }
        }

        if (!errors.isEmpty()) {
            log.debug("Faraid share override rejected: {}", errors);
        }
        return ValidationResult.of(errors, warnings);
    }

    private static String plain(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
