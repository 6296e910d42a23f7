package com.warisan.agreement.faraid;

import com.warisan.agreement.domain.FamilyMember;
import com.warisan.agreement.domain.RelationKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference table of Quranic fixed shares per relation.
 *
 * <p>The calculator derives shares contextually; this table backs {@link #hasFixedShare}, rule
 * explanations and the per-beneficiary share basis. Collateral relations (uncle, aunt, nephew,
 * niece, cousin) carry descriptive entries but are not eligible for automatic distribution.
 */
public final class FaraidRuleTable {

    /**
     * One row of the table.
     *
     * @param share      nominal fixed share, 0 for residuary-only relations
     * @param description rule as stated in the Faraid reference
     * @param shareBasis explanation shown next to a computed fixed share
     */
    public record Rule(double share, String description, String shareBasis) {
    }

    private static final Map<RelationKind, Rule> RULES;
    private static final Set<RelationKind> ELIGIBLE_HEIRS = Collections.unmodifiableSet(EnumSet.of(
        RelationKind.FATHER,
        RelationKind.MOTHER,
        RelationKind.HUSBAND,
        RelationKind.WIFE,
        RelationKind.DAUGHTER,
        RelationKind.SON,
        RelationKind.GRANDDAUGHTER,
        RelationKind.GRANDSON,
        RelationKind.GRANDMOTHER,
        RelationKind.GRANDFATHER,
        RelationKind.SIBLING
    ));

    static {
        var rules = new EnumMap<RelationKind, Rule>(RelationKind.class);
        rules.put(RelationKind.FATHER, new Rule(1.0 / 6,
            "1/6 fixed share, plus residuary if no male offspring",
            "Fixed share of 1/6, plus residuary if no male descendants"));
        rules.put(RelationKind.MOTHER, new Rule(1.0 / 6,
            "1/6 if children/grandchildren, 1/3 if no children",
            "1/6 if children present, 1/3 if no children"));
        rules.put(RelationKind.HUSBAND, new Rule(1.0 / 4,
            "1/4 with children, 1/2 without children",
            "1/4 if children present, 1/2 if no children"));
        rules.put(RelationKind.WIFE, new Rule(1.0 / 8,
            "1/8 with children, 1/4 without children",
            "1/8 if children present, 1/4 if no children"));
        rules.put(RelationKind.DAUGHTER, new Rule(1.0 / 2,
            "1/2 if single, 2/3 if multiple daughters",
            "1/2 if single, 2/3 shared among multiple daughters (with no sons)"));
        rules.put(RelationKind.GRANDDAUGHTER, new Rule(1.0 / 6,
            "1/6 when representing deceased daughter",
            "1/6 representing deceased daughter"));
        rules.put(RelationKind.GRANDMOTHER, new Rule(1.0 / 6,
            "1/6 if no mother",
            "1/6 in absence of mother"));
        rules.put(RelationKind.SON, new Rule(0,
            "Residuary only - receives remaining portion",
            "Residuary - receives remaining portion"));
        rules.put(RelationKind.GRANDSON, new Rule(0,
            "Residuary only - receives remaining portion",
            "Residuary - in absence of sons"));
        rules.put(RelationKind.SIBLING, new Rule(0,
            "Residuary in absence of descendants/ancestors",
            "Residuary - in absence of descendants, parents, and grandparents"));
        rules.put(RelationKind.GRANDFATHER, new Rule(0,
            "May receive fixed share or residuary",
            "May receive fixed share or residuary depending on circumstances"));
        rules.put(RelationKind.UNCLE, new Rule(0,
            "Residuary in absence of closer relatives",
            "Residuary - distant relative"));
        rules.put(RelationKind.AUNT, new Rule(0,
            "No fixed share in most schools",
            "No fixed share in most schools of thought"));
        rules.put(RelationKind.NEPHEW, new Rule(0,
            "Residuary in absence of closer relatives",
            "Residuary - distant relative"));
        rules.put(RelationKind.NIECE, new Rule(0,
            "Residuary in certain conditions",
            "Residuary in certain conditions"));
        rules.put(RelationKind.COUSIN, new Rule(0,
            "Distant residuary heir",
            "Distant residuary heir"));
        rules.put(RelationKind.OTHER, new Rule(0,
            "No prescribed share",
            "No prescribed Faraid share"));
        RULES = Collections.unmodifiableMap(rules);
    }

    private FaraidRuleTable() {
    }

    public static Rule rule(RelationKind relation) {
        return RULES.get(relation);
    }

    public static boolean hasFixedShare(RelationKind relation) {
        var rule = RULES.get(relation);
        return rule != null && rule.share() > 0;
    }

    public static String explanation(RelationKind relation) {
        var rule = relation != null ? RULES.get(relation) : null;
        return rule != null ? rule.description() : "No specific Faraid rule for this relation";
    }

    public static String shareBasis(RelationKind relation) {
        var rule = RULES.get(relation);
        return rule != null ? rule.shareBasis() : "Share according to Faraid rules for " + relation;
    }

    public static boolean isEligibleHeir(RelationKind relation) {
        return ELIGIBLE_HEIRS.contains(relation);
    }

    public static Set<RelationKind> eligibleHeirs() {
        return ELIGIBLE_HEIRS;
    }

    /**
     * Keep only members whose relation takes part in automatic distribution, preserving order.
     */
    public static List<FamilyMember> filterEligibleHeirs(List<FamilyMember> members) {
        return members.stream()
            .filter(member -> isEligibleHeir(member.relation()))
            .toList();
    }
}
