package com.warisan.agreement.faraid;

import com.warisan.agreement.domain.HeirDescriptor;
import com.warisan.agreement.domain.RelationKind;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Surviving heirs aggregated by relation. Counts of repeated descriptors are summed.
 */
public final class HeirCase {

    private final Map<RelationKind, Integer> heirs;

    private HeirCase(Map<RelationKind, Integer> heirs) {
        this.heirs = heirs;
    }

    public static HeirCase of(Collection<HeirDescriptor> descriptors) {
        var counts = new LinkedHashMap<RelationKind, Integer>();
        for (HeirDescriptor d : descriptors) {
            counts.merge(d.relation(), d.count(), Integer::sum);
        }
        return new HeirCase(counts);
    }

    /**
     * One heir per listed relation, e.g. the relations of a proposed beneficiary list.
     */
    public static HeirCase fromRelations(Collection<RelationKind> relations) {
        var counts = new LinkedHashMap<RelationKind, Integer>();
        for (RelationKind relation : relations) {
            counts.merge(relation, 1, Integer::sum);
        }
        return new HeirCase(counts);
    }

    public int count(RelationKind relation) {
        return heirs.getOrDefault(relation, 0);
    }

    public boolean has(RelationKind relation) {
        return count(relation) > 0;
    }

    public boolean hasDescendant() {
        return has(RelationKind.SON) || has(RelationKind.DAUGHTER)
            || has(RelationKind.GRANDSON) || has(RelationKind.GRANDDAUGHTER);
    }

    public boolean hasParent() {
        return has(RelationKind.FATHER) || has(RelationKind.MOTHER);
    }

    public boolean hasMaleDescendant() {
        return has(RelationKind.SON) || has(RelationKind.GRANDSON);
    }

    public boolean hasSpouse() {
        return has(RelationKind.HUSBAND) || has(RelationKind.WIFE);
    }

    public boolean isEmpty() {
        return heirs.isEmpty();
    }

    /**
     * Descriptors in first-seen relation order.
     */
    public List<HeirDescriptor> toDescriptors() {
        return heirs.entrySet().stream()
            .map(e -> HeirDescriptor.of(e.getKey(), e.getValue()))
            .toList();
    }
}
