package com.warisan.agreement.domain;

/**
 * Whether a family member holds an account or was entered by the owner.
 */
public enum MemberType {
    REGISTERED,
    NON_REGISTERED
}
