package com.warisan.agreement.domain;

public enum SignerType {
    OWNER,
    BENEFICIARY,
    WITNESS
}
