package com.warisan.agreement.domain;

/**
 * Status an agreement should hold given its signing progress, with the reason.
 */
public record WorkflowStatus(AgreementStatus status, String reason) {
}
