package com.warisan.agreement.workflow;

import com.warisan.agreement.domain.AgreementStatus;
import com.warisan.agreement.domain.SignatureContext;
import com.warisan.agreement.domain.SignatureProgress;
import com.warisan.agreement.domain.SignerType;
import com.warisan.agreement.domain.SigningCapabilities;
import com.warisan.agreement.domain.TransitionContext;
import com.warisan.agreement.domain.ValidationResult;
import com.warisan.agreement.domain.WorkflowStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Agreement status transitions and signing guards.
 *
 * <p>The transition table lives on {@link AgreementStatus}. Entering PENDING_SIGNATURES,
 * PENDING_WITNESS and ACTIVE additionally requires the owner signature, all beneficiary
 * signatures and the admin witness respectively. All violated conditions are reported.
 */
@Service
public class AgreementStatusMachine {

    private static final Set<AgreementStatus> CANCELLABLE = EnumSet.of(
        AgreementStatus.DRAFT,
        AgreementStatus.PENDING_SIGNATURES,
        AgreementStatus.PENDING_WITNESS
    );

    public ValidationResult validateStatusTransition(
        AgreementStatus current,
        AgreementStatus target,
        TransitionContext context
    ) {
        var errors = new ArrayList<String>();
        var ctx = context != null ? context : TransitionContext.none();

        if (!current.canTransitionTo(target)) {
            errors.add("Cannot transition from " + current + " to " + target
                + ". Allowed transitions: " + describe(current.allowedTransitions()));
        }

        switch (target) {
            case PENDING_SIGNATURES -> {
                if (!ctx.ownerHasSigned()) {
                    errors.add("Owner must sign before submitting for beneficiary signatures");
                }
            }
            case PENDING_WITNESS -> {
                if (!ctx.allBeneficiariesSigned()) {
                    errors.add("All beneficiaries must sign before submitting for witnessing");
                }
            }
            case ACTIVE -> {
                if (!ctx.witnessed()) {
                    errors.add("Agreement must be witnessed by an admin before becoming active");
                }
            }
            default -> {
                // no precondition beyond the transition table
            }
        }

        return ValidationResult.of(errors, List.of());
    }

    public ValidationResult validateSignature(SignerType signerType, AgreementStatus status, SignatureContext context) {
        var errors = new ArrayList<String>();
        var ctx = context != null ? context : SignatureContext.anonymous();

        switch (signerType) {
            case OWNER -> {
                if (!ctx.isOwner()) {
                    errors.add("Only the agreement owner can sign as owner");
                }
                if (status != AgreementStatus.DRAFT && status != AgreementStatus.PENDING_SIGNATURES) {
                    errors.add("Owner can only sign agreements in DRAFT or PENDING_SIGNATURES status. Current status: " + status);
                }
            }
            case BENEFICIARY -> {
                if (!ctx.isBeneficiary()) {
                    errors.add("Only designated beneficiaries can sign as beneficiary");
                }
                if (status != AgreementStatus.PENDING_SIGNATURES) {
                    errors.add("Beneficiaries can only sign agreements in PENDING_SIGNATURES status. Current status: " + status);
                }
            }
            case WITNESS -> {
                if (!ctx.isAdmin()) {
                    errors.add("Only admins can witness agreements");
                }
                if (status != AgreementStatus.PENDING_WITNESS) {
                    errors.add("Agreements can only be witnessed in PENDING_WITNESS status. Current status: " + status);
                }
            }
        }

        return ValidationResult.of(errors, List.of());
    }

    public boolean canEditAgreement(AgreementStatus status, String userId, String ownerId) {
        return status == AgreementStatus.DRAFT && userId != null && userId.equals(ownerId);
    }

    public boolean canCancelAgreement(AgreementStatus status) {
        return CANCELLABLE.contains(status);
    }

    public boolean canComplete(AgreementStatus status) {
        return status == AgreementStatus.ACTIVE;
    }

    /**
     * Allowed targets whose preconditions are already met.
     */
    public List<AgreementStatus> nextValidStatuses(AgreementStatus current, TransitionContext context) {
        return current.allowedTransitions().stream()
            .filter(target -> validateStatusTransition(current, target, context).valid())
            .toList();
    }

    /**
     * Status the agreement should be in given how far signing has progressed.
     */
    public WorkflowStatus workflowStatus(TransitionContext context) {
        if (!context.ownerHasSigned()) {
            return new WorkflowStatus(AgreementStatus.DRAFT, "Waiting for owner to sign");
        }
        if (!context.allBeneficiariesSigned()) {
            return new WorkflowStatus(AgreementStatus.PENDING_SIGNATURES, "Waiting for all beneficiaries to sign");
        }
        if (!context.witnessed()) {
            return new WorkflowStatus(AgreementStatus.PENDING_WITNESS, "Waiting for admin witness");
        }
        return new WorkflowStatus(AgreementStatus.ACTIVE, "Agreement fully executed");
    }

    public SignatureProgress signatureProgress(
        int totalBeneficiaries,
        int signedBeneficiaries,
        boolean ownerHasSigned,
        boolean witnessed
    ) {
        int total = 2 + totalBeneficiaries;
        int completed = signedBeneficiaries + (ownerHasSigned ? 1 : 0) + (witnessed ? 1 : 0);

        var steps = List.of(
            new SignatureProgress.Step("Owner Signature", ownerHasSigned),
            new SignatureProgress.Step("Beneficiary Signatures", signedBeneficiaries == totalBeneficiaries),
            new SignatureProgress.Step("Admin Witness", witnessed)
        );

        int percentage = total > 0 ? (int) Math.round(completed * 100.0 / total) : 0;
        return new SignatureProgress(total, completed, percentage, steps);
    }

    public SigningCapabilities signingCapabilities(
        String userId,
        String ownerId,
        AgreementStatus status,
        boolean isBeneficiary,
        boolean isAdmin
    ) {
        boolean isOwner = userId != null && userId.equals(ownerId);
        return new SigningCapabilities(
            isOwner && (status == AgreementStatus.DRAFT || status == AgreementStatus.PENDING_SIGNATURES),
            isBeneficiary && status == AgreementStatus.PENDING_SIGNATURES,
            isAdmin && status == AgreementStatus.PENDING_WITNESS
        );
    }

    private static String describe(Set<AgreementStatus> statuses) {
        if (statuses.isEmpty()) {
            return "none";
        }
        return statuses.stream().map(Enum::name).collect(Collectors.joining(", "));
    }
}
