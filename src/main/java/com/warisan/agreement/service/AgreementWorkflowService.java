package com.warisan.agreement.service;

import com.warisan.agreement.domain.Agreement;
import com.warisan.agreement.domain.AgreementInput;
import com.warisan.agreement.domain.AgreementStatus;
import com.warisan.agreement.domain.AssetAllocation;
import com.warisan.agreement.domain.BeneficiaryInput;
import com.warisan.agreement.domain.DistributionType;
import com.warisan.agreement.domain.SignatureContext;
import com.warisan.agreement.domain.SignerType;
import com.warisan.agreement.domain.TransitionContext;
import com.warisan.agreement.domain.ValidationResult;
import com.warisan.agreement.validation.AgreementValidator;
import com.warisan.agreement.workflow.AgreementStatusMachine;
import io.vavr.control.Either;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Agreement lifecycle operations over immutable {@link Agreement} values.
 * Uses Either for rejections: Left carries every collected error, Right the updated copy.
 * Persisting the result and serialising concurrent changes is up to the caller.
 */
@Service
public class AgreementWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(AgreementWorkflowService.class);

    private final AgreementStatusMachine statusMachine;
    private final AgreementValidator validator;

    public AgreementWorkflowService(AgreementStatusMachine statusMachine, AgreementValidator validator) {
        this.statusMachine = statusMachine;
        this.validator = validator;
    }

    // ========================================================================
    // STATUS
    // ========================================================================

    /**
     * Move an agreement to a new status with state machine validation.
     */
    public Either<ValidationResult, Agreement> transition(
        Agreement agreement, AgreementStatus target, TransitionContext context, String actor
    ) {
        var result = statusMachine.validateStatusTransition(agreement.status(), target, context);
        if (!result.valid()) {
            log.warn("Rejected transition of agreement {} from {} to {}: {}",
                agreement.id().orElse(null), agreement.status(), target, result.errors());
            return Either.left(result);
        }
        log.info("Agreement {} moved from {} to {} by {}",
            agreement.id().orElse(null), agreement.status(), target, actor);
        return Either.right(agreement.withStatus(target, actor));
    }

    /**
     * Submit a draft for beneficiary signatures. The full agreement content is validated
     * together with the transition so the owner sees every problem at once.
     */
    public Either<ValidationResult, Agreement> submitForSignatures(
        Agreement agreement, TransitionContext context, String actor
    ) {
        var result = validator.validateSubmission(agreement.toInput(), agreement.beneficiaries(), agreement.assets())
            .merge(statusMachine.validateStatusTransition(agreement.status(), AgreementStatus.PENDING_SIGNATURES, context));
        if (!result.valid()) {
            log.warn("Rejected submission of agreement {}: {}", agreement.id().orElse(null), result.errors());
            return Either.left(result);
        }
        return Either.right(agreement.withStatus(AgreementStatus.PENDING_SIGNATURES, actor));
    }

    /**
     * Cancel an agreement that has not yet become active.
     */
    public Either<ValidationResult, Agreement> cancel(Agreement agreement, String actor) {
        if (!statusMachine.canCancelAgreement(agreement.status())) {
            return Either.left(ValidationResult.error(
                "Agreement in status " + agreement.status() + " cannot be cancelled"));
        }
        return transition(agreement, AgreementStatus.CANCELLED, TransitionContext.none(), actor);
    }

    /**
     * Complete an active agreement once its assets have been distributed.
     */
    public Either<ValidationResult, Agreement> complete(Agreement agreement, String actor) {
        if (!statusMachine.canComplete(agreement.status())) {
            return Either.left(ValidationResult.error(
                "Only ACTIVE agreements can be completed. Current status: " + agreement.status()));
        }
        return transition(agreement, AgreementStatus.COMPLETED, TransitionContext.fullyExecuted(), actor);
    }

    // ========================================================================
    // EDIT & SIGN
    // ========================================================================

    /**
     * Replace header, beneficiaries and assets of a draft owned by the user.
     * A missing distribution type in the input keeps the current one.
     */
    public Either<ValidationResult, Agreement> edit(
        Agreement agreement,
        String userId,
        AgreementInput input,
        List<BeneficiaryInput> beneficiaries,
        List<AssetAllocation> assets
    ) {
        if (!statusMachine.canEditAgreement(agreement.status(), userId, agreement.ownerId())) {
            return Either.left(ValidationResult.error(
                "Only the owner can edit an agreement while it is in DRAFT status"));
        }

        var effectiveInput = input.distributionType().isPresent()
            ? input
            : new AgreementInput(input.title(), input.description(),
                Optional.of(agreement.distributionType().name()), input.effectiveDate(), input.expiryDate());

        var result = validator.validateSubmission(effectiveInput, beneficiaries, assets);
        if (!result.valid()) {
            return Either.left(result);
        }

        var distributionType = DistributionType.valueOf(effectiveInput.distributionType().get());
        var updated = agreement.withHeader(effectiveInput, distributionType, userId)
            .withAllocations(beneficiaries, assets);
        if (result.hasWarnings()) {
            log.debug("Agreement {} saved with warnings: {}", agreement.id().orElse(null), result.warnings());
        }
        return Either.right(updated);
    }

    /**
     * Check that a user may place the given signature on the agreement now.
     */
    public Either<ValidationResult, SignerType> authorizeSignature(
        Agreement agreement, SignerType signerType, String userId, boolean isBeneficiary, boolean isAdmin
    ) {
        var context = new SignatureContext(agreement.isOwnedBy(userId), isBeneficiary, isAdmin);
        var result = statusMachine.validateSignature(signerType, agreement.status(), context);
        if (!result.valid()) {
            return Either.left(result);
        }
        return Either.right(signerType);
    }
}
