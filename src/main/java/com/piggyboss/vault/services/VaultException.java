package com.piggyboss.vault.services;

/**
 * Rejection raised by the vault engine. Every code belongs to a {@link Category};
 * validation and state-conflict failures are raised before anything is mutated,
 * collaborator failures after a full rollback.
 */
public class VaultException extends Exception {

    public enum Category {
        VALIDATION_ERROR,
        STATE_CONFLICT,
        COLLABORATOR_FAILURE
    }

    public enum ErrorCode {
        PLAN_NOT_FOUND(Category.VALIDATION_ERROR, "Savings plan not found"),
        PLAN_INACTIVE(Category.VALIDATION_ERROR, "Savings plan is not active"),
        INVALID_PLAN(Category.VALIDATION_ERROR, "Invalid savings plan parameters"),
        AMOUNT_OUT_OF_RANGE(Category.VALIDATION_ERROR, "Amount is outside the plan limits"),
        ZERO_PRINCIPAL(Category.VALIDATION_ERROR, "Principal must be greater than zero"),
        NOT_OWNER(Category.VALIDATION_ERROR, "Caller does not own this deposit"),
        NOT_ADMIN(Category.VALIDATION_ERROR, "Admin access required"),
        MULTIPLIER_OUT_OF_RANGE(Category.VALIDATION_ERROR, "Multiplier must be between 5000 and 20000 bps"),
        DEPOSIT_NOT_FOUND(Category.VALIDATION_ERROR, "Deposit not found"),
        POSITION_NOT_FOUND(Category.VALIDATION_ERROR, "Yield position not found"),
        ALREADY_WITHDRAWN(Category.STATE_CONFLICT, "Deposit already withdrawn"),
        NOT_MATURED(Category.STATE_CONFLICT, "Deposit has not matured yet"),
        POSITION_ALREADY_FINALIZED(Category.STATE_CONFLICT, "Yield position already finalized"),
        VAULT_PAUSED(Category.STATE_CONFLICT, "Vault is paused for new deposits"),
        STORE_CONFLICT(Category.STATE_CONFLICT, "Vault state changed concurrently, retry the request"),
        TRANSFER_FAILED(Category.COLLABORATOR_FAILURE, "Transfer failed"),
        STORE_UNAVAILABLE(Category.COLLABORATOR_FAILURE, "Vault store unavailable");

        private final Category category;
        private final String description;

        ErrorCode(Category category, String description) {
            this.category = category;
            this.description = description;
        }

        public Category getCategory() {
            return category;
        }

        public String getDescription() {
            return description;
        }
    }

    private final ErrorCode errorCode;

    public VaultException(ErrorCode errorCode) {
        super(errorCode.getDescription());
        this.errorCode = errorCode;
    }

    public VaultException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public VaultException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Category getCategory() {
        return errorCode.getCategory();
    }
}
