package io.modelpipe.pipeline;

import io.modelpipe.model.JobKind;

import java.util.List;

/**
 * Raised when a submission or a job result does not match the contract of its job kind.
 * Always raised before any state is touched.
 */
public final class JobContractException extends RuntimeException {
    public static final String CODE = "invalid_payload";

    public JobContractException(String message) {
        super(message);
    }

    public String code() {
        return CODE;
    }

    public List<String> allowedKinds() {
        return JobKind.wireNames();
    }
}
