package org.checkpulse.contract;

/**
 * Thrown when a check's stdout is not a valid result contract.
 */
public class ContractViolationException extends Exception {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
