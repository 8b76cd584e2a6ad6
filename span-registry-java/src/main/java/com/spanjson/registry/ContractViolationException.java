package com.spanjson.registry;

/**
 * Thrown when the host engine and a layer disagree about span state: a callback names a
 * span that does not exist, per-span data a layer attached is missing, or a span is closed
 * without ever having been entered.
 *
 * These are wiring bugs, not runtime conditions. Nothing in this project catches it.
 */
public class ContractViolationException extends IllegalStateException {

    public ContractViolationException(String message) {
        super(message);
    }
}
