package com.bank.lease.domain.exception;

/**
 * Malformed scoring or rule configuration. Fatal and never retried.
 */
public class ConfigurationException extends LeaseReconciliationException {

    public ConfigurationException(String message) {
        super(message);
    }
}
