package com.flagship.erp_ledger.common.exception;

/**
 * The tenant is missing configuration a posting needs, typically an unmapped well-known account.
 */
public class ConfigurationException extends ErpException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
