package com.flagship.erp_ledger.ledger;

/**
 * Result of deleting an account: accounts with ledger history are only deactivated.
 */
public enum AccountDeletion {
    DELETED,
    DEACTIVATED
}
