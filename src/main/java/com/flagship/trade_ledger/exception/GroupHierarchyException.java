package com.flagship.trade_ledger.exception;

/**
 * A group change would break the hierarchy (cycle, or a child whose type
 * differs from its parent's).
 */
public class GroupHierarchyException extends RuntimeException {

    public GroupHierarchyException(String message) {
        super(message);
    }
}
