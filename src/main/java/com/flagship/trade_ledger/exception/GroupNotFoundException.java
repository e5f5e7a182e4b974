package com.flagship.trade_ledger.exception;

import java.util.UUID;

public class GroupNotFoundException extends ResourceNotFoundException {

    public GroupNotFoundException(UUID groupId) {
        super("Group", groupId);
    }
}
