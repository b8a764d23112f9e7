package com.policyledger.audit;

public class SealedLogException extends RuntimeException {

    public SealedLogException(String tenantId, String logId) {
        super("Audit log " + logId + " for tenant " + tenantId + " is sealed");
    }
}
