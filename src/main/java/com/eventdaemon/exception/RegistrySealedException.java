package com.eventdaemon.exception;

public class RegistrySealedException extends BaseException {

    public RegistrySealedException(String operation) {
        super(
                ErrorCode.REGISTRY_SEALED,
                "Event registry is sealed while the dispatch loop runs; cannot " + operation);
    }
}
