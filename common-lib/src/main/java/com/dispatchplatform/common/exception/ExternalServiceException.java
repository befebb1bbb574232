package com.dispatchplatform.common.exception;

/** A call to an external collaborator (speech-to-text, reasoning, call-log API) failed. */
public class ExternalServiceException extends DispatchException {

    private final String service;

    public ExternalServiceException(String service, String message) {
        super("[" + service + "] " + message);
        this.service = service;
    }

    public ExternalServiceException(String service, String message, Throwable cause) {
        super("[" + service + "] " + message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
