package com.dispatchplatform.common.exception;

/** The call-log API rejected our credentials. Triggers one re-authentication per request. */
public class AuthExpiredException extends ExternalServiceException {

    public AuthExpiredException(String service, String message) {
        super(service, message);
    }
}
