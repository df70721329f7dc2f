package com.brayford.organization.infrastructure.web;

import com.brayford.security.AuthenticatedUserSerializer;
import com.brayford.security.BrayfordException;

/**
 * The request reached an authenticated route without a usable caller header.
 */
public class MissingCallerException extends BrayfordException {

    public static final String CODE = "missing-caller";

    public MissingCallerException(String reason) {
        super("Authentication required: " + reason + " " + AuthenticatedUserSerializer.HEADER + " header");
    }

    @Override
    public String errorCode() {
        return CODE;
    }
}
