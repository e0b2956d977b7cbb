package com.voterimport.voterimport;

/**
 * Fatal condition that stops an onboarding or import run.
 */
public class VoterImportException extends RuntimeException {

    public VoterImportException(String message) {
        super(message);
    }

    public VoterImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
