package com.rebenew.watchParty.syncserver.error;

// El mensaje entrante no pasó la validación de frontera.
public class InvalidMessageException extends RuntimeException {

    public InvalidMessageException(String message) {
        super(message);
    }
}
