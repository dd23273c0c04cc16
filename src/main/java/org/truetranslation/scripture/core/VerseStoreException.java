package org.truetranslation.scripture.core;

public class VerseStoreException extends RuntimeException {

    public VerseStoreException(String message) {
        super(message);
    }

    public VerseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
