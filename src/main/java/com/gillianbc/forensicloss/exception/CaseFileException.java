package com.gillianbc.forensicloss.exception;

/**
 * Reading a case configuration file or writing case outputs failed.
 */
public class CaseFileException extends RuntimeException {

    public CaseFileException(String message) {
        super(message);
    }

    public CaseFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
