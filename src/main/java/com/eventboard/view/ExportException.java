package com.eventboard.view;

/**
 * CSV export could not be produced: nothing to export, or the file could not be written.
 */
public class ExportException extends Exception {
    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
