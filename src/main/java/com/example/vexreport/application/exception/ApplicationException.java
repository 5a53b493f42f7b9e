package com.example.vexreport.application.exception;

/**
 * Failure raised by an application service before or around a batch run, as opposed to the rejection of a single
 * input file. The command-line runner reports it and exits with a non-zero status.
 */
public abstract class ApplicationException extends RuntimeException {

    protected ApplicationException(String message) {
        super(message);
    }
}
