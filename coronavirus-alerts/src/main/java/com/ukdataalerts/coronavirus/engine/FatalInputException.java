package com.ukdataalerts.coronavirus.engine;

/**
 * Input that makes a whole metric check meaningless. Aborts that check only;
 * the remaining checks of the run still execute.
 */
public class FatalInputException extends RuntimeException {

    public FatalInputException(String message) {
        super(message);
    }
}
