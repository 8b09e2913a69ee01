package com.goldtracker.acquisition;

/**
 * A cycle cannot produce a usable result: no exchange rates, no benchmark, or no market at all.
 */
public class AcquisitionException extends Exception {

    public AcquisitionException(String message) {
        super(message);
    }
}
