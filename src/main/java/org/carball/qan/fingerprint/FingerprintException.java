package org.carball.qan.fingerprint;

/**
 * Raised when a profiler document has no usable query to fingerprint.
 */
public class FingerprintException extends Exception {

    public FingerprintException(String message) {
        super(message);
    }
}
