package org.carball.qan.worker;

/**
 * A worker could not engage its row source or the capture of a snapshot failed.
 */
public class WorkerException extends Exception {

    public WorkerException(String message) {
        super(message);
    }

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
