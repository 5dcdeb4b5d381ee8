package org.carball.qan.analyzer;

import org.carball.qan.model.report.Result;

import java.io.IOException;

/**
 * Receives the result of every interval that produced one. Shipping or storing it is up to
 * the implementation.
 */
@FunctionalInterface
public interface ResultSink {

    void accept(String instance, Result result) throws IOException;
}
