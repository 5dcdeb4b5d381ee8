package org.carball.qan.model.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a counter metric; only the total is meaningful.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NumberStats {
    private long sum;

    public void add(long value) {
        sum += value;
    }
}
