package org.carball.qan.model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One class of queries within a result: every row sharing a digest or fingerprint, folded.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryClass {

    @JsonProperty("id")
    private String id;

    @JsonProperty("fingerprint")
    private String fingerprint;

    @JsonProperty("example")
    private String example;

    @JsonProperty("total_queries")
    private long totalQueries;

    @JsonProperty("metrics")
    private Metrics metrics = new Metrics();

    public QueryClass(String id) {
        this.id = id;
    }
}
