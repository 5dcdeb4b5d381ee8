package org.carball.qan.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a document store's profiler collection ({@code system.profile}).
 *
 * <p>{@code query} carries the filter for the legacy wire protocol, {@code command} the whole
 * command document for the command protocol. Field order inside both is preserved, the first
 * key of a command names the operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemProfile {

    @JsonProperty("op")
    private String op;

    @JsonProperty("ns")
    private String ns;

    @JsonProperty("query")
    private JsonNode query;

    @JsonProperty("command")
    private JsonNode command;

    @JsonProperty("millis")
    private long millis;

    @JsonProperty("nreturned")
    private long nreturned;

    @JsonProperty("docsExamined")
    private long docsExamined;

    @JsonProperty("keysExamined")
    private long keysExamined;

    @JsonProperty("responseLength")
    private long responseLength;

    @JsonProperty("ts")
    private String ts;
}
