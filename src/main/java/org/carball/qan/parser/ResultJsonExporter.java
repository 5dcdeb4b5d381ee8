package org.carball.qan.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.qan.model.report.Result;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes interval results as indented JSON or YAML and reads them back.
 */
@Slf4j
public class ResultJsonExporter {

    private static final TypeReference<List<Result>> RESULT_LIST = new TypeReference<>() { };

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ResultJsonExporter() {
        this.jsonMapper = configure(new ObjectMapper());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public String toJson(Result result) throws JsonProcessingException {
        return jsonMapper.writeValueAsString(result);
    }

    public Result fromJson(String json) throws JsonProcessingException {
        return jsonMapper.readValue(json, Result.class);
    }

    public void write(List<Result> results, Path file, ExportFormat format) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper(format).writeValue(file.toFile(), results);
        log.info("Wrote {} results to {}", results.size(), file);
    }

    public List<Result> read(Path file, ExportFormat format) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Result file not found: " + file);
        }
        return mapper(format).readValue(file.toFile(), RESULT_LIST);
    }

    private ObjectMapper mapper(ExportFormat format) {
        return format == ExportFormat.YAML ? yamlMapper : jsonMapper;
    }
}
