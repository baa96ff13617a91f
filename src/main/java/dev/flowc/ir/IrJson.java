package dev.flowc.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Path;

/**
 * JSON form of {@link WorkflowIR}, the hand-off format to code emission.
 */
public final class IrJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private IrJson() {}

    public static String write(WorkflowIR ir) throws JsonProcessingException {
        return MAPPER.writeValueAsString(ir);
    }

    public static void write(WorkflowIR ir, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), ir);
    }

    public static WorkflowIR read(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, WorkflowIR.class);
    }

    public static WorkflowIR read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), WorkflowIR.class);
    }
}
