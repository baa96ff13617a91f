package dev.flowc.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowc.engine.CompileResult;
import dev.flowc.engine.WorkflowCompiler;
import dev.flowc.validate.IrValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static dev.flowc.IrFixtures.*;
import static dev.flowc.WorkflowFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;

class IrJsonTest {

    private static WorkflowIR compile(String name) throws IOException {
        var result = new WorkflowCompiler().compileString(Files.readString(document(name)));
        return ((CompileResult.Success) result).ir();
    }

    @Test
    void compiledIrSurvivesSerialization() throws IOException {
        for (String name : new String[] {"price-diamond.json", "kyc-minting.json"}) {
            WorkflowIR ir = compile(name);

            assertThat(IrJson.read(IrJson.write(ir))).as(name).isEqualTo(ir);
        }
    }

    @Test
    void variantsCarryTypeDiscriminators() throws IOException {
        JsonNode tree = new ObjectMapper().readTree(IrJson.write(compile("price-diamond.json")));

        assertThat(tree.at("/trigger/type").asText()).isEqualTo("cron");
        assertThat(tree.at("/handlerBody/steps/2/operation/type").asText()).isEqualTo("branch");
        assertThat(tree.at("/handlerBody/steps/2/operation/reconvergeAt").asText()).isEqualTo("join");
        assertThat(tree.at("/handlerBody/steps/4/operation/expression/kind").asText()).isEqualTo("binding");
        assertThat(tree.at("/handlerBody/steps/0/operation/url/kind").asText()).isEqualTo("template");
    }

    @Test
    void violationsAreStableAcrossSerialization() throws IOException {
        var body = Block.of(
            authenticatedHttp("call", "TOKEN"),
            branch("b", Block.of(code("x")), Block.of(code("y", ValueExpr.binding("x", ""))), "m"),
            merge("m", "b", ValueExpr.binding("x", ""), ValueExpr.nullValue()));
        WorkflowIR ir = ir(body);

        var before = IrValidator.validate(ir);
        var after = IrValidator.validate(IrJson.read(IrJson.write(ir)));

        assertThat(before).isNotEmpty();
        assertThat(after).isEqualTo(before);
    }

    @Test
    void writesToFile(@TempDir Path dir) throws IOException {
        WorkflowIR ir = compile("kyc-minting.json");
        Path file = dir.resolve("kyc.ir.json");

        IrJson.write(ir, file);

        assertThat(IrJson.read(file)).isEqualTo(ir);
    }
}
