package dev.flowc.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.flowc.ir.HttpAuth;
import dev.flowc.model.*;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static dev.flowc.WorkflowFixtures.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowLoaderTest {

    @Test
    void loadsWorkflowFromFile() throws IOException {
        Workflow workflow = WorkflowLoader.loadFromFile(document("price-diamond.json"));

        assertThat(workflow.id()).isEqualTo("price-alert");
        assertThat(workflow.name()).isEqualTo("Price alert");
        assertThat(workflow.version()).isEqualTo("1.2.0");
        assertThat(workflow.nodes()).hasSize(8);
        assertThat(workflow.trigger().id()).isEqualTo("trigger-1");
        assertThat(workflow.edges().get(0).id()).isEqualTo("trigger-1->fetch-price");
        assertThat(workflow.edges().get(3).sourceHandle()).isEqualTo("true");

        WorkflowNode check = workflow.nodes().get(3);
        assertThat(check.kind()).isEqualTo(NodeKind.IF);
        assertThat(check.label()).isEqualTo("Above threshold?");
        assertThat(((NodeConfig.If) check.config()).conditions())
            .containsExactly(new ConditionConfig("{{parse-price.value}}", "gt", "{{config.threshold}}"));

        assertThat(workflow.nodes().get(6).config()).isEqualTo(new NodeConfig.Merge("append", null));
    }

    @Test
    void appliesDocumentDefaults() throws IOException {
        String json = """
            {
              "id": "minimal",
              "nodes": [
                { "id": "t", "type": "httpTrigger", "data": { "config": {} } }
              ]
            }
            """;

        Workflow workflow = WorkflowLoader.loadFromString(json);

        assertThat(workflow.name()).isEqualTo("minimal");
        assertThat(workflow.version()).isEqualTo("1.0.0");
        assertThat(workflow.edges()).isEmpty();
        assertThat(workflow.globalConfig()).isEqualTo(GlobalConfig.empty());
        assertThat(workflow.nodes().get(0).label()).isEqualTo("t");
        assertThat(workflow.nodes().get(0).config()).isEqualTo(new NodeConfig.HttpTrigger("POST", null, List.of()));
    }

    @Test
    void readsAuthenticationSettingsAndGlobalConfig() throws IOException {
        String json = """
            {
              "id": "auth",
              "globalConfig": {
                "isTestnet": false,
                "defaultChainSelector": "ethereum-mainnet",
                "secrets": [ { "name": "TOKEN", "envVariable": "TOKEN_VAR" } ],
                "rpcs": [ { "chainName": "ethereum-mainnet", "url": "https://rpc.example.com" } ]
              },
              "nodes": [
                { "id": "t", "type": "cronTrigger", "data": { "config": { "schedule": "0 0 * * * *" } } },
                {
                  "id": "call",
                  "type": "httpRequest",
                  "data": {
                    "config": {
                      "url": "https://api.example.com",
                      "authentication": { "type": "bearerToken", "tokenSecret": "TOKEN" }
                    }
                  },
                  "settings": {
                    "returnExpression": "{{call.body}}",
                    "log": { "level": "debug", "messageTemplate": "called" }
                  }
                }
              ],
              "edges": [ { "id": "e1", "source": "t", "target": "call" } ]
            }
            """;

        Workflow workflow = WorkflowLoader.loadFromString(json);

        var config = (NodeConfig.HttpRequest) workflow.nodes().get(1).config();
        assertThat(config.method()).isEqualTo("GET");
        assertThat(config.authentication()).isEqualTo(new HttpAuth.BearerToken("TOKEN"));
        assertThat(workflow.nodes().get(1).settings()).isEqualTo(
            new NodeSettings("{{call.body}}", new NodeSettings.LogSettings("debug", "called")));
        assertThat(workflow.globalConfig().testnet()).isFalse();
        assertThat(workflow.globalConfig().secrets()).containsExactly(new SecretReference("TOKEN", "TOKEN_VAR"));
        assertThat(workflow.globalConfig().rpcs())
            .containsExactly(new RpcReference("ethereum-mainnet", "https://rpc.example.com"));
        assertThat(workflow.edges().get(0).id()).isEqualTo("e1");
    }

    @Test
    void tokenNodeKeepsItsAbiAsJsonText() throws IOException {
        Workflow workflow = WorkflowLoader.loadFromFile(document("kyc-minting.json"));

        var mint = (NodeConfig.TokenOperation) workflow.nodes().get(3).config();
        assertThat(mint.kind()).isEqualTo(NodeKind.MINT_TOKEN);
        assertThat(mint.tokenAbiJson()).isEqualTo("[]");
        assertThat(mint.accountSource()).isEqualTo("{{request.wallet}}");
    }

    @Test
    void missingIdIsRejected() {
        assertThatThrownBy(() -> WorkflowLoader.loadFromString("{ \"nodes\": [] }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing required field 'id' in workflow");
    }

    @Test
    void missingRequiredConfigNamesTheNode() {
        String json = """
            { "id": "x", "nodes": [ { "id": "fetch", "type": "httpRequest", "data": { "config": {} } } ] }
            """;

        assertThatThrownBy(() -> WorkflowLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing required field 'url' in node 'fetch'");
    }

    @Test
    void unknownNodeTypeIsRejected() {
        String json = """
            { "id": "x", "nodes": [ { "id": "n", "type": "teleport" } ] }
            """;

        assertThatThrownBy(() -> WorkflowLoader.loadFromString(json))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown node type: teleport");
    }

    @Test
    void malformedJsonIsAnIoError() {
        assertThatThrownBy(() -> WorkflowLoader.loadFromString("{ \"id\": "))
            .isInstanceOf(JsonProcessingException.class);
    }
}
