package dev.flowc.validate;

import dev.flowc.ir.Block;
import dev.flowc.ir.ConsensusStrategy;
import dev.flowc.ir.EvmChainUsage;
import dev.flowc.ir.Operation;
import dev.flowc.ir.ResponseFormat;
import dev.flowc.ir.SecretDeclaration;
import dev.flowc.ir.TriggerDef;
import dev.flowc.ir.ValueExpr;
import dev.flowc.ir.WorkflowIR;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.flowc.IrFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class IrValidatorTest {

    private static List<String> codes(List<Violation> violations) {
        return violations.stream().map(Violation::code).toList();
    }

    private static Block diamond() {
        return Block.of(
            http("h"),
            branch("b",
                Block.of(code("x", ValueExpr.binding("h", "body"))),
                Block.of(code("y")),
                "m"),
            merge("m", "b", ValueExpr.binding("x", ""), ValueExpr.binding("y", "")),
            ret("r", ValueExpr.binding("m", "")));
    }

    @Test
    void wellFormedDiamondIsValid() {
        assertThat(IrValidator.validate(ir(diamond()))).isEmpty();
    }

    @Test
    void emptyBodyIsTheOnlyViolation() {
        assertThat(codes(IrValidator.validate(ir(Block.empty())))).containsExactly("E001");
    }

    @Test
    void duplicateStepIdsAcrossArms() {
        var body = Block.of(
            branch("b", Block.of(code("a"), ret("done", ValueExpr.nullValue())),
                Block.of(code("a"), error("fail")), null));

        var violations = IrValidator.validate(ir(body));

        assertThat(violations).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E002");
            assertThat(v.message()).isEqualTo("Duplicate step id 'a'");
        });
    }

    @Test
    void referenceToUnknownStep() {
        var body = Block.of(ret("r", ValueExpr.binding("ghost", "value")));

        assertThat(IrValidator.validate(ir(body))).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E003");
            assertThat(v.message()).isEqualTo("Step 'r' references unknown step 'ghost'");
        });
    }

    @Test
    void referenceToStepWithoutOutput() {
        var body = Block.of(log("note", ValueExpr.string("hi")), ret("r", ValueExpr.binding("note", "")));

        assertThat(IrValidator.validate(ir(body))).extracting(Violation::message)
            .containsExactly("Step 'r' references step 'note', which produces no output");
    }

    @Test
    void siblingArmIsNotInScope() {
        var body = Block.of(
            branch("b",
                Block.of(code("x"), ret("t", ValueExpr.nullValue())),
                Block.of(code("y", ValueExpr.binding("x", "")), ret("f", ValueExpr.nullValue())),
                null));

        assertThat(IrValidator.validate(ir(body))).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E003");
            assertThat(v.stepId()).isEqualTo("y");
            assertThat(v.message()).endsWith("which is not in scope at this point");
        });
    }

    @Test
    void forwardReferenceIsNotInScope() {
        var body = Block.of(code("a", ValueExpr.binding("b", "")), code("b"), ret("r", ValueExpr.nullValue()));

        assertThat(codes(IrValidator.validate(ir(body)))).containsExactly("E003");
    }

    @Test
    void armBindingsDoNotLeakPastTheMerge() {
        var body = Block.of(
            branch("b", Block.of(code("x")), Block.of(code("y")), "m"),
            merge("m", "b", ValueExpr.binding("x", ""), ValueExpr.binding("y", "")),
            ret("r", ValueExpr.binding("x", "")));

        assertThat(IrValidator.validate(ir(body))).extracting(Violation::stepId).containsExactly("r");
    }

    @Test
    void reconvergenceTargetMustFollowTheBranch() {
        var body = Block.of(
            branch("b", Block.of(code("x")), Block.of(code("y")), "m"),
            ret("r", ValueExpr.nullValue()));

        var violations = IrValidator.validate(ir(body));

        assertThat(codes(violations)).containsExactly("E004", "E006");
        assertThat(violations.get(0).message()).isEqualTo("Branch 'b' reconverges at 'm' but is followed by 'r'");
    }

    @Test
    void reconvergingBranchAtEndOfBlock() {
        var body = Block.of(
            code("a"),
            branch("b", Block.of(code("x")), Block.of(code("y")), "m"));

        var violations = IrValidator.validate(ir(body));

        assertThat(codes(violations)).contains("E004");
        assertThat(violations).extracting(Violation::message)
            .contains("Branch 'b' reconverges at 'm' but no step follows it");
    }

    @Test
    void mergeMustNameItsBranch() {
        var body = Block.of(
            branch("b", Block.of(code("x")), Block.of(code("y")), "m"),
            merge("m", "other", ValueExpr.binding("x", ""), ValueExpr.binding("y", "")),
            ret("r", ValueExpr.binding("m", "")));

        assertThat(IrValidator.validate(ir(body))).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E005");
            assertThat(v.message()).isEqualTo("Merge 'm' follows branch 'b' but names branch 'other'");
        });
    }

    @Test
    void undeclaredSecretsAreReported() {
        var body = Block.of(
            secret("key", "API_KEY"),
            authenticatedHttp("call", "TOKEN"),
            ret("r", ValueExpr.nullValue()));
        WorkflowIR ir = ir(body, List.of(new SecretDeclaration("API_KEY", "API_KEY_ENV")), List.of());

        assertThat(IrValidator.validate(ir)).extracting(Violation::message)
            .containsExactly("Step 'call' uses undeclared secret 'TOKEN'");
    }

    @Test
    void undeclaredEvmClientsAreReported() {
        var body = Block.of(
            evmRead("read", EVM_CLIENT),
            evmWrite("write", "evmClient_unknown"),
            ret("r", ValueExpr.nullValue()));
        var trigger = new TriggerDef.EvmLog("evmClient_base", List.of(), "Transfer()", "{}", List.of(), "finalized");
        WorkflowIR base = ir(body);
        WorkflowIR ir = new WorkflowIR(base.metadata(), trigger, base.triggerParam(), base.configSchema(),
            base.requiredSecrets(), base.evmChains(), base.userRpcs(), body);

        var violations = IrValidator.validate(ir);

        assertThat(codes(violations)).containsExactly("E008", "E008");
        assertThat(violations.get(0).stepId()).isNull();
        assertThat(violations.get(1).stepId()).isEqualTo("write");
    }

    @Test
    void budgetChargesTheMoreExpensiveArm() {
        var body = Block.of(
            http("h1"), http("h2"), http("h3"),
            branch("b",
                Block.of(http("t1"), http("t2"), http("t3"), ret("t", ValueExpr.nullValue())),
                Block.of(http("f1"), http("f2"), error("f")),
                null));

        assertThat(IrValidator.validate(ir(body))).extracting(Violation::message)
            .containsExactly("Up to 6 HTTP/AI calls per execution exceeds the limit of 5");
        assertThat(IrValidator.validate(ir(body), CapabilityBudget.defaults().withOverrides(6, null, null)))
            .isEmpty();
    }

    @Test
    void evmReadAndWriteCeilings() {
        var body = Block.of(evmRead("read", EVM_CLIENT), evmWrite("write", EVM_CLIENT), ret("r", ValueExpr.nullValue()));

        var violations = IrValidator.validate(ir(body), new CapabilityBudget(5, 0, 0));

        assertThat(codes(violations)).containsExactly("E010", "E011");
    }

    @Test
    void bodyMustEndEveryPath() {
        var fallsOff = Block.of(code("a"));
        var oneArmOpen = Block.of(
            branch("b", Block.of(ret("t", ValueExpr.nullValue())), Block.of(code("f")), null));
        var bothArmsClosed = Block.of(
            branch("b", Block.of(ret("t", ValueExpr.nullValue())), Block.of(error("f")), null));

        assertThat(codes(IrValidator.validate(ir(fallsOff)))).containsExactly("E012");
        assertThat(codes(IrValidator.validate(ir(oneArmOpen)))).containsExactly("E012");
        assertThat(IrValidator.validate(ir(bothArmsClosed))).isEmpty();
        assertThat(IrValidator.terminates(diamond())).isTrue();
        assertThat(IrValidator.terminates(Block.empty())).isFalse();
    }

    @Test
    void onlyTheLastStepCountsAsTheEnd() {
        var stepsAfterReturn = Block.of(ret("r", ValueExpr.nullValue()), code("after"));
        var armContinuesAfterReturn = Block.of(branch("b",
            Block.of(ret("t", ValueExpr.nullValue()), log("tl", ValueExpr.string("late"))),
            Block.of(error("f")),
            null));

        assertThat(codes(IrValidator.validate(ir(stepsAfterReturn)))).containsExactly("E012");
        assertThat(codes(IrValidator.validate(ir(armContinuesAfterReturn)))).containsExactly("E012");
    }

    @Test
    void aiCallWithoutKeyOrSystemPromptValidates() {
        var ai = new Operation.AiCall("openai", ValueExpr.string("https://api.openai.com"),
            ValueExpr.string("gpt-4o"), null, null, ValueExpr.string("hi"), null, null,
            ResponseFormat.TEXT, ConsensusStrategy.identical());
        var body = Block.of(step("ai", ai, output("ai")), ret("r", ValueExpr.binding("ai", "")));

        assertThat(IrValidator.validate(ir(body))).isEmpty();
    }

    @Test
    void mergeOutsideItsBranchIsStray() {
        var body = Block.of(
            code("a"),
            merge("m", "b", ValueExpr.binding("a", ""), ValueExpr.binding("a", "")),
            ret("r", ValueExpr.binding("m", "")));

        assertThat(IrValidator.validate(ir(body))).singleElement().satisfies(v -> {
            assertThat(v.code()).isEqualTo("E013");
            assertThat(v.stepId()).isEqualTo("m");
        });
    }

    @Test
    void everyViolationIsReportedInRuleOrder() {
        var body = Block.of(
            secret("key", "MISSING"),
            code("key", ValueExpr.binding("ghost", "")),
            evmWrite("write", "evmClient_nowhere"));
        WorkflowIR ir = ir(body, List.of(), List.of(new EvmChainUsage("x", "evmClient_x", false)));

        assertThat(codes(IrValidator.validate(ir))).containsExactly("E002", "E003", "E007", "E008", "E012");
    }
}
