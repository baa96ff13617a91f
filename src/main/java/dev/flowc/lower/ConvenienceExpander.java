package dev.flowc.lower;

import dev.flowc.ir.Step;
import dev.flowc.model.WorkflowNode;

import java.util.List;

/**
 * Rewrites high-level editor nodes into sequences of primitive steps before structuring.
 */
public interface ConvenienceExpander {

    /**
     * Primitive steps replacing {@code node}, in execution order. Empty when the node is primitive.
     *
     * @param node     the node to expand
     * @param resolver resolver for the node's reference strings
     */
    List<Step> expand(WorkflowNode node, ExpressionResolver resolver);

    /**
     * Id of the expanded step whose output stands for the node, or null when the node is primitive.
     * Downstream references to the node are redirected to this step.
     */
    String outputStepId(WorkflowNode node);

    default boolean handles(WorkflowNode node) {
        return outputStepId(node) != null;
    }
}
