package dev.flowc.ir;

import java.util.List;

/**
 * Ordered sequence of steps, executed top to bottom. Used for the handler body and for each branch arm.
 */
public record Block(List<Step> steps) {

    public static Block of(Step... steps) {
        return new Block(List.of(steps));
    }

    public static Block empty() {
        return new Block(List.of());
    }
}
