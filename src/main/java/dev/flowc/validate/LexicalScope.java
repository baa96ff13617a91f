package dev.flowc.validate;

import java.util.HashSet;
import java.util.Set;

/**
 * Step bindings visible at one point of the block tree. Forking copies the set, so bindings defined in
 * a fork never reach the parent or a sibling fork.
 */
public final class LexicalScope {

    private final Set<String> visible;

    private LexicalScope(Set<String> visible) {
        this.visible = visible;
    }

    public static LexicalScope root() {
        return new LexicalScope(new HashSet<>());
    }

    public LexicalScope fork() {
        return new LexicalScope(new HashSet<>(visible));
    }

    public void define(String stepId) {
        visible.add(stepId);
    }

    public boolean contains(String stepId) {
        return visible.contains(stepId);
    }
}
