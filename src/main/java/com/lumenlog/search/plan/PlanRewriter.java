package com.lumenlog.search.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces one node (by identity) and rebuilds its ancestors
 */
public class PlanRewriter implements PlanVisitor<PlanNode> {

    private final PlanNode target;
    private final PlanNode replacement;

    private PlanRewriter(PlanNode target, PlanNode replacement) {
        this.target = target;
        this.replacement = replacement;
    }

    public static PlanNode replace(PlanNode plan, PlanNode target, PlanNode replacement) {
        return plan.accept(new PlanRewriter(target, replacement));
    }

    @Override
    public PlanNode visitOperator(OperatorNode node) {
        if (node == target) {
            return replacement;
        }
        List<PlanNode> children = new ArrayList<>();
        boolean changed = false;
        for (PlanNode child : node.children()) {
            PlanNode rewritten = child.accept(this);
            changed |= rewritten != child;
            children.add(rewritten);
        }
        return changed ? node.withChildren(children) : node;
    }

    @Override
    public PlanNode visitPlaceholder(PlaceholderScanNode node) {
        return node == target ? replacement : node;
    }

    @Override
    public PlanNode visitUnion(UnionScanNode node) {
        return node == target ? replacement : node;
    }
}
