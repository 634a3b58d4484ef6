package com.lumenlog.search.plan;

import com.lumenlog.search.exception.PlanShapeViolationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the placeholder scans of a plan tree
 */
public class PlaceholderFinder implements PlanVisitor<Void> {

    private final List<PlaceholderScanNode> found = new ArrayList<>();

    /**
     * The single placeholder of a partition plan. Zero or several placeholders is a shape violation.
     */
    public static PlaceholderScanNode findSingle(PlanNode plan) {
        PlaceholderFinder finder = new PlaceholderFinder();
        plan.accept(finder);
        if (finder.found.size() != 1) {
            throw new PlanShapeViolationException(
                "Expected exactly one placeholder scan in partition plan, found " + finder.found.size());
        }
        return finder.found.get(0);
    }

    @Override
    public Void visitOperator(OperatorNode node) {
        for (PlanNode child : node.children()) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitPlaceholder(PlaceholderScanNode node) {
        found.add(node);
        return null;
    }

    @Override
    public Void visitUnion(UnionScanNode node) {
        return null;
    }
}
