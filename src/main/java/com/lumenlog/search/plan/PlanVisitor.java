package com.lumenlog.search.plan;

public interface PlanVisitor<R> {

    R visitOperator(OperatorNode node);

    R visitPlaceholder(PlaceholderScanNode node);

    R visitUnion(UnionScanNode node);
}
