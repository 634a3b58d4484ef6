package com.lumenlog.search.sql;

import com.google.common.collect.ImmutableSet;

import java.util.Locale;
import java.util.Set;

/**
 * Function names that make a query an aggregate query
 */
public final class AggregateFunctions {

    private static final Set<String> NAMES = ImmutableSet.of(
        "avg", "count", "max", "min", "sum", "median", "mean",
        "array_agg", "string_agg", "first_value", "last_value",
        "approx_distinct", "approx_median", "approx_percentile_cont",
        "approx_percentile_cont_with_weight", "approx_topk",
        "stddev", "stddev_pop", "stddev_samp", "var", "variance", "var_pop", "var_samp",
        "corr", "covar", "covar_pop", "covar_samp",
        "bit_and", "bit_or", "bit_xor", "bool_and", "bool_or",
        "percentile_cont", "grouping", "summary_percentile", "histogram_agg");

    private AggregateFunctions() {
    }

    public static boolean isAggregate(String functionName) {
        return functionName != null && NAMES.contains(functionName.toLowerCase(Locale.ROOT));
    }
}
