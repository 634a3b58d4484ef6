package com.lumenlog.search.sql;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.dto.SearchRequest;
import com.lumenlog.search.schema.SchemaResolver;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.pass.AnalysisContext;
import com.lumenlog.search.sql.pass.ColumnCollectPass;
import com.lumenlog.search.sql.pass.ColumnInjectionPass;
import com.lumenlog.search.sql.pass.DefaultOrderPass;
import com.lumenlog.search.sql.pass.EffectiveSchemaPass;
import com.lumenlog.search.sql.pass.HistogramPass;
import com.lumenlog.search.sql.pass.IndexConditionPass;
import com.lumenlog.search.sql.pass.MatchTermPass;
import com.lumenlog.search.sql.pass.PartitionHintPass;
import com.lumenlog.search.sql.pass.PrefixHintPass;
import com.lumenlog.search.sql.pass.RewritePass;
import com.lumenlog.search.sql.pass.StreamResolutionPass;
import com.lumenlog.search.sql.pass.TotalHitsPass;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Analyzes and rewrites search SQL.
 *
 * Passes run in a fixed order; later passes depend on what earlier ones recorded:
 * stream resolution, total-hits rewrite, column collection, default ordering, match terms,
 * effective schema, partition and prefix hints, histogram interval, column injection and
 * index condition extraction.
 */
@Component
public class SqlAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SqlAnalyzer.class);

    private final SearchEngineConfig config;
    private final SchemaResolver schemaResolver;
    private final List<RewritePass> passes;

    @Autowired
    public SqlAnalyzer(SearchEngineConfig config, SchemaResolver schemaResolver) {
        this.config = config;
        this.schemaResolver = schemaResolver;
        this.passes = Collections.unmodifiableList(Arrays.asList(
            new StreamResolutionPass(),
            new TotalHitsPass(),
            new ColumnCollectPass(),
            new DefaultOrderPass(),
            new MatchTermPass(),
            new EffectiveSchemaPass(),
            new PartitionHintPass(),
            new PrefixHintPass(),
            new HistogramPass(),
            new ColumnInjectionPass(),
            new IndexConditionPass()));
    }

    public List<RewritePass> getPasses() {
        return passes;
    }

    public ParsedQuery analyze(String org, StreamType streamType, SearchRequest request) {
        SqlSelect select = SqlSupport.parseSelect(request.getSql());
        AnalysisContext context = new AnalysisContext(config, schemaResolver, org, streamType, request);
        for (RewritePass pass : passes) {
            select = pass.apply(select, context);
        }

        ParsedQuery parsed = ParsedQuery.builder()
            .sql(SqlSupport.unparse(select))
            .originalSql(request.getSql())
            .org(org)
            .streamType(streamType)
            .streamNames(context.getStreamNames())
            .matchTerms(context.getMatchTerms())
            .equalItems(context.getEqualItems())
            .prefixItems(context.getPrefixItems())
            .columns(context.getColumns())
            .aliases(context.getAliases())
            .schemas(context.getEffectiveSchemas())
            .limit(resolveLimit(request, select))
            .offset(Math.max(0, request.getFrom()))
            .timeRange(context.getTimeRange())
            .groupBy(new ArrayList<>(context.getGroupBy()))
            .orderBy(context.getOrderBy())
            .histogramInterval(context.getHistogramInterval())
            .sortedByTime(context.isSortedByTime())
            .useInvertedIndex(context.isUseInvertedIndex())
            .indexCondition(context.getIndexCondition())
            .trackTotalHits(context.isTotalHitsRewritten())
            .aggregate(context.isAggregate())
            .distinct(context.isDistinct())
            .wildcard(context.isWildcard())
            .complex(context.isComplex())
            .resultTimestampColumn(context.getResultTimestampColumn())
            .build();
        log.info("Analyzed query on {}: sortedByTime={}, histogram={}s, equalItems={}, prefixItems={}, index={}",
            parsed.getStreamNames(), parsed.isSortedByTime(), parsed.getHistogramInterval(),
            parsed.getEqualItems(), parsed.getPrefixItems(),
            parsed.getIndexCondition().map(c -> c.toQueryString()).orElse("none"));
        return parsed;
    }

    /**
     * Request size wins; otherwise the SQL LIMIT; otherwise the configured default
     */
    private int resolveLimit(SearchRequest request, SqlSelect select) {
        if (request.getSize() > 0) {
            return request.getSize();
        }
        if (select.getFetch() instanceof SqlNumericLiteral) {
            return ((SqlNumericLiteral) select.getFetch()).intValue(true);
        }
        return config.getLimit().getQueryDefaultLimit();
    }
}
