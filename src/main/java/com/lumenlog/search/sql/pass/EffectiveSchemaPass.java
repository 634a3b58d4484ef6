package com.lumenlog.search.sql.pass;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamSettings;
import org.apache.calcite.sql.SqlSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Chooses the columns each stream must expose to the execution engine
 */
public class EffectiveSchemaPass implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(EffectiveSchemaPass.class);

    static final String TIMESTAMP_TYPE = "Int64";
    static final String ROW_ID_TYPE = "Int64";

    @Override
    public String name() {
        return "effective-schema";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        for (String stream : context.getStreamNames()) {
            StreamSchema schema = context.isWildcard()
                ? wildcardSchema(stream, context)
                : projectedSchema(stream, context);
            context.getEffectiveSchemas().put(stream, schema);
            log.debug("Effective schema for {}: {}", stream, schema.fieldNames());
        }
        return select;
    }

    private StreamSchema wildcardSchema(String stream, AnalysisContext context) {
        SearchEngineConfig.CommonConfig common = context.getConfig().getCommon();
        StreamSchema full = context.getSchemas().get(stream);
        StreamSettings settings = context.getSettings().get(stream);

        if (settings.getDefinedSchemaFields().isEmpty()) {
            if (context.isColumnReferenced(common.getColumnOriginal())) {
                return full;
            }
            return full.without(common.getColumnOriginal());
        }

        Set<String> keep = new LinkedHashSet<>(settings.getDefinedSchemaFields());
        keep.add(context.timestampColumn());
        keep.add(context.rowIdColumn());
        if (!common.isExcludeAll()) {
            keep.add(common.getColumnAll());
        }
        return withReservedColumns(full.retain(keep), context);
    }

    private StreamSchema projectedSchema(String stream, AnalysisContext context) {
        StreamSchema full = context.getSchemas().get(stream);
        Set<String> keep = new LinkedHashSet<>(context.getColumns().getOrDefault(stream, new LinkedHashSet<>()));
        keep.add(context.timestampColumn());
        keep.add(context.rowIdColumn());
        if (!context.getMatchTerms().isEmpty()) {
            keep.addAll(context.ftsFields(stream));
        }
        return withReservedColumns(full.retain(keep), context);
    }

    private static StreamSchema withReservedColumns(StreamSchema schema, AnalysisContext context) {
        return schema
            .withField(context.timestampColumn(), TIMESTAMP_TYPE)
            .withField(context.rowIdColumn(), ROW_ID_TYPE);
    }
}
