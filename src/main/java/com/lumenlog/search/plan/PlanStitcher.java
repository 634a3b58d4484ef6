package com.lumenlog.search.plan;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.exception.PlanShapeViolationException;
import com.lumenlog.search.exception.SearchException;
import com.lumenlog.search.exception.StreamDeletingException;
import com.lumenlog.search.exception.StreamNotFoundException;
import com.lumenlog.search.exception.UpstreamIoException;
import com.lumenlog.search.plan.tier.ScanStats;
import com.lumenlog.search.plan.tier.StitchContext;
import com.lumenlog.search.plan.tier.TierSource;
import com.lumenlog.search.plan.tier.TierTable;
import com.lumenlog.search.schema.SchemaResolver;
import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamSettings;
import com.lumenlog.search.sql.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds a storage-agnostic partition plan to concrete data.
 *
 * The incoming plan carries exactly one placeholder scan. The stitcher resolves the data of
 * every storage tier for that stream partition, unions the tiers under the placeholder's
 * schema, projection, filters and limit, and swaps the union in for the placeholder.
 * Any tier failure fails the whole partition.
 */
@Service
public class PlanStitcher {

    private static final Logger log = LoggerFactory.getLogger(PlanStitcher.class);

    private final SearchEngineConfig config;
    private final SchemaResolver schemaResolver;
    private final PlanCodec codec;
    private final List<TierSource> tierSources;

    @Autowired
    public PlanStitcher(SearchEngineConfig config, SchemaResolver schemaResolver, PlanCodec codec,
                        List<TierSource> tierSources) {
        this.config = config;
        this.schemaResolver = schemaResolver;
        this.codec = codec;
        this.tierSources = tierSources;
    }

    public StitchResult stitch(StitchRequest request) {
        PlanNode plan = codec.decode(request.getPlan());
        PlaceholderScanNode placeholder = PlaceholderFinder.findSingle(plan);
        if (request.getStreamName() != null && !request.getStreamName().equals(placeholder.getStreamName())) {
            throw new PlanShapeViolationException("Placeholder scans stream [" + placeholder.getStreamName()
                + "] but partition targets [" + request.getStreamName() + "]");
        }

        String org = placeholder.getOrg() != null ? placeholder.getOrg() : request.getOrg();
        String stream = placeholder.getStreamName();
        StreamSchema schema = placeholder.getSchema();
        if (schema == null || schema.isEmpty()) {
            schema = schemaResolver.getSchema(org, stream, placeholder.getStreamType())
                .orElseThrow(() -> new StreamNotFoundException("Stream not found: " + stream));
        }

        if (schemaResolver.isDeleting(org, stream, placeholder.getStreamType())) {
            throw new StreamDeletingException(stream);
        }

        StreamSettings settings = schemaResolver.getSettings(org, stream, placeholder.getStreamType());
        if (settings == null) {
            settings = StreamSettings.defaults();
        }
        StitchContext ctx = new StitchContext(
            request.getTraceId(), org, placeholder.getStreamType(), stream, request.getTimeRange(),
            settings.getPartitionKeys(),
            narrow(request.getEqualItems(), schema),
            narrow(request.getPrefixItems(), schema),
            ftsFields(settings, schema),
            request.getIndexCondition(),
            request.getFileIds(),
            request.getIndexFiles());

        boolean ingester = config.getNode().getRole().isIngester();
        ScanStats stats = new ScanStats();
        List<TierTable> tables = new ArrayList<>();
        for (TierSource source : tierSources) {
            if (source.ingesterOnly() && !ingester) {
                continue;
            }
            TierTable table;
            try {
                table = source.build(ctx, stats);
            } catch (SearchException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new UpstreamIoException("Failed to build " + source.tier() + " source for stream ["
                    + stream + "]: " + e.getMessage(), e);
            }
            if (table != null) {
                tables.add(table);
            }
        }

        UnionScanNode union = new UnionScanNode(schema, placeholder.getProjection(), placeholder.getFilters(),
            placeholder.getLimit(), tables);
        PlanNode stitched = PlanRewriter.replace(plan, placeholder, union);
        log.info("[trace_id {}] stitched {}/{}/{}: {} tiers, {}", request.getTraceId(), org,
            placeholder.getStreamType(), stream, tables.size(), stats);
        return new StitchResult(stitched, stats);
    }

    /**
     * Stitch and re-encode for shipping to the execution runtime
     */
    public byte[] stitchToBytes(StitchRequest request) {
        return codec.encode(stitch(request).getPlan());
    }

    static Map<String, List<FieldValue>> narrow(Collection<FieldValue> items, StreamSchema schema) {
        Map<String, List<FieldValue>> byField = new LinkedHashMap<>();
        for (FieldValue item : items) {
            if (schema.hasField(item.getField())) {
                byField.computeIfAbsent(item.getField(), k -> new ArrayList<>()).add(item);
            }
        }
        return byField;
    }

    private List<String> ftsFields(StreamSettings settings, StreamSchema schema) {
        Collection<String> candidates = settings.getFtsFields();
        if (candidates == null || candidates.isEmpty()) {
            candidates = config.getCommon().getDefaultFtsFields();
        }
        List<String> fields = new ArrayList<>();
        for (String field : candidates) {
            if (schema.hasField(field)) {
                fields.add(field);
            }
        }
        return fields;
    }
}
