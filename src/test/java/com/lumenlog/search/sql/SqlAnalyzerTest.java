package com.lumenlog.search.sql;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.dto.SearchRequest;
import com.lumenlog.search.exception.InvalidQueryException;
import com.lumenlog.search.exception.StreamNotFoundException;
import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamSettings;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.index.IndexCondition;
import com.lumenlog.search.support.FakeSchemaResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static com.lumenlog.search.support.FakeSchemaResolver.schema;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SqlAnalyzer - hint extraction and rewriting of search SQL
 */
public class SqlAnalyzerTest {

    private static final long START = 1_700_000_000_000_000L;
    private static final long END = START + 3600L * 1_000_000L;

    private SearchEngineConfig config;
    private FakeSchemaResolver resolver;
    private SqlAnalyzer analyzer;

    @BeforeEach
    public void setUp() {
        config = new SearchEngineConfig();
        resolver = new FakeSchemaResolver();
        resolver.addStream("logs", schema("_timestamp", "service", "message", "level"),
            StreamSettings.defaults().setIndexFields(new LinkedHashSet<>(Arrays.asList("message"))));
        resolver.addStream("audit", schema("_timestamp", "user_name", "host", "service"));
        analyzer = new SqlAnalyzer(config, resolver);
    }

    private ParsedQuery analyze(String sql) {
        return analyzer.analyze("default", StreamType.LOGS, new SearchRequest(sql, START, END));
    }

    @Test
    public void testPlainListingDefaultsToNewestFirst() {
        ParsedQuery parsed = analyze("SELECT service, message FROM logs");

        assertEquals(1, parsed.getOrderBy().size());
        assertEquals("_timestamp", parsed.getOrderBy().get(0).getField());
        assertTrue(parsed.getOrderBy().get(0).isDescending());
        assertTrue(parsed.isSortedByTime());
        assertFalse(parsed.isComplex());
        assertEquals("_timestamp", parsed.getResultTimestampColumn().orElse(null));
        assertTrue(parsed.getSql().contains("_timestamp"), "timestamp should be injected into projection");
    }

    @Test
    public void testExplicitOrderIsKept() {
        ParsedQuery parsed = analyze("SELECT service FROM logs ORDER BY service");

        assertEquals(1, parsed.getOrderBy().size());
        assertEquals("service", parsed.getOrderBy().get(0).getField());
        assertFalse(parsed.getOrderBy().get(0).isDescending());
        assertFalse(parsed.isSortedByTime());
    }

    @Test
    public void testAggregateGetsNoDefaultOrder() {
        ParsedQuery parsed = analyze("SELECT count(*) AS cnt FROM logs");

        assertTrue(parsed.isAggregate());
        assertTrue(parsed.isComplex());
        assertTrue(parsed.getOrderBy().isEmpty());
        assertFalse(parsed.isSortedByTime());
        assertFalse(parsed.getResultTimestampColumn().isPresent());
    }

    @Test
    public void testDistinctGetsNoDefaultOrder() {
        ParsedQuery parsed = analyze("SELECT DISTINCT service FROM logs");

        assertTrue(parsed.isDistinct());
        assertTrue(parsed.getOrderBy().isEmpty());
        assertFalse(parsed.getSql().contains("_timestamp"), "no columns are injected into DISTINCT");
    }

    @Test
    public void testWildcardWithDefinedSchemaKeepsTimestampAndRowId() {
        resolver.addStream("app", schema("service", "message", "level", "host"),
            StreamSettings.defaults().setDefinedSchemaFields(new LinkedHashSet<>(Arrays.asList("service", "level"))));

        ParsedQuery parsed = analyze("SELECT * FROM app");
        StreamSchema effective = parsed.getSchema("app");

        assertTrue(parsed.isWildcard());
        assertTrue(effective.hasField("_timestamp"));
        assertTrue(effective.hasField("_row_id"));
        assertTrue(effective.hasField("service"));
        assertTrue(effective.hasField("level"));
        assertFalse(effective.hasField("message"));
        assertFalse(effective.hasField("host"));
    }

    @Test
    public void testWildcardWithoutDefinedSchemaDropsOriginalColumn() {
        resolver.addStream("raw", schema("_timestamp", "service", "_original"));

        ParsedQuery parsed = analyze("SELECT * FROM raw");

        assertTrue(parsed.getSchema("raw").hasField("service"));
        assertFalse(parsed.getSchema("raw").hasField("_original"));
    }

    @Test
    public void testRowIdInjectedWhenStreamKeepsOriginals() {
        resolver.addStream("raw", schema("_timestamp", "service", "_original"),
            StreamSettings.defaults().setStoreOriginalData(true));

        ParsedQuery parsed = analyze("SELECT service FROM raw");

        assertFalse(parsed.isComplex());
        assertTrue(parsed.getSql().contains("_row_id"), "row id should be injected: " + parsed.getSql());
        assertTrue(parsed.getColumns().get("raw").contains("_row_id"));
    }

    @Test
    public void testRowIdNotInjectedWithoutOriginals() {
        ParsedQuery parsed = analyze("SELECT service FROM logs");

        assertTrue(parsed.getSql().contains("_timestamp"));
        assertFalse(parsed.getSql().contains("_row_id"), "row id is only injected for raw payload streams");
    }

    @Test
    public void testAliasDoesNotShadowColumnInWhere() {
        ParsedQuery parsed = analyze("SELECT upper(service) AS service FROM logs WHERE service = 'api'");

        assertTrue(parsed.getColumns().get("logs").contains("service"));
        assertTrue(parsed.getSchema("logs").hasField("service"));
        assertEquals(Collections.singletonList(new FieldValue("service", "api")), parsed.getEqualItems().get("logs"));
    }

    @Test
    public void testOrderByAliasIsNotAColumn() {
        ParsedQuery parsed = analyze("SELECT upper(message) AS shout FROM logs ORDER BY shout");

        assertTrue(parsed.getColumns().get("logs").contains("message"));
        assertFalse(parsed.getColumns().get("logs").contains("shout"));
        assertEquals("shout", parsed.getOrderBy().get(0).getField());
    }

    @Test
    public void testEqualityOnFieldOfOneStreamIsRecordedForThatStreamOnly() {
        ParsedQuery parsed = analyze(
            "SELECT l.message FROM logs l JOIN audit a ON l.service = a.service WHERE host = 'web-1'");

        assertEquals(Arrays.asList("logs", "audit"), parsed.getStreamNames());
        Map<String, List<FieldValue>> equalItems = parsed.getEqualItems();
        assertEquals(1, equalItems.size());
        assertEquals(Collections.singletonList(new FieldValue("host", "web-1")), equalItems.get("audit"));
        assertTrue(parsed.isComplex());
    }

    @Test
    public void testAmbiguousFieldProducesNoHint() {
        ParsedQuery parsed = analyze(
            "SELECT l.message FROM logs l JOIN audit a ON l.level = a.host WHERE service = 'api'");

        assertTrue(parsed.getEqualItems().isEmpty());
    }

    @Test
    public void testQualifiedFieldResolvesThroughAlias() {
        ParsedQuery parsed = analyze(
            "SELECT l.message FROM logs l JOIN audit a ON l.level = a.host WHERE a.service = 'api'");

        assertEquals(Collections.singletonList(new FieldValue("service", "api")), parsed.getEqualItems().get("audit"));
        assertNull(parsed.getEqualItems().get("logs"));
    }

    @Test
    public void testInListBecomesEqualItems() {
        ParsedQuery parsed = analyze("SELECT message FROM logs WHERE level IN ('error', 'warn')");

        assertEquals(Arrays.asList(new FieldValue("level", "error"), new FieldValue("level", "warn")),
            parsed.getEqualItems().get("logs"));
    }

    @Test
    public void testHistogramBucketCount() {
        ParsedQuery parsed = analyze(
            "SELECT histogram(_timestamp, 10) AS ts, count(*) AS cnt FROM logs GROUP BY ts");

        assertTrue(parsed.hasHistogram());
        assertEquals(360, parsed.getHistogramInterval());
        assertEquals("ts", parsed.getResultTimestampColumn().orElse(null));
    }

    @Test
    public void testHistogramDurationLiteral() {
        ParsedQuery parsed = analyze(
            "SELECT histogram(_timestamp, '5 minutes') AS ts, count(*) AS cnt FROM logs GROUP BY ts");

        assertEquals(300, parsed.getHistogramInterval());
    }

    @Test
    public void testEqualityAndPrefixHintsWithIndexCondition() {
        ParsedQuery parsed = analyze("SELECT * FROM logs WHERE service = 'a' AND message LIKE 'err%'");

        assertEquals(Collections.singletonList(new FieldValue("service", "a")), parsed.getEqualItems().get("logs"));
        assertEquals(Collections.singletonList(new FieldValue("message", "err")), parsed.getPrefixItems().get("logs"));

        assertTrue(parsed.isUseInvertedIndex());
        IndexCondition condition = parsed.getIndexCondition().orElse(null);
        assertNotNull(condition);
        assertEquals("message:err*", condition.toQueryString());
        assertFalse(condition.hasPreFilters());

        String sql = parsed.getSql().toUpperCase();
        assertFalse(sql.contains("LIKE"), "indexed prefix should leave the SQL filter: " + sql);
        assertTrue(sql.contains("SERVICE"), "non-indexed equality should stay: " + sql);
    }

    @Test
    public void testIndexedFilterKeptWhenRemovalDisabled() {
        config.getIndex().setRemoveFilterWithIndex(false);

        ParsedQuery parsed = analyze("SELECT * FROM logs WHERE message LIKE 'err%'");

        assertEquals("message:err*", parsed.getIndexCondition().get().toQueryString());
        assertTrue(parsed.getSql().toUpperCase().contains("LIKE"));
    }

    @Test
    public void testFullTextEqualityIsOnlyAPreFilter() {
        resolver.addStream("app", schema("_timestamp", "msg", "level"));

        ParsedQuery parsed = analyze("SELECT * FROM app WHERE msg = 'disk full'");

        IndexCondition condition = parsed.getIndexCondition().orElse(null);
        assertNotNull(condition);
        assertTrue(condition.hasPreFilters());
        assertEquals("msg:disk full", condition.toQueryString());
        assertTrue(parsed.getSql().contains("disk full"), "pre-filtered conjunct must stay in SQL");
    }

    @Test
    public void testMatchAllContributesTermAndIndexCondition() {
        ParsedQuery parsed = analyze("SELECT service FROM logs WHERE match_all('timeout')");

        assertEquals(Collections.singletonList("timeout"), parsed.getMatchTerms());
        assertEquals("timeout*", parsed.getIndexCondition().get().toQueryString());
        assertTrue(parsed.getSchema("logs").hasField("message"), "full-text fields are scanned for match terms");
    }

    @Test
    public void testNoIndexConditionWithoutNativeIndex() {
        config.getIndex().setSearchFormat(SearchEngineConfig.SearchFormat.NONE);

        ParsedQuery parsed = analyze("SELECT * FROM logs WHERE message LIKE 'err%'");

        assertFalse(parsed.isUseInvertedIndex());
        assertFalse(parsed.getIndexCondition().isPresent());
        assertTrue(parsed.getSql().toUpperCase().contains("LIKE"));
    }

    @Test
    public void testTotalHitsRewrite() {
        SearchRequest request = new SearchRequest("SELECT service FROM logs ORDER BY _timestamp DESC", START, END);
        request.setTrackTotalHits(true);

        ParsedQuery parsed = analyzer.analyze("default", StreamType.LOGS, request);

        assertTrue(parsed.isTrackTotalHits());
        assertTrue(parsed.getSql().contains("total_hits"));
        assertTrue(parsed.getSql().toUpperCase().contains("COUNT(*)"));
        assertTrue(parsed.getOrderBy().isEmpty());
        assertFalse(parsed.getResultTimestampColumn().isPresent());
    }

    @Test
    public void testLimitResolution() {
        assertEquals(50, analyze("SELECT service FROM logs LIMIT 50").getLimit());
        assertEquals(1000, analyze("SELECT service FROM logs").getLimit());

        SearchRequest request = new SearchRequest("SELECT service FROM logs LIMIT 50", START, END);
        request.setSize(20);
        assertEquals(20, analyzer.analyze("default", StreamType.LOGS, request).getLimit());
    }

    @Test
    public void testUnknownStream() {
        assertThrows(StreamNotFoundException.class, () -> analyze("SELECT * FROM missing"));
    }

    @Test
    public void testInvalidSql() {
        assertThrows(InvalidQueryException.class, () -> analyze("SELEC service FROM logs"));
        assertThrows(InvalidQueryException.class, () -> analyze("DELETE FROM logs"));
    }
}
