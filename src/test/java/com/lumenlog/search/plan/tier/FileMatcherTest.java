package com.lumenlog.search.plan.tier;

import com.lumenlog.search.schema.StreamPartition;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.FieldValue;
import com.lumenlog.search.sql.TimeRange;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.lumenlog.search.support.FakeFileCatalog.file;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for file pruning by time span and partition hints
 */
public class FileMatcherTest {

    private static StitchContext context(List<StreamPartition> partitions,
                                         Map<String, List<FieldValue>> equalItems,
                                         Map<String, List<FieldValue>> prefixItems) {
        return new StitchContext("t", "default", StreamType.LOGS, "app", new TimeRange(100, 200),
            partitions, equalItems, prefixItems, Collections.<String>emptyList(), null, null, null);
    }

    @Test
    public void testTimeOverlap() {
        StitchContext ctx = context(Collections.<StreamPartition>emptyList(), null, null);

        assertTrue(FileMatcher.matches(file(1, "files/a.parquet", 150, 250), ctx));
        assertTrue(FileMatcher.matches(file(2, "files/b.parquet", 50, 100), ctx));
        assertFalse(FileMatcher.matches(file(3, "files/c.parquet", 200, 300), ctx));
        assertFalse(FileMatcher.matches(file(4, "files/d.parquet", 10, 99), ctx));
    }

    @Test
    public void testValuePartitionEquality() {
        StitchContext ctx = context(Collections.singletonList(StreamPartition.value("service")),
            Collections.singletonMap("service", Arrays.asList(new FieldValue("service", "api"), new FieldValue("service", "web"))),
            null);

        assertTrue(FileMatcher.matches(file(1, "files/service=api/a.parquet", 100, 150), ctx));
        assertTrue(FileMatcher.matches(file(2, "files/service=web/a.parquet", 100, 150), ctx));
        assertFalse(FileMatcher.matches(file(3, "files/service=db/a.parquet", 100, 150), ctx));
        assertTrue(FileMatcher.matches(file(4, "files/a.parquet", 100, 150), ctx), "unpartitioned files are kept");
    }

    @Test
    public void testHashPartitionEquality() {
        StreamPartition partition = StreamPartition.hash("trace_id", 32);
        StitchContext ctx = context(Collections.singletonList(partition),
            Collections.singletonMap("trace_id", Collections.singletonList(new FieldValue("trace_id", "abc"))),
            null);
        String bucket = partition.partitionValue("abc");
        String other = String.valueOf((Integer.parseInt(bucket) + 1) % 32);

        assertTrue(FileMatcher.matches(file(1, "files/trace_id=" + bucket + "/a.parquet", 100, 150), ctx));
        assertFalse(FileMatcher.matches(file(2, "files/trace_id=" + other + "/a.parquet", 100, 150), ctx));
    }

    @Test
    public void testPrefixHints() {
        StitchContext valueCtx = context(Collections.singletonList(StreamPartition.value("host")), null,
            Collections.singletonMap("host", Collections.singletonList(new FieldValue("host", "web"))));
        assertTrue(FileMatcher.matches(file(1, "files/host=web-01/a.parquet", 100, 150), valueCtx));
        assertFalse(FileMatcher.matches(file(2, "files/host=db-01/a.parquet", 100, 150), valueCtx));

        StitchContext prefixCtx = context(Collections.singletonList(StreamPartition.prefix("host")), null,
            Collections.singletonMap("host", Collections.singletonList(new FieldValue("host", "Web"))));
        assertTrue(FileMatcher.matches(file(3, "files/host=w/a.parquet", 100, 150), prefixCtx));
        assertFalse(FileMatcher.matches(file(4, "files/host=d/a.parquet", 100, 150), prefixCtx));

        StitchContext hashCtx = context(Collections.singletonList(StreamPartition.hash("host", 16)), null,
            Collections.singletonMap("host", Collections.singletonList(new FieldValue("host", "web"))));
        assertTrue(FileMatcher.matches(file(5, "files/host=3/a.parquet", 100, 150), hashCtx),
            "hash buckets cannot be pruned by prefix");
    }

    @Test
    public void testPartitionValuesFromKey() {
        FileMeta meta = file(1, "files/default/logs/app/2024/01/01/00/service=api/host=w1/7.parquet", 0, 1);

        assertEquals("api", meta.partitionValues().get("service"));
        assertEquals("w1", meta.partitionValues().get("host"));
        assertEquals(2, meta.partitionValues().size());
    }
}
