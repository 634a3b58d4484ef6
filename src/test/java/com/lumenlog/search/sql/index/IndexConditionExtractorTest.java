package com.lumenlog.search.sql.index;

import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for converting SQL predicates into index conditions
 */
public class IndexConditionExtractorTest {

    private final IndexConditionExtractor extractor = new IndexConditionExtractor(
        new HashSet<>(Arrays.asList("trace_id", "service")),
        new HashSet<>(Arrays.asList("message")));

    private static SqlNode where(String predicate) {
        return SqlSupport.parseSelect("SELECT * FROM logs WHERE " + predicate).getWhere();
    }

    @Test
    public void testIndexFieldEqualityIsExact() {
        IndexNode node = extractor.exact(where("trace_id = 'abc'"));
        assertNotNull(node);
        assertEquals("trace_id:abc", node.toQueryString());

        assertEquals("trace_id:abc", extractor.exact(where("'abc' = trace_id")).toQueryString());
    }

    @Test
    public void testInBecomesOrGroup() {
        assertEquals("(service:api OR service:web)",
            extractor.exact(where("service IN ('api', 'web')")).toQueryString());
        assertEquals("service:api", extractor.exact(where("service IN ('api')")).toQueryString());
    }

    @Test
    public void testPrefixLike() {
        assertEquals("service:ap*", extractor.exact(where("service LIKE 'ap%'")).toQueryString());
        assertNull(extractor.exact(where("service LIKE '%ap'")));
        assertNull(extractor.exact(where("service LIKE 'a_p%'")));
    }

    @Test
    public void testCompoundPredicates() {
        assertEquals("(service:api OR trace_id:abc)",
            extractor.exact(where("service = 'api' OR trace_id = 'abc'")).toQueryString());
        assertNull(extractor.exact(where("service = 'api' OR level = 'error'")),
            "an OR with a non-indexed arm cannot be evaluated by the index");
    }

    @Test
    public void testMatchAllIsExact() {
        assertEquals("timeout*", extractor.exact(where("match_all('timeout')")).toQueryString());
        assertEquals("timeout*", extractor.exact(where("match_all_raw_ignore_case('timeout')")).toQueryString());
    }

    @Test
    public void testFullTextFieldOnlyRelaxes() {
        assertNull(extractor.exact(where("message = 'disk full'")));
        assertEquals("message:disk full", extractor.relax(where("message = 'disk full'")).toQueryString());
    }

    @Test
    public void testRelaxKeepsIndexableAndArms() {
        SqlNode predicate = where("service = 'api' OR (message LIKE 'err%' AND level > 3)");
        IndexNode relaxed = extractor.relax(predicate);
        assertNotNull(relaxed);
        assertEquals("(service:api OR message:err*)", relaxed.toQueryString());

        assertNull(extractor.relax(where("service = 'api' OR level = 'error'")));
    }

    @Test
    public void testNonIndexedFieldIsIgnored() {
        assertNull(extractor.exact(where("level = 'error'")));
        assertNull(extractor.relax(where("level = 'error'")));
        assertNull(extractor.exact(where("service <> 'api'")));
    }

    @Test
    public void testConditionString() {
        IndexCondition condition = new IndexCondition();
        condition.addExact(IndexNode.term("service", "api"));
        condition.addPreFilter(IndexNode.prefix("message", "err"));

        assertEquals("service:api AND message:err*", condition.toQueryString());
        assertTrue(condition.hasPreFilters());
        assertEquals(new HashSet<>(Arrays.asList("service", "message")), condition.fields());
    }
}
