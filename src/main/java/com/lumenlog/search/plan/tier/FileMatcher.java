package com.lumenlog.search.plan.tier;

import com.lumenlog.search.schema.PartitionType;
import com.lumenlog.search.schema.StreamPartition;
import com.lumenlog.search.sql.FieldValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prunes files by time span and partition hints.
 *
 * A file is only dropped when its own partition value proves that no hinted value can be in it;
 * files without a value for a partition field are always kept.
 */
public final class FileMatcher {

    private FileMatcher() {
    }

    public static boolean matches(FileMeta file, StitchContext ctx) {
        if (ctx.getTimeRange() != null && !ctx.getTimeRange().overlaps(file.getMinTs(), file.getMaxTs())) {
            return false;
        }
        if (ctx.getPartitionKeys().isEmpty()) {
            return true;
        }
        Map<String, String> values = file.partitionValues();
        for (StreamPartition partition : ctx.getPartitionKeys()) {
            String fileValue = values.get(partition.getField());
            if (fileValue == null) {
                continue;
            }
            List<FieldValue> equals = ctx.getEqualItems().get(partition.getField());
            if (equals != null && !equals.isEmpty() && !anyEqual(partition, equals, fileValue)) {
                return false;
            }
            List<FieldValue> prefixes = ctx.getPrefixItems().get(partition.getField());
            if (prefixes != null && !prefixes.isEmpty() && !anyPrefix(partition, prefixes, fileValue)) {
                return false;
            }
        }
        return true;
    }

    private static boolean anyEqual(StreamPartition partition, List<FieldValue> items, String fileValue) {
        for (FieldValue item : items) {
            if (partition.partitionValue(item.getValue()).equals(fileValue)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyPrefix(StreamPartition partition, List<FieldValue> items, String fileValue) {
        if (partition.getType() == PartitionType.HASH) {
            // a hash bucket says nothing about prefixes
            return true;
        }
        for (FieldValue item : items) {
            String prefix = item.getValue();
            if (prefix.isEmpty()) {
                return true;
            }
            if (partition.getType() == PartitionType.PREFIX) {
                if (prefix.substring(0, 1).toLowerCase(Locale.ROOT).equals(fileValue)) {
                    return true;
                }
            } else if (fileValue.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
