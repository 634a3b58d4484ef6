package com.lumenlog.search.plan.tier;

/**
 * Volume a partition scan will read, summed over all tiers. Counters only grow.
 */
public class ScanStats {
    private long files;
    private long records;
    private long originalSize;
    private long compressedSize;
    private long indexSize;

    public void add(FileMeta file) {
        files++;
        records += file.getRecords();
        originalSize += file.getOriginalSize();
        compressedSize += file.getCompressedSize();
        indexSize += file.getIndexSize();
    }

    public void add(ScanStats other) {
        files += other.files;
        records += other.records;
        originalSize += other.originalSize;
        compressedSize += other.compressedSize;
        indexSize += other.indexSize;
    }

    public long getFiles() {
        return files;
    }

    public long getRecords() {
        return records;
    }

    public long getOriginalSize() {
        return originalSize;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public long getIndexSize() {
        return indexSize;
    }

    @Override
    public String toString() {
        return "files: " + files + ", records: " + records + ", original_size: " + originalSize
            + ", compressed_size: " + compressedSize;
    }
}
