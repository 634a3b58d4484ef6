package com.lumenlog.search.dto;

/**
 * Timing breakdown of a search, in milliseconds
 */
public class TookDetail {
    private long total;
    private long cacheTook;
    private long fileListTook;
    private long waitInQueue;
    private long idxTook;
    private long clusterTotal;
    private long clusterWaitInQueue;

    public TookDetail() {
    }

    /**
     * Field-wise sum. Cluster totals from concurrently executed deltas are summed as well,
     * which overstates wall-clock time; consumers rely on the summed values.
     */
    public void add(TookDetail other) {
        if (other == null) {
            return;
        }
        total += other.total;
        cacheTook += other.cacheTook;
        fileListTook += other.fileListTook;
        waitInQueue += other.waitInQueue;
        idxTook += other.idxTook;
        clusterTotal += other.clusterTotal;
        clusterWaitInQueue += other.clusterWaitInQueue;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public long getCacheTook() {
        return cacheTook;
    }

    public void setCacheTook(long cacheTook) {
        this.cacheTook = cacheTook;
    }

    public long getFileListTook() {
        return fileListTook;
    }

    public void setFileListTook(long fileListTook) {
        this.fileListTook = fileListTook;
    }

    public long getWaitInQueue() {
        return waitInQueue;
    }

    public void setWaitInQueue(long waitInQueue) {
        this.waitInQueue = waitInQueue;
    }

    public long getIdxTook() {
        return idxTook;
    }

    public void setIdxTook(long idxTook) {
        this.idxTook = idxTook;
    }

    public long getClusterTotal() {
        return clusterTotal;
    }

    public void setClusterTotal(long clusterTotal) {
        this.clusterTotal = clusterTotal;
    }

    public long getClusterWaitInQueue() {
        return clusterWaitInQueue;
    }

    public void setClusterWaitInQueue(long clusterWaitInQueue) {
        this.clusterWaitInQueue = clusterWaitInQueue;
    }
}
