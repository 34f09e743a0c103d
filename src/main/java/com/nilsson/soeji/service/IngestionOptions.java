package com.nilsson.soeji.service;

/**
 Switches of the ingestion pipeline that differ between interactive uploads and batch tools.
 */
public final class IngestionOptions {

    private final boolean losslessEnabled;
    private final boolean losslessFailureFatal;

    public IngestionOptions(boolean losslessEnabled, boolean losslessFailureFatal) {
        this.losslessEnabled = losslessEnabled;
        this.losslessFailureFatal = losslessFailureFatal;
    }

    public boolean isLosslessEnabled() {
        return losslessEnabled;
    }

    /**
     When false, a derivative that cannot be produced is logged and left for the reindex tool
     instead of failing the ingestion.
     */
    public boolean isLosslessFailureFatal() {
        return losslessFailureFatal;
    }

    public IngestionOptions withLosslessFailureFatal(boolean fatal) {
        return new IngestionOptions(losslessEnabled, fatal);
    }

    @Override
    public String toString() {
        return "IngestionOptions{lossless=" + losslessEnabled + ", failureFatal=" + losslessFailureFatal + "}";
    }
}
