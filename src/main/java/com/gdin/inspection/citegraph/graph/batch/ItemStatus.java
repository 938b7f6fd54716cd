package com.gdin.inspection.citegraph.graph.batch;

public enum ItemStatus {
    SUCCEEDED, FAILED, CANCELLED
}
