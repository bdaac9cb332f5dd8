package org.lite.telemetry.model;

import lombok.Value;

@Value
public class Pagination {
    int total;
    int limit;
    int offset;

    public boolean isHasMore() {
        return offset + limit < total;
    }
}
