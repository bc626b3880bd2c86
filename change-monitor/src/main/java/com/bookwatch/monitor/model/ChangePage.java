package com.bookwatch.monitor.model;

import java.util.List;

public record ChangePage(List<Change> changes, int page, int size, long total) {

    public boolean hasNext() {
        return (long) (page + 1) * size < total;
    }
}
