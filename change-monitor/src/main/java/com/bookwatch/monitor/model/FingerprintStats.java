package com.bookwatch.monitor.model;

import java.time.Instant;

public record FingerprintStats(long total, long active, long removed, Instant oldestUpdate, Instant newestUpdate) {}
