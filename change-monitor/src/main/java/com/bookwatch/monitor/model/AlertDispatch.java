package com.bookwatch.monitor.model;

/**
 * What a channel is asked to deliver for one change.
 */
public record AlertDispatch(String channel, Severity severity, String summary, Change change) {}
