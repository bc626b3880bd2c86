package com.bookwatch.monitor.service;

import com.bookwatch.monitor.model.Change;
import com.bookwatch.monitor.model.Fingerprint;

import java.util.List;

/**
 * Outcome of comparing one observed item with its stored fingerprint.
 *
 * @param fingerprint freshly computed fingerprint, to be stored once the changes are durable
 * @param needsUpsert false when the stored row is already current
 */
public record ItemDetection(String itemId, List<Change> changes, Fingerprint fingerprint, boolean needsUpsert) {}
