package com.battery.analysis.dto;

import com.battery.analysis.algorithm.selection.ReferenceMethod;

/**
 * The channel chosen to represent a batch.
 *
 * @param channelId selected channel
 * @param method strategy that produced the selection
 * @param score value that decided the selection (lower is more representative)
 * @param rationale human-readable explanation for reporting
 */
public record ReferenceSelection(
    String channelId, ReferenceMethod method, double score, String rationale) {}
