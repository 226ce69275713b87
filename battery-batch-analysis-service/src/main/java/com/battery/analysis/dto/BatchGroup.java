package com.battery.analysis.dto;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Channels tested from the same sample batch. Channel order is preserved and is the order used
 * for tie-breaking and for time-series treatment of metric vectors.
 *
 * @param batchKey batch identity derived by the ingestion collaborator
 * @param channels channel series with unique channel ids
 */
public record BatchGroup(String batchKey, List<ChannelSeries> channels) {

  public BatchGroup {
    if (batchKey == null || batchKey.isBlank()) {
      throw new IllegalArgumentException("Batch key cannot be null or blank");
    }
    if (channels == null) {
      throw new IllegalArgumentException("Channels cannot be null for batch " + batchKey);
    }
    channels = List.copyOf(channels);
    Set<String> seen = new HashSet<>();
    for (ChannelSeries channel : channels) {
      if (!seen.add(channel.channelId())) {
        throw new IllegalArgumentException(
            "Duplicate channel " + channel.channelId() + " in batch " + batchKey);
      }
    }
  }

  public static BatchGroup of(String batchKey, ChannelSeries... channels) {
    return new BatchGroup(batchKey, Arrays.asList(channels));
  }

  public int size() {
    return channels.size();
  }

  /** Returns a batch with the same key holding only the given channels. */
  public BatchGroup withChannels(List<ChannelSeries> retained) {
    return new BatchGroup(batchKey, retained);
  }
}
