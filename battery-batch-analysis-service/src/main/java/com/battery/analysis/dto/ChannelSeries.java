package com.battery.analysis.dto;

import java.util.List;
import java.util.Optional;

/**
 * Ordered cycle records of one test channel.
 *
 * @param channelId identifier of the channel, unique within its batch
 * @param testMode channel-level test mode label (for example {@code -0.1C-}), may be null
 * @param cycles records ordered by strictly increasing cycle index
 */
public record ChannelSeries(String channelId, String testMode, List<CycleRecord> cycles) {

  public ChannelSeries {
    if (channelId == null || channelId.isBlank()) {
      throw new IllegalArgumentException("Channel id cannot be null or blank");
    }
    if (cycles == null) {
      throw new IllegalArgumentException("Cycles cannot be null for channel " + channelId);
    }
    cycles = List.copyOf(cycles);
    for (int i = 1; i < cycles.size(); i++) {
      if (cycles.get(i).cycleIndex() <= cycles.get(i - 1).cycleIndex()) {
        throw new IllegalArgumentException(
            String.format(
                "Cycle indices of channel %s must be strictly increasing: %d follows %d",
                channelId, cycles.get(i).cycleIndex(), cycles.get(i - 1).cycleIndex()));
      }
    }
  }

  public static ChannelSeries of(String channelId, List<CycleRecord> cycles) {
    return new ChannelSeries(channelId, null, cycles);
  }

  public int cycleCount() {
    return cycles.size();
  }

  public Optional<CycleRecord> first() {
    return cycles.isEmpty() ? Optional.empty() : Optional.of(cycles.get(0));
  }

  public Optional<CycleRecord> last() {
    return cycles.isEmpty() ? Optional.empty() : Optional.of(cycles.get(cycles.size() - 1));
  }

  /** Looks up the record with the given cycle index. */
  public Optional<CycleRecord> cycle(int cycleIndex) {
    for (CycleRecord record : cycles) {
      if (record.cycleIndex() == cycleIndex) {
        return Optional.of(record);
      }
      if (record.cycleIndex() > cycleIndex) {
        break;
      }
    }
    return Optional.empty();
  }
}
