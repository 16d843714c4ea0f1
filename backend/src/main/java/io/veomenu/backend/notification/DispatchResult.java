package io.veomenu.backend.notification;

import java.util.List;

/** Per-channel outcome of one dispatch. */
public record DispatchResult(List<ChannelResult> channels) {

  public DispatchResult {
    channels = List.copyOf(channels);
  }

  public boolean allSucceeded() {
    return channels.stream().allMatch(ChannelResult::success);
  }

  public boolean anySucceeded() {
    return channels.stream().anyMatch(ChannelResult::success);
  }

  public List<String> failedChannels() {
    return channels.stream().filter(c -> !c.success()).map(ChannelResult::channelId).toList();
  }

  /**
   * @param channelId channel the message was routed to
   * @param success whether the transport accepted the message
   * @param error failure description, null on success
   */
  public record ChannelResult(String channelId, boolean success, String error) {

    public static ChannelResult ok(String channelId) {
      return new ChannelResult(channelId, true, null);
    }

    public static ChannelResult failed(String channelId, String error) {
      return new ChannelResult(channelId, false, error);
    }
  }
}
