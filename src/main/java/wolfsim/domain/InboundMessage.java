package wolfsim.domain;

/**
 * A message delivered by the host runtime. The arrival time is implicit; the store
 * stamps claims when they are recorded.
 */
public record InboundMessage(String sender, String channel, ChannelType channelType, String text) {
  public InboundMessage {
    sender = sender == null ? "" : sender;
    channel = channel == null ? "" : channel;
    channelType = channelType == null ? ChannelType.GROUP : channelType;
    text = text == null ? "" : text;
  }

  public boolean isDirect() { return channelType == ChannelType.DIRECT; }

  public static InboundMessage direct(String sender, String text) {
    return new InboundMessage(sender, "direct", ChannelType.DIRECT, text);
  }

  public static InboundMessage group(String sender, String channel, String text) {
    return new InboundMessage(sender, channel, ChannelType.GROUP, text);
  }
}
