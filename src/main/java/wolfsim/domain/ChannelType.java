package wolfsim.domain;

public enum ChannelType {
  DIRECT,
  GROUP
}
