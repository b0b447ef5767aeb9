package chatcollector.model;

import java.util.Objects;

/**
 * A chat message as delivered by the gateway.
 *
 * @param id       the message's snowflake identity
 * @param channel  the channel the message was posted in
 * @param authorId the author's identity, may be null for system messages
 * @param content  the text content, may be empty
 */
public record Message(String id, Channel channel, String authorId, String content) {
  public Message {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(channel, "channel");
    if (content == null) {
      content = "";
    }
  }

  public String channelId() {
    return channel.id();
  }
}
