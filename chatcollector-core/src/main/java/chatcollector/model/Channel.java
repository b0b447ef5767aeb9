package chatcollector.model;

import java.util.Objects;

/**
 * A text-based channel messages are posted into.
 *
 * <p>{@code guildId} is {@code null} for direct-message channels, which have no
 * parent guild and therefore can never be affected by a guild deletion.
 *
 * @param id      the channel's snowflake identity
 * @param guildId the parent guild's identity, or null for a DM channel
 */
public record Channel(String id, String guildId) {
  public Channel {
    Objects.requireNonNull(id, "id");
  }

  /**
   * Creates a channel that belongs to the given guild.
   *
   * @param id      channel id
   * @param guildId parent guild id
   * @return the channel
   */
  public static Channel inGuild(String id, String guildId) {
    return new Channel(id, Objects.requireNonNull(guildId, "guildId"));
  }

  /**
   * Creates a direct-message channel without a parent guild.
   *
   * @param id channel id
   * @return the channel
   */
  public static Channel direct(String id) {
    return new Channel(id, null);
  }

  public boolean isInGuild() {
    return guildId != null;
  }

  /**
   * Whether this channel belongs to the given guild.
   *
   * @param guild the guild to compare against
   * @return true only if this channel has a parent guild with the same id
   */
  public boolean belongsTo(Guild guild) {
    return guildId != null && guild != null && guildId.equals(guild.id());
  }
}
