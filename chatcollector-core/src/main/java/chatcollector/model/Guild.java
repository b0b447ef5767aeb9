package chatcollector.model;

import java.util.Objects;

/**
 * A guild (server): the parent container of guild channels.
 *
 * @param id   the guild's snowflake identity
 * @param name the display name, may be null when the gateway omitted it
 */
public record Guild(String id, String name) {
  public Guild {
    Objects.requireNonNull(id, "id");
  }

  public static Guild of(String id) {
    return new Guild(id, null);
  }
}
