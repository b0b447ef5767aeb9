package chatcollector.collector;

/**
 * Well-known terminal reasons. Callers may stop a collector with any other string.
 */
public final class EndReasons {

  /** The accepted-item limit ({@code max}) was reached. */
  public static final String LIMIT = "limit";

  /** The processed-item limit ({@code maxProcessed}) was reached. */
  public static final String PROCESSED_LIMIT = "processedLimit";

  /** The absolute {@code time} window elapsed. */
  public static final String TIME = "time";

  /** No item was accepted within the {@code idle} window. */
  public static final String IDLE = "idle";

  /** The channel being collected from was deleted. */
  public static final String CHANNEL_DELETE = "channelDelete";

  /** The guild owning the channel was deleted. */
  public static final String GUILD_DELETE = "guildDelete";

  /** Stopped by the caller without a specific reason. */
  public static final String USER = "user";

  /** The caller cancelled the completion future. */
  public static final String CANCELLED = "cancelled";

  private EndReasons() {
  }
}
