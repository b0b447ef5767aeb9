/**
 * Domain objects carried by gateway events: {@link chatcollector.model.Guild guilds},
 * {@link chatcollector.model.Channel channels} and {@link chatcollector.model.Message messages}.
 *
 * <p>Identities are snowflake strings and are compared by value.
 */
package chatcollector.model;
