/**
 * The gateway event bus: typed {@link chatcollector.event.GatewayEvent event keys},
 * {@link chatcollector.event.EventHandler handlers} and the
 * {@link chatcollector.event.EventSource} they are registered on.
 *
 * <p>The source is injected wherever it is needed rather than held in a global, so
 * tests can supply their own instance and assert on its listener counts.
 *
 * @see chatcollector.event.DefaultEventSource
 */
package chatcollector.event;
