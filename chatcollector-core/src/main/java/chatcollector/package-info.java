/**
 * Root API of the chat collector library: bounded, event-driven collection of chat
 * messages on top of a gateway event stream.
 *
 * <h2>Core Design</h2>
 * <p>The gateway emits parsed domain events (message created, deleted, bulk-deleted,
 * channel and guild deleted) on an {@linkplain chatcollector.event.EventSource event
 * source}. A {@linkplain chatcollector.message.MessageCollector message collector}
 * subscribes to the events it needs, feeds them through the generic
 * {@linkplain chatcollector.collector.Collector collection engine}, and unsubscribes
 * everything once any end condition holds: item limit, processed limit, time window,
 * idle window, channel or guild deletion, or an explicit stop. The result is exposed
 * as a {@link java.util.concurrent.CompletableFuture} that completes exactly once.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>chatcollector-core</b>: model, event source, engine, message collector (zero external deps)</li>
 *   <li><b>chatcollector-micrometer</b>: optional Micrometer bridge for
 *       {@link chatcollector.spi.CollectorMetrics}</li>
 *   <li><b>chatcollector-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (GatewayClient client = GatewayClient.builder().build()) {
 *   MessageCollector collector = client.createMessageCollector(channel,
 *       CollectorOptions.<Message>builder()
 *           .filter(message -> message.content().startsWith("!vote"))
 *           .max(5)
 *           .idle(Duration.ofSeconds(30))
 *           .build());
 *
 *   client.events().emit(GatewayEvent.MESSAGE_CREATE, message);
 *
 *   CollectionResult<String, Message> result = collector.completion().join();
 * }
 * }</pre>
 *
 * @see chatcollector.GatewayClient
 * @see chatcollector.collector.Collector
 * @see chatcollector.message.MessageCollector
 */
package chatcollector;
