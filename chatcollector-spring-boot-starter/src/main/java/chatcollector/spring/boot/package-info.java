/**
 * Spring Boot auto-configuration for the chat collector client.
 *
 * <p>Add {@code chatcollector-spring-boot-starter} to the classpath and a
 * {@link chatcollector.GatewayClient} bean is created with defaults taken from
 * {@code chatcollector.*} properties.
 */
package chatcollector.spring.boot;
