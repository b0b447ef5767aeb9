/**
 * Channel-scoped message collection built on the generic
 * {@linkplain chatcollector.collector collection engine}.
 */
package chatcollector.message;
