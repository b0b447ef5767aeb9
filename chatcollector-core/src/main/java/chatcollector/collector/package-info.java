/**
 * The generic collection engine.
 *
 * <p>A {@link chatcollector.collector.Collector} does the bookkeeping (counters,
 * accepted items, timers, notifications, single completion); a
 * {@link chatcollector.collector.CollectorPolicy} supplies the domain rules. There is
 * one engine type: specializations compose it rather than extend it.
 *
 * @see chatcollector.collector.Collector
 * @see chatcollector.collector.CollectorOptions
 * @see chatcollector.collector.EndReasons
 */
package chatcollector.collector;
