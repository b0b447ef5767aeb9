package chatcollector.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the chat collector client.
 *
 * @see ChatCollectorAutoConfiguration
 */
@ConfigurationProperties(prefix = "chatcollector")
public class ChatCollectorProperties {

    private final Collector collector = new Collector();
    private final Metrics metrics = new Metrics();

    public Collector getCollector() {
        return collector;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Default options for collectors created without explicit options.
     * Unset durations and zero limits leave the corresponding bound disabled.
     */
    public static class Collector {
        /**
         * Overall lifetime of a collector.
         */
        private Duration time;

        /**
         * Maximum inactivity between accepted messages.
         */
        private Duration idle;

        /**
         * Accepted-message limit, 0 for none.
         */
        private int max;

        /**
         * Received-message limit, 0 for none.
         */
        private int maxProcessed;

        /**
         * Whether delete events remove collected messages.
         */
        private boolean dispose = true;

        public Duration getTime() {
            return time;
        }

        public void setTime(Duration time) {
            this.time = time;
        }

        public Duration getIdle() {
            return idle;
        }

        public void setIdle(Duration idle) {
            this.idle = idle;
        }

        public int getMax() {
            return max;
        }

        public void setMax(int max) {
            this.max = max;
        }

        public int getMaxProcessed() {
            return maxProcessed;
        }

        public void setMaxProcessed(int maxProcessed) {
            this.maxProcessed = maxProcessed;
        }

        public boolean isDispose() {
            return dispose;
        }

        public void setDispose(boolean dispose) {
            this.dispose = dispose;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "chatcollector";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
