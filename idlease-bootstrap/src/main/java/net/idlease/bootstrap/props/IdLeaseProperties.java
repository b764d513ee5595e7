package net.idlease.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("idlease")
public class IdLeaseProperties {
    private Pool pool = new Pool();

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public static class Pool {
        private int min = 1;
        private int max = 65535;
        private Duration timeout = Duration.ofMillis(3000); // 단위 없는 숫자는 ms

        public int getMin() {
            return min;
        }

        public void setMin(int min) {
            this.min = min;
        }

        public int getMax() {
            return max;
        }

        public void setMax(int max) {
            this.max = max;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        @Override
        public String toString() {
            return "Pool{" +
                    "min=" + min +
                    ", max=" + max +
                    ", timeout=" + timeout +
                    '}';
        }
    }
}
