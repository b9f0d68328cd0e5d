package com.swarmcore.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process backend that echoes payloads back. Used for dry runs and local plans
 * when no real backend is configured.
 */
public class LoopbackConnectionFactory implements ConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(LoopbackConnectionFactory.class);

    @Override
    public BackendConnection open(String connectionId) {
        log.debug("Opening loopback connection {}", connectionId);
        return new LoopbackConnection(connectionId);
    }

    static final class LoopbackConnection implements BackendConnection {

        private final String id;
        private volatile boolean open = true;

        LoopbackConnection(String id) {
            this.id = id;
        }

        @Override
        public String invoke(String endpoint, String payload) {
            if (!open) {
                throw new BackendException(endpoint, "Connection " + id + " is closed");
            }
            return payload == null ? "" : payload;
        }

        @Override
        public boolean isHealthy() {
            return open;
        }

        @Override
        public void close() {
            open = false;
        }
    }
}
