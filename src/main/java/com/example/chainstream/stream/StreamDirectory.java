package com.example.chainstream.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the logical stream names subscribers ask for to durable log subjects.
 *
 * Unknown names resolve to {@link #DEFAULT_SUBJECT} unless the directory was built to reject them.
 */
public class StreamDirectory {

    private static final Logger log = LoggerFactory.getLogger(StreamDirectory.class);

    public static final String DEFAULT_STREAM = "blocks";
    public static final String DEFAULT_SUBJECT = Subjects.BLOCKS_FULL;

    private final Map<String, Route> routes = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final boolean rejectUnknown;

    public StreamDirectory(boolean rejectUnknown) {
        this.rejectUnknown = rejectUnknown;
        routes.put("blocks", new Route(Subjects.BLOCKS_FULL, "Full block data with transactions"));
        routes.put("pending", new Route(Subjects.PENDING, "Pending transactions"));
        routes.put("logs", new Route(Subjects.LOGS, "Recent event logs"));
        routes.put("network", new Route(Subjects.NETWORK, "Network statistics"));
        routes.put("gasPrice", new Route(Subjects.GAS_PRICE, "Current gas price"));
        routes.put("blocks-simple", new Route(Subjects.BLOCKS_SIMPLE, "Simple block data"));
        aliases.put("gas", "gasPrice");
    }

    /**
     * Resolve a logical stream name to its subject.
     *
     * @throws UnknownStreamException if the name is unknown and unknown names are rejected
     */
    public String resolve(String streamName) {
        Route route = routes.get(aliases.getOrDefault(streamName, streamName));
        if (route != null) {
            return route.subject;
        }
        if (rejectUnknown) {
            throw new UnknownStreamException(streamName);
        }
        log.warn("Unknown stream '{}', falling back to {}", streamName, DEFAULT_SUBJECT);
        return DEFAULT_SUBJECT;
    }

    /**
     * Listed stream names with a human-readable description, in listing order. Aliases are not listed.
     */
    public Map<String, String> describe() {
        Map<String, String> streams = new LinkedHashMap<>();
        routes.forEach((name, route) -> streams.put(name, route.subject + " - " + route.description));
        return Collections.unmodifiableMap(streams);
    }

    public boolean isRejectUnknown() {
        return rejectUnknown;
    }

    private static final class Route {
        private final String subject;
        private final String description;

        private Route(String subject, String description) {
            this.subject = subject;
            this.description = description;
        }
    }
}
