package io.waypoint.standalone.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.waypoint.core.cache.CacheStats;
import io.waypoint.core.error.NavigationException;
import io.waypoint.core.matcher.Hotspot;
import io.waypoint.core.model.NavigationFailure;
import io.waypoint.core.model.NavigationResult;
import io.waypoint.core.model.ResolvedLocation;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/** Writes one JSON object per line for each navigation outcome. */
final class ResultWriter {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final PrintStream out;

    ResultWriter(PrintStream out) {
        this.out = out;
    }

    void result(String step, NavigationResult result) {
        ObjectNode line = JSON.createObjectNode();
        line.put("step", step);
        if (result.isSuccess()) {
            line.put("outcome", "SUCCESS");
            line.set("location", location(result.location()));
            if (result.redirectedFrom() != null) {
                line.put("redirectedFrom", result.redirectedFrom().fullPath());
            }
        } else {
            NavigationFailure failure = result.failure();
            line.put("outcome", failure.kind().name());
            line.put("from", failure.from().fullPath());
            line.put("to", failure.to().fullPath());
        }
        write(line);
    }

    void error(String step, Throwable error) {
        ObjectNode line = JSON.createObjectNode();
        line.put("step", step);
        line.put("outcome", "ERROR");
        line.put("error", error.getClass().getSimpleName());
        line.put("message", error.getMessage());
        if (error instanceof NavigationException navigation) {
            line.put("generation", navigation.generation());
        }
        write(line);
    }

    void stats(CacheStats stats, List<Hotspot> hotspots) {
        ObjectNode line = JSON.createObjectNode();
        ObjectNode cache = line.putObject("cache");
        cache.put("size", stats.size());
        cache.put("capacity", stats.capacity());
        cache.put("hits", stats.hits());
        cache.put("misses", stats.misses());
        cache.put("evictions", stats.evictions());
        cache.put("resizes", stats.resizes());
        cache.put("hitRate", stats.hitRate());
        ArrayNode top = line.putArray("hotspots");
        for (Hotspot h : hotspots) {
            top.addObject().put("path", h.path()).put("count", h.count());
        }
        write(line);
    }

    private static ObjectNode location(ResolvedLocation location) {
        ObjectNode node = JSON.createObjectNode();
        node.put("path", location.path());
        node.put("fullPath", location.fullPath());
        node.put("name", location.name());
        node.set("params", JSON.valueToTree(location.params()));
        node.set("query", JSON.valueToTree(location.query().asMap()));
        node.put("hash", location.hash());
        node.set("meta", JSON.valueToTree(location.meta()));
        return node;
    }

    private void write(ObjectNode line) {
        try {
            out.println(JSON.writeValueAsString(line));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize navigation result", e);
        }
    }
}
