package io.waypoint.core.matcher;

/**
 * A frequently matched path.
 *
 * @param path  normalized path
 * @param count number of lookups
 */
public record Hotspot(String path, long count) {}
