package io.waypoint.core.trie;

import io.waypoint.core.model.RouteRecord;
import java.util.List;

/**
 * Raw trie hit.
 *
 * @param record   terminal record reached
 * @param captures raw capture values parallel to the record pattern's param names; {@code null} marks an
 *                 absent optional param
 * @param score    specificity of the walk
 */
public record TrieMatch(RouteRecord record, List<String> captures, int score) {}
