package org.pathfinder.app;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a graph file. Node {@code id}, {@code lat}, {@code lon} and edge {@code source},
 * {@code target} are mandatory; {@link JsonGraphLoader} rejects entries missing any of them.
 *
 * <pre>
 * {"nodes": [{"id": 1, "lat": 21.02, "lon": 105.85}],
 *  "edges": [{"source": 1, "target": 2, "length": 120.5, "oneway": false}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphDocument {
    @JsonProperty("nodes")
    List<NodeEntry> nodes = new ArrayList<>();

    @JsonProperty("edges")
    List<EdgeEntry> edges = new ArrayList<>();

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NodeEntry {
        // Boxed so that absent or null values can be told apart from 0.
        @JsonProperty("id")
        Long id;
        @JsonProperty("lat")
        Double lat;
        @JsonProperty("lon")
        Double lon;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EdgeEntry {
        @JsonProperty("source")
        Long source;
        @JsonProperty("target")
        Long target;
        /** Meters; when absent the great-circle length between the endpoints is used. */
        @JsonProperty("length")
        Double length;
        @JsonProperty("oneway")
        boolean oneway;
    }
}
