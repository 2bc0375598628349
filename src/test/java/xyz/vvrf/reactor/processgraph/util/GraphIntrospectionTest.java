package xyz.vvrf.reactor.processgraph.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.processgraph.core.ProcessGraph;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.PARSER;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.json;
import static xyz.vvrf.reactor.processgraph.test.util.ProcessGraphTestSupport.readGraph;

class GraphIntrospectionTest {

    @Test
    void collectsLoadCollectionArguments() {
        ProcessGraph graph = PARSER.parse(readGraph("load_and_reduce.json")).getDocumentOrThrow().getGraph();

        List<GraphIntrospection.DataSource> sources = GraphIntrospection.collectDataSources(graph);

        assertEquals(1, sources.size());
        GraphIntrospection.DataSource source = sources.get(0);
        assertEquals("load", source.getNodeId());
        assertEquals("SENTINEL2_L2A", source.getCollectionId());
        assertEquals(Arrays.asList("2018-01-01", "2018-02-01"), source.getTemporalExtent());
        assertEquals(Arrays.asList("B08", "B04"), source.getBands());
        assertEquals(16.1, ((Map<?, ?>) source.getSpatialExtent()).get("west"));
    }

    @Test
    void argumentsWithReferencesAreUnknown() {
        ProcessGraph graph = PARSER.parse(json("{'load': {'process_id': 'load_collection', 'arguments': {"
                + "'id': {'from_argument': 'collection'}, 'bands': ['B02', {'from_argument': 'band'}]}, 'result': true}}"))
                .getDocumentOrThrow().getGraph();

        GraphIntrospection.DataSource source = GraphIntrospection.collectDataSources(graph).get(0);

        assertNull(source.getCollectionId());
        assertNull(source.getBands());
        assertNull(source.getTemporalExtent());
    }

    @Test
    void findsNodesByProcess() {
        ProcessGraph graph = PARSER.parse(readGraph("evi.json")).getDocumentOrThrow().getGraph();

        assertEquals(3, GraphIntrospection.findNodesByProcess(graph, "product").size());
        assertTrue(GraphIntrospection.findNodesByProcess(graph, "load_collection").isEmpty());
    }
}
