package com.designlens.core.graph;

import com.designlens.core.nodes.CompareStagesNode;
import com.designlens.core.nodes.ExtractStructureNode;
import com.designlens.core.nodes.GroupComponentsNode;
import com.designlens.core.nodes.MapStylesNode;
import com.designlens.core.nodes.ValidateVisualsNode;
import com.designlens.core.state.AnalysisState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives one design analysis.
 * <p>
 * Topology:
 * <pre>
 *   START -> extract_structure -> group_components -> validate_visuals
 *         -> map_styles -> compare_stages -> END
 * </pre>
 * Grouping and validation never fail the run; they fall back to heuristic output instead.
 */
@Component
public class AnalysisGraph {

    private static final Logger log = LoggerFactory.getLogger(AnalysisGraph.class);

    private final CompiledGraph<AnalysisState> compiledGraph;

    public AnalysisGraph(
            ExtractStructureNode extractNode,
            GroupComponentsNode groupNode,
            ValidateVisualsNode validateNode,
            MapStylesNode mapNode,
            CompareStagesNode compareNode) throws Exception {

        var graph = new StateGraph<>(AnalysisState.SCHEMA, AnalysisState::new)
                .addNode("extract_structure", node_async(extractNode::apply))
                .addNode("group_components", node_async(groupNode::apply))
                .addNode("validate_visuals", node_async(validateNode::apply))
                .addNode("map_styles", node_async(mapNode::apply))
                .addNode("compare_stages", node_async(compareNode::apply))
                .addEdge(START, "extract_structure")
                .addEdge("extract_structure", "group_components")
                .addEdge("group_components", "validate_visuals")
                .addEdge("validate_visuals", "map_styles")
                .addEdge("map_styles", "compare_stages")
                .addEdge("compare_stages", END);

        this.compiledGraph = graph.compile();
        log.info("Analysis graph compiled");
    }

    public CompiledGraph<AnalysisState> getCompiledGraph() {
        return compiledGraph;
    }
}
