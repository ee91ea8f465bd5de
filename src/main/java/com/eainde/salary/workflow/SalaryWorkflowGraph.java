package com.eainde.salary.workflow;

import com.eainde.salary.nodes.AnalyzeSalaryNode;
import com.eainde.salary.nodes.AssembleResultNode;
import com.eainde.salary.nodes.GenerateQueriesNode;
import com.eainde.salary.nodes.LookupKnowledgeBaseNode;
import com.eainde.salary.nodes.ParseProfileNode;
import com.eainde.salary.nodes.SearchWebNode;
import com.eainde.salary.state.SalaryEstimationState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * parse_profile -> generate_queries -> (search_web | lookup_kb) -> analyze_salary -> assemble_result
 *
 * <p>The two lookup nodes fan out from generate_queries and join again on
 * analyze_salary. There are no conditional edges and no loops.</p>
 */
@Component
public class SalaryWorkflowGraph {

    public static final String BEAN_NAME = "salaryEstimationWorkflow";

    private final ParseProfileNode parseProfile;
    private final GenerateQueriesNode generateQueries;
    private final SearchWebNode searchWeb;
    private final LookupKnowledgeBaseNode lookupKnowledgeBase;
    private final AnalyzeSalaryNode analyzeSalary;
    private final AssembleResultNode assembleResult;

    public SalaryWorkflowGraph(ParseProfileNode parseProfile,
                               GenerateQueriesNode generateQueries,
                               SearchWebNode searchWeb,
                               LookupKnowledgeBaseNode lookupKnowledgeBase,
                               AnalyzeSalaryNode analyzeSalary,
                               AssembleResultNode assembleResult) {
        this.parseProfile = parseProfile;
        this.generateQueries = generateQueries;
        this.searchWeb = searchWeb;
        this.lookupKnowledgeBase = lookupKnowledgeBase;
        this.analyzeSalary = analyzeSalary;
        this.assembleResult = assembleResult;
    }

    @Bean(BEAN_NAME)
    public CompiledGraph<SalaryEstimationState> build() throws GraphStateException {
        StateGraph<SalaryEstimationState> workflow = new StateGraph<>(SalaryEstimationState::new);

        workflow.addNode(ParseProfileNode.NAME, parseProfile);
        workflow.addNode(GenerateQueriesNode.NAME, generateQueries);
        workflow.addNode(SearchWebNode.NAME, searchWeb);
        workflow.addNode(LookupKnowledgeBaseNode.NAME, lookupKnowledgeBase);
        workflow.addNode(AnalyzeSalaryNode.NAME, analyzeSalary);
        workflow.addNode(AssembleResultNode.NAME, assembleResult);

        workflow.addEdge(START, ParseProfileNode.NAME);
        workflow.addEdge(ParseProfileNode.NAME, GenerateQueriesNode.NAME);

        // fan out
        workflow.addEdge(GenerateQueriesNode.NAME, SearchWebNode.NAME);
        workflow.addEdge(GenerateQueriesNode.NAME, LookupKnowledgeBaseNode.NAME);

        // join
        workflow.addEdge(SearchWebNode.NAME, AnalyzeSalaryNode.NAME);
        workflow.addEdge(LookupKnowledgeBaseNode.NAME, AnalyzeSalaryNode.NAME);

        workflow.addEdge(AnalyzeSalaryNode.NAME, AssembleResultNode.NAME);
        workflow.addEdge(AssembleResultNode.NAME, END);

        return workflow.compile();
    }
}
