package com.eainde.loganalyzer;

import com.eainde.loganalyzer.state.LogAnalysisState;
import com.eainde.loganalyzer.workflow.LogAnalysisEngine;
import org.bsc.langgraph4j.CompiledGraph;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "loganalyzer.inputs=",
        "loganalyzer.llm.provider=ollama",
        "loganalyzer.llm.base-url=http://localhost:11434"
})
class LogAnalyzerApplicationTest {

    @Autowired
    private LogAnalysisEngine engine;

    @Autowired
    @Qualifier("logAnalyzerWorkflow")
    private CompiledGraph<LogAnalysisState> workflow;

    @Test
    void contextWiresTheWorkflow() {
        assertThat(engine).isNotNull();
        assertThat(workflow).isNotNull();
    }
}
