package org.dxworks.flowframe;

import org.approvaltests.Approvals;
import org.dxworks.flowframe.analyzer.NodeIdGenerator;
import org.dxworks.flowframe.model.AnalysisResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class WorkflowApprovalTest {

    @Test
    void analyze_NotifyWorkflow() throws IOException {
        List<AnalysisResult> results = new WorkflowAnalyzer(new NodeIdGenerator())
                .analyzeFile(TestUtils.sample("notify.ts"), AnalyzerOptions.defaults().withIncludeLocations(false));

        assertEquals(1, results.size());
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(results.get(0).root) + "\n");
    }
}
