package me.scout.cron.adapter.outbound.executor;

import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.JobExecutionResult;
import me.scout.cron.domain.model.RunRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DryRunJobExecutorAdapterTest {

    private final DryRunJobExecutorAdapter adapter = new DryRunJobExecutorAdapter();

    @Test
    void shouldReportSuccessWithoutUsage() {
        JobDefinition job = JobDefinition.builder()
                .id("job-1")
                .graphId("report-graph")
                .inputs(Map.of("a", 1, "b", 2))
                .build();
        RunRecord run = RunRecord.builder().id("dryrun_job-1_1_abc").jobId("job-1").build();

        JobExecutionResult result = adapter.execute(job, run).join();

        assertEquals("[Dry run] graph=report-graph, inputs=2", result.getOutput());
        assertEquals(0, result.getSteps());
        assertEquals(0, result.getTokens());
        assertEquals("dry-run", adapter.getExecutorId());
        assertEquals(1, result.getIntermediateSteps().size());
        assertEquals("report-graph", result.getIntermediateSteps().get(0).get("graphId"));
    }
}
