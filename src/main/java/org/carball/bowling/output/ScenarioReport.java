package org.carball.bowling.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.bowling.scenario.ScenarioResult;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class ScenarioReport {

    private static final String CORRECT_MARK = "✓";
    private static final String WRONG_MARK = "✗";

    private final List<ScenarioResult> results;
    private final ObjectMapper objectMapper;

    public ScenarioReport(List<ScenarioResult> results) {
        this.results = results;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toText() {
        StringBuilder text = new StringBuilder();

        text.append("BOWLING GAME SCENARIOS\n");
        text.append("======================\n");

        for (ScenarioResult result : results) {
            text.append("\n").append(result.getTitle()).append(":\n");
            text.append("Rolls: ").append(formatRolls(result.getRolls())).append("\n");
            text.append("Expected score: ").append(result.getExpectedScore()).append("\n");
            text.append("Actual score: ").append(result.getActualScore()).append("\n");
            text.append("Correct implementation: ")
                    .append(result.isCorrect() ? CORRECT_MARK : WRONG_MARK).append("\n");
        }

        text.append("\n").append("-".repeat(40)).append("\n");
        text.append(String.format("%d scenarios, %d correct, %d incorrect\n",
                results.size(), getPassedCount(), getFailedCount()));
        return text.toString();
    }

    public long getPassedCount() {
        return results.stream().filter(ScenarioResult::isCorrect).count();
    }

    public long getFailedCount() {
        return results.size() - getPassedCount();
    }

    public boolean isAllCorrect() {
        return getFailedCount() == 0;
    }

    private static String formatRolls(List<Integer> rolls) {
        return rolls.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setResults(results);
        report.setSummary(new Summary(results.size(), getPassedCount(), getFailedCount()));
        return report;
    }

    @lombok.Data
    private static class ReportData {
        private List<ScenarioResult> results;
        private Summary summary;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class Summary {
        private int total;
        private long passed;
        private long failed;
    }
}
