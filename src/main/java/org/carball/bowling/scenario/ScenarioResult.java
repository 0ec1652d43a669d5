package org.carball.bowling.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ScenarioResult {
    private String name;
    private String title;
    private List<Integer> rolls;
    private int expectedScore;
    private int actualScore;

    @JsonProperty("correct")
    public boolean isCorrect() {
        return expectedScore == actualScore;
    }
}
