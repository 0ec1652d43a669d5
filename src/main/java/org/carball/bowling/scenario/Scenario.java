package org.carball.bowling.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Scenario {
    private String name;
    private String title;
    private String description;

    @Builder.Default
    private List<Integer> rolls = new ArrayList<>();

    @JsonProperty("expected_score")
    private int expectedScore;
}
