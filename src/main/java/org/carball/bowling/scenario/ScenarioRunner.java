package org.carball.bowling.scenario;

import lombok.extern.slf4j.Slf4j;
import org.carball.bowling.game.BowlingGame;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plays canned scenarios through a fresh {@link BowlingGame} each.
 */
@Slf4j
public class ScenarioRunner {

    public ScenarioResult run(Scenario scenario) {
        BowlingGame game = new BowlingGame();
        for (int pins : scenario.getRolls()) {
            game.roll(pins);
        }

        int actual = game.score();
        if (actual != scenario.getExpectedScore()) {
            log.warn("Scenario '{}' scored {} but {} was expected",
                    scenario.getName(), actual, scenario.getExpectedScore());
        } else {
            log.debug("Scenario '{}' scored {}", scenario.getName(), actual);
        }

        return ScenarioResult.builder()
                .name(scenario.getName())
                .title(scenario.getTitle())
                .rolls(game.getRolls())
                .expectedScore(scenario.getExpectedScore())
                .actualScore(actual)
                .build();
    }

    public List<ScenarioResult> runAll(List<Scenario> scenarios) {
        return scenarios.stream()
                .map(this::run)
                .collect(Collectors.toList());
    }
}
