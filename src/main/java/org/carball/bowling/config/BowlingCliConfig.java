package org.carball.bowling.config;

import lombok.Data;

@Data
public class BowlingCliConfig {
    private String scenarioSelection = "all";
    private OutputFormat outputFormat = OutputFormat.TEXT;
    private String outputFile;
    private boolean listOnly;
    private boolean verbose;
}
