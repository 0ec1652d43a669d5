package org.carball.bowling.config;

public enum OutputFormat {
    TEXT,
    JSON
}
