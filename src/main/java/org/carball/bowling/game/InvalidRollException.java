package org.carball.bowling.game;

import lombok.Getter;

/**
 * Thrown when a roll is outside [0, 10] or is not a whole number of pins.
 */
@Getter
public class InvalidRollException extends IllegalArgumentException {

    private final transient Object pins;

    public InvalidRollException(Object pins, String message) {
        super(message);
        this.pins = pins;
    }
}
