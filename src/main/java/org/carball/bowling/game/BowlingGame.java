package org.carball.bowling.game;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single ten-pin bowling game.
 * <p>
 * Rolls are kept in a flat list in the order they were thrown, bonus balls of the
 * tenth frame included. The score is derived from that list on every call, so it
 * can be asked for at any point during play: rolls that have not been thrown yet
 * count as zero.
 * <p>
 * Only the pin count of each roll is validated. Two rolls of an open frame adding
 * up to more than ten are accepted.
 * <p>
 * Not thread-safe.
 */
@Slf4j
public class BowlingGame {

    public static final int FRAMES = 10;
    public static final int MAX_PINS = 10;

    private final List<Integer> rolls = new ArrayList<>();

    /**
     * Records a roll.
     *
     * @throws InvalidRollException if {@code pins} is not between 0 and 10
     */
    public void roll(int pins) {
        if (pins < 0 || pins > MAX_PINS) {
            log.debug("Rejected roll of {} pins", pins);
            throw new InvalidRollException(pins, "pins must be between 0 and 10 inclusive, got " + pins);
        }
        rolls.add(pins);
    }

    /**
     * Records a roll given as an arbitrary number. The value must be a whole number
     * of pins; {@code 3.5} is rejected the same way {@code 11} is.
     *
     * @throws InvalidRollException if {@code pins} is null, not integral or out of range
     */
    public void roll(Number pins) {
        if (pins == null) {
            throw new InvalidRollException(null, "pins must be an integer, got null");
        }
        if (!isIntegral(pins)) {
            log.debug("Rejected non-integral roll {}", pins);
            throw new InvalidRollException(pins, "pins must be an integer, got " + pins);
        }
        double value = pins.doubleValue();
        if (value < 0 || value > MAX_PINS) {
            log.debug("Rejected roll of {} pins", pins);
            throw new InvalidRollException(pins, "pins must be between 0 and 10 inclusive, got " + pins);
        }
        roll(pins.intValue());
    }

    /**
     * Total score of the game so far.
     */
    public int score() {
        int score = 0;
        int frameIndex = 0;

        for (int frame = 0; frame < FRAMES; frame++) {
            if (isStrike(frameIndex)) {
                score += MAX_PINS + strikeBonus(frameIndex);
                frameIndex += 1;
            } else if (isSpare(frameIndex)) {
                score += MAX_PINS + spareBonus(frameIndex);
                frameIndex += 2;
            } else {
                score += framePins(frameIndex);
                frameIndex += 2;
            }
        }
        return score;
    }

    public List<Integer> getRolls() {
        return Collections.unmodifiableList(new ArrayList<>(rolls));
    }

    public int getRollCount() {
        return rolls.size();
    }

    private boolean isStrike(int i) {
        return i < rolls.size() && rolls.get(i) == MAX_PINS;
    }

    // Both rolls must have been thrown; a lone 10 is handled as a strike above.
    private boolean isSpare(int i) {
        return i + 1 < rolls.size() && rolls.get(i) + rolls.get(i + 1) == MAX_PINS;
    }

    private int strikeBonus(int i) {
        return pinsAt(i + 1) + pinsAt(i + 2);
    }

    private int spareBonus(int i) {
        return pinsAt(i + 2);
    }

    private int framePins(int i) {
        return pinsAt(i) + pinsAt(i + 1);
    }

    private int pinsAt(int i) {
        return i < rolls.size() ? rolls.get(i) : 0;
    }

    private static boolean isIntegral(Number pins) {
        if (pins instanceof Integer || pins instanceof Long
                || pins instanceof Short || pins instanceof Byte
                || pins instanceof BigInteger) {
            return true;
        }
        if (pins instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) pins;
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        double value = pins.doubleValue();
        return !Double.isNaN(value) && !Double.isInfinite(value) && value == Math.rint(value);
    }
}
