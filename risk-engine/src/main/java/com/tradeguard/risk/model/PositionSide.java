package com.tradeguard.risk.model;

public enum PositionSide {
    LONG,
    SHORT;

    /**
     * +1 for longs, -1 for shorts. Multiplying a price move by this gives the move in the
     * position's favour.
     */
    public int direction() {
        return this == LONG ? 1 : -1;
    }
}
