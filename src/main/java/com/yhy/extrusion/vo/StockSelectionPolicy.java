package com.yhy.extrusion.vo;

/**
 * How a stock length is chosen when a new bar has to be opened.
 */
public enum StockSelectionPolicy {
    /** first option by priority, then stock length, that holds the piece */
    PRIORITY,
    /** option with the smallest waste per piece when filled with copies of the piece */
    LEAST_WASTE_PER_PIECE
}
