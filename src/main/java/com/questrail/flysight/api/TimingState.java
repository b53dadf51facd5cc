package com.questrail.flysight.api;

/**
 * TimingState
 * -----------------------------------------------------------------------------
 * State of the start-timing exchange.
 *
 * <ul>
 *   <li>{@link #IDLE}: no start command outstanding; results are discarded</li>
 *   <li>{@link #COUNTING}: a start command was sent; the next valid result is
 *       recorded and the state returns to {@link #IDLE}</li>
 * </ul>
 */
public enum TimingState
{
    IDLE,
    COUNTING
}
