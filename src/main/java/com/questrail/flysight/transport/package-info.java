/**
 * FlySight Transport Port
 * =============================================================================
 *
 * These interfaces define the boundary between a concrete BLE central stack
 * (a platform Bluetooth API, a bridge process, a simulator or a test double)
 * and the FlySight client.
 *
 * <p>Everything above this boundary sees only:</p>
 * <ul>
 *   <li>Devices as stable identifier strings</li>
 *   <li>Services and characteristics as {@link java.util.UUID}s</li>
 *   <li>Characteristic values as {@code byte[]}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no protocol interpretation)</li>
 *   <li>Not decode directory entries, data frames or timing results</li>
 *   <li>Not retry, reconnect or time out on the client's behalf</li>
 * </ul>
 *
 * <p>All protocol behavior lives in the controller and its sub-protocols.</p>
 */
package com.questrail.flysight.transport;
