/**
 * <p>
 * The concurrent ticket inventory and allocation engine.
 * </p>
 *
 * <ul>
 * <li>{@link com.boxoffice.engine.IdentifierSource}: issues unique, increasing ticket numbers.</li>
 * <li>{@link com.boxoffice.engine.SeatLedger}: counts consumed seats per showing.</li>
 * <li>{@link com.boxoffice.engine.RecordStore}: the table of ticket records.</li>
 * <li>{@link com.boxoffice.engine.InventoryEngine}: initialize, sell and exchange.</li>
 * </ul>
 *
 * <p>
 * State is owned by an {@link com.boxoffice.engine.InventoryEngine} instance;
 * independent engines do not share anything.
 * </p>
 */
package com.boxoffice.engine;
