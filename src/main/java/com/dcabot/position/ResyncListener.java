package com.dcabot.position;

/**
 * Notified once when the venue reports the position closed while the replica still held it open.
 */
@FunctionalInterface
public interface ResyncListener {

	void onPositionClosedExternally(PositionSnapshot previous);
}
