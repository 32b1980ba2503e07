package com.txscript.bus;

/**
 * Callback for inbound frames. Invoked on the bus's own thread.
 */
@FunctionalInterface
public interface CanFrameListener {
    void onFrame(CanFrame frame);
}
