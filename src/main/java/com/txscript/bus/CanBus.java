package com.txscript.bus;

import java.io.IOException;

/**
 * Boundary to the CAN hardware (or a simulator). The script engine only ever sends
 * frames and listens for inbound traffic; connecting, bit rates and filters belong
 * to the host.
 */
public interface CanBus {

    /**
     * Send one frame on a port.
     *
     * @return true if the interface accepted the frame
     * @throws IOException if the transport failed
     */
    boolean sendFrame(int port, long id, byte[] data, boolean extended) throws IOException;

    /**
     * Register for frames received on a port. Frames arrive on the bus's thread.
     */
    Subscription subscribe(int port, CanFrameListener listener);

    /**
     * Handle returned by {@link #subscribe}. Closing it stops delivery; closing twice is harmless.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
