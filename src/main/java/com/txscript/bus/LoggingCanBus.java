package com.txscript.bus;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.txscript.debug.Debug;

/**
 * A bus with no hardware behind it: sent frames are logged and accepted, and frames
 * injected with {@link #publish(CanFrame)} are delivered to the subscribers of their port.
 * Used by the command line runner and for dry runs.
 */
public final class LoggingCanBus implements CanBus {

    private static final String TAG = "txscript.bus";

    private final Map<Integer, List<CanFrameListener>> listeners = new ConcurrentHashMap<>();

    @Override
    public boolean sendFrame(int port, long id, byte[] data, boolean extended) {
        Debug.get().i(TAG, "TX port " + port + " " + CanFrame.formatId(id, extended)
                + " [" + data.length + "] " + CanFrame.hex(data));
        return true;
    }

    @Override
    public Subscription subscribe(int port, CanFrameListener listener) {
        List<CanFrameListener> list = listeners.computeIfAbsent(port, p -> new CopyOnWriteArrayList<>());
        list.add(listener);
        return () -> list.remove(listener);
    }

    public void publish(CanFrame frame) {
        Debug.get().i(TAG, "RX " + frame);
        List<CanFrameListener> list = listeners.get(frame.port());
        if (list == null) return;
        for (CanFrameListener l : list) {
            l.onFrame(frame);
        }
    }
}
