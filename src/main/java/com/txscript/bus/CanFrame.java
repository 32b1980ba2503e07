package com.txscript.bus;

import java.util.Arrays;

/**
 * One CAN frame as seen on a port. Immutable; the payload is copied in and out.
 */
public final class CanFrame {
    public static final long MAX_STANDARD_ID = 0x7FFL;
    public static final long MAX_EXTENDED_ID = 0x1FFFFFFFL;

    private final long id;
    private final byte[] data;
    private final long timestamp;
    private final int port;
    private final boolean extended;

    /**
     * @param timestamp milliseconds, in whatever time base the bus uses for inbound traffic
     */
    public CanFrame(long id, byte[] data, long timestamp, int port, boolean extended) {
        this.id = id;
        this.data = (data == null) ? new byte[0] : data.clone();
        this.timestamp = timestamp;
        this.port = port;
        this.extended = extended;
    }

    public long id() { return id; }
    public byte[] data() { return data.clone(); }
    public int dlc() { return data.length; }
    public long timestamp() { return timestamp; }
    public int port() { return port; }
    public boolean extended() { return extended; }

    /** Upper-case hex bytes separated by spaces, e.g. "02 01 0C". */
    public static String hex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(String.format("%02X", bytes[i] & 0xFF));
        }
        return sb.toString();
    }

    public static String formatId(long id, boolean extended) {
        return extended ? String.format("0x%08X", id) : String.format("0x%03X", id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanFrame)) return false;
        CanFrame other = (CanFrame) o;
        return id == other.id
                && timestamp == other.timestamp
                && port == other.port
                && extended == other.extended
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(id);
        h = 31 * h + Arrays.hashCode(data);
        h = 31 * h + port;
        return 31 * h + (extended ? 1 : 0);
    }

    @Override
    public String toString() {
        return "CanFrame(port " + port + ", " + formatId(id, extended) + " [" + dlc() + "] " + hex(data) + ")";
    }
}
