package com.questrail.archon.protocol.model;

/**
 * Frame buffer readout mode, as reported by {@code BUFnMODE}.
 */
public enum BufferMode
{
    TOP(0),
    BOTTOM(1),
    SPLIT(2);

    private final int code;

    BufferMode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static BufferMode fromCode(int code) {
        for (BufferMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown buffer mode: " + code);
    }
}
