package com.questrail.archon.protocol.model;

/**
 * Frame buffer sample width, as reported by {@code BUFnSAMPLE}.
 */
public enum SampleMode
{
    BITS_16(0, 2),
    BITS_32(1, 4);

    private final int code;
    private final int bytesPerSample;

    SampleMode(int code, int bytesPerSample) {
        this.code = code;
        this.bytesPerSample = bytesPerSample;
    }

    public int code() {
        return code;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    public static SampleMode fromCode(int code) {
        for (SampleMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown sample mode: " + code);
    }
}
