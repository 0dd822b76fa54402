package com.cumulo.service.core.error;

public class WindowTooWideException extends IllegalArgumentException {
    private final int window;
    private final int width;

    public WindowTooWideException(int window, int width) {
        super("Window of " + window + " days is outside the tracked bitset width 1.." + width);
        this.window = window;
        this.width = width;
    }

    public int window() {
        return window;
    }

    public int width() {
        return width;
    }
}
