package org.dxworks.clippy;

public enum InputFormat {
    HTML,
    TEXT,
    /** HTML when the input contains both {@code <} and {@code >}, text otherwise. */
    AUTO;

    public static InputFormat detect(String raw) {
        return raw != null && raw.indexOf('<') >= 0 && raw.indexOf('>') >= 0 ? HTML : TEXT;
    }
}
