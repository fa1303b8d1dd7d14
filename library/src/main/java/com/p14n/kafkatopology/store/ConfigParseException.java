package com.p14n.kafkatopology.store;

import java.io.IOException;

/**
 * Raised when a topology configuration file is syntactically malformed.
 */
public class ConfigParseException extends IOException {

    private final String source;
    private final int line;

    public ConfigParseException(String source, int line, String message) {
        super(source + ":" + line + ": " + message);
        this.source = source;
        this.line = line;
    }

    public String source() {
        return source;
    }

    public int line() {
        return line;
    }
}
