package com.p14n.kafkatopology;

/**
 * Raised when the topology module cannot start; the only failure that is
 * fatal to the module.
 */
public class ModuleLoadException extends RuntimeException {

    public ModuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
