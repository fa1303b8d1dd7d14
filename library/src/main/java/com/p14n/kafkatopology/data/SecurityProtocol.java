package com.p14n.kafkatopology.data;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Security protocols accepted for a cluster.
 */
public enum SecurityProtocol {

    PLAINTEXT("plaintext", false),
    SSL("ssl", false),
    SASL_PLAINTEXT("sasl_plaintext", true),
    SASL_SSL("sasl_ssl", true);

    private final String configName;
    private final boolean sasl;

    SecurityProtocol(String configName, boolean sasl) {
        this.configName = configName;
        this.sasl = sasl;
    }

    public String configName() {
        return configName;
    }

    /**
     * Whether this protocol authenticates with SASL.
     *
     * @return true for the SASL protocols
     */
    public boolean usesSasl() {
        return sasl;
    }

    public static Optional<SecurityProtocol> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.configName.equals(normalised))
                .findFirst();
    }
}
