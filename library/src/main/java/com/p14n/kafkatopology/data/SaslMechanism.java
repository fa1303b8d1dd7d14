package com.p14n.kafkatopology.data;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * SASL mechanisms accepted for a cluster.
 */
public enum SaslMechanism {

    PLAIN("PLAIN", "org.apache.kafka.common.security.plain.PlainLoginModule"),
    GSSAPI("GSSAPI", null),
    SCRAM_SHA_256("SCRAM-SHA-256", "org.apache.kafka.common.security.scram.ScramLoginModule"),
    SCRAM_SHA_512("SCRAM-SHA-512", "org.apache.kafka.common.security.scram.ScramLoginModule"),
    OAUTHBEARER("OAUTHBEARER", null);

    private final String mechanismName;
    private final String loginModule;

    SaslMechanism(String mechanismName, String loginModule) {
        this.mechanismName = mechanismName;
        this.loginModule = loginModule;
    }

    public String mechanismName() {
        return mechanismName;
    }

    /**
     * The JAAS login module that takes a username and password for this
     * mechanism, or empty when the mechanism does not authenticate that way.
     *
     * @return the login module class name
     */
    public Optional<String> passwordLoginModule() {
        return Optional.ofNullable(loginModule);
    }

    public static Optional<SaslMechanism> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.mechanismName.equals(normalised))
                .findFirst();
    }
}
