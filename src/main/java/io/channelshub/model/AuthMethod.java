package io.channelshub.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Credential used to authenticate against a host.
 */
public interface AuthMethod {

    /**
     * Short label safe to print (never includes the secret).
     */
    String describe();

    record Password(String secret) implements AuthMethod {
        public Password {
            Objects.requireNonNull(secret, "secret");
        }

        @Override
        public String describe() {
            return "password";
        }

        @Override
        public String toString() {
            return "Password[***]";
        }
    }

    record PrivateKey(Path keyPath, String passphrase) implements AuthMethod {
        public PrivateKey {
            Objects.requireNonNull(keyPath, "keyPath");
        }

        public Optional<String> passphraseValue() {
            return passphrase == null || passphrase.isEmpty() ? Optional.empty() : Optional.of(passphrase);
        }

        @Override
        public String describe() {
            return "key " + keyPath;
        }

        @Override
        public String toString() {
            return "PrivateKey[" + keyPath + (passphrase == null ? "" : ", passphrase=***") + "]";
        }
    }
}
