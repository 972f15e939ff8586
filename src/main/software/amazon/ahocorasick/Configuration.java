package software.amazon.ahocorasick;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Configuration for an Automaton.
 */
@Immutable
public class Configuration {

    static final int DEFAULT_INITIAL_STATE_CAPACITY = 16;

    /**
     * Patterns and texts supplied as Strings are turned into bytes with this charset before they reach the automaton,
     * which only ever sees bytes. Patterns and texts must be encoded the same way for matches to be found, which is why
     * the automaton keeps this setting and applies it to both.
     */
    private final Charset charset;

    /**
     * Initial capacity of the automaton's state list. Purely a sizing hint; the list grows as needed.
     */
    private final int initialStateCapacity;

    private Configuration(Charset charset, int initialStateCapacity) {
        this.charset = charset;
        this.initialStateCapacity = initialStateCapacity;
    }

    public Charset getCharset() {
        return charset;
    }

    public int getInitialStateCapacity() {
        return initialStateCapacity;
    }

    public static Configuration defaults() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        return "Configuration{" +
                "charset=" + charset +
                ", initialStateCapacity=" + initialStateCapacity +
                '}';
    }

    public static class Builder {

        private Charset charset = StandardCharsets.UTF_8;
        private int initialStateCapacity = DEFAULT_INITIAL_STATE_CAPACITY;

        public Builder withCharset(@Nonnull Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder withInitialStateCapacity(int initialStateCapacity) {
            if (initialStateCapacity <= 0) {
                throw new IllegalArgumentException("initialStateCapacity must be positive");
            }
            this.initialStateCapacity = initialStateCapacity;
            return this;
        }

        public Configuration build() {
            return new Configuration(charset, initialStateCapacity);
        }
    }
}
