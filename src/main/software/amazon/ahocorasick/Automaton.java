package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntSet;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 *  Represents an Aho-Corasick automaton built from an ordered list of patterns. Each pattern is identified by its
 *  zero-based position in that list.
 *
 *  The automaton is immutable once built and may be shared by any number of threads; matching only reads the
 *  transitions, failure links and outputs of the states.
 *
 *  Matching reports the patterns recognized at the first position of the text where any pattern match completes,
 *  and stops there. All patterns ending at that position are reported together, including patterns that are a suffix
 *  of a longer one ending there, but matches completing later in the text are not.
 *  <pre>
 *  {@code
 *    Automaton automaton = Automaton.builder().add("he").add("she").add("his").add("hers").build();
 *    automaton.match("but she said");   // {1, 0}
 *  }
 *  </pre>
 */
@Immutable
@ThreadSafe
public class Automaton {

    /**
     * Index of the start state in the state list.
     */
    static final int ROOT_STATE = 0;

    /**
     * Marks an absent transition or an unset failure link. Never a valid index into the state list.
     */
    static final int NO_STATE = -1;

    private static final String RULE = String.join("", Collections.nCopies(79, "-"));

    private final Configuration configuration;
    private final List<String> patterns;
    private final List<State> states;

    private Automaton(final Configuration configuration, final List<String> patterns) {
        this.configuration = configuration;
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));

        final List<byte[]> encoded = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            encoded.add(pattern.getBytes(configuration.getCharset()));
        }
        final List<State> built = TrieBuilder.build(encoded, configuration.getInitialStateCapacity());
        FailureLinkPropagator.propagate(built);
        this.states = Collections.unmodifiableList(built);
    }

    /**
     * Return the identifiers of the patterns recognized at the first position in the text where a match completes.
     *
     * @param text the bytes to scan
     * @return the identifiers, in the order they were recorded. The set may be empty but never null.
     */
    public IntSet match(@Nonnull final byte[] text) {
        return Matcher.firstMatch(states, Objects.requireNonNull(text, "text"));
    }

    /**
     * Return the identifiers of the patterns recognized at the first position in the text where a match completes.
     * The text is encoded with the configured charset.
     *
     * @param text the text to scan
     * @return the identifiers, in the order they were recorded. The set may be empty but never null.
     */
    public IntSet match(@Nonnull final String text) {
        return match(Objects.requireNonNull(text, "text").getBytes(configuration.getCharset()));
    }

    public boolean matches(@Nonnull final byte[] text) {
        return !match(text).isEmpty();
    }

    public boolean matches(@Nonnull final String text) {
        return !match(text).isEmpty();
    }

    /**
     * The patterns this automaton was built from, in identifier order. Kept for inspection only.
     */
    public List<String> getPatterns() {
        return patterns;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    /**
     * Number of live states, the root included.
     */
    public int getStateCount() {
        return states.size();
    }

    /**
     * Dumps the patterns and every state with its output, failure link and explicit transitions. The root's
     * transitions back to itself are left out.
     */
    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        final StringJoiner quoted = new StringJoiner(", ", "[", "]");
        for (String pattern : patterns) {
            quoted.add(quote(pattern));
        }
        sb.append("Patterns: ").append(quoted).append('\n');
        for (int i = 0; i < states.size(); i++) {
            sb.append(String.format("%3d: %s", i, describe(i))).append('\n');
        }
        sb.append(RULE);
        return sb.toString();
    }

    private String describe(final int index) {
        final State state = states.get(index);
        final StringJoiner transitions = new StringJoiner(", ");
        state.forEachTransition((utf8byte, target) -> {
            if (index != ROOT_STATE || target != ROOT_STATE) {
                transitions.add(printable(utf8byte) + " => " + target);
            }
        });
        return "State { out: " + Arrays.toString(state.getOutput().toIntArray()) +
                ", fail: " + state.getFail() +
                ", goto: {" + transitions + "} }";
    }

    /**
     * Quotes a pattern so that it stays on one line and its boundaries are unambiguous.
     */
    private static String quote(final String pattern) {
        final StringBuilder sb = new StringBuilder(pattern.length() + 2).append('"');
        for (int i = 0; i < pattern.length(); i++) {
            final char c = pattern.charAt(i);
            switch (c) {
            case '"':
                sb.append("\\\"");
                break;
            case '\\':
                sb.append("\\\\");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\t':
                sb.append("\\t");
                break;
            default:
                if (Character.isISOControl(c)) {
                    sb.append(String.format("\\u{%x}", (int) c));
                } else {
                    sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    private static String printable(final byte utf8byte) {
        final int value = utf8byte & 0xFF;
        if (value >= 0x20 && value < 0x7F) {
            return String.valueOf((char) value);
        }
        return String.format("\\x%02X", value);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects patterns in order. {@link #build()} may be called any number of times; each call produces an
     * independent automaton from the patterns collected so far.
     */
    public static class Builder {

        private final List<String> patterns = new ArrayList<>();
        private Configuration configuration = Configuration.defaults();

        Builder() { }

        /**
         * Adds a pattern. Its identifier is the number of patterns added before it. Any string is a legal pattern,
         * including the empty string and a string added before.
         */
        public Builder add(@Nonnull final String pattern) {
            patterns.add(Objects.requireNonNull(pattern, "pattern"));
            return this;
        }

        public Builder addAll(@Nonnull final String... patterns) {
            return addAll(Arrays.asList(patterns));
        }

        public Builder addAll(@Nonnull final Iterable<String> patterns) {
            for (String pattern : patterns) {
                add(pattern);
            }
            return this;
        }

        /**
         * Adds every pattern of a JSON array of strings, in document order.
         *
         * @param json the pattern list, see {@link JsonPatternCompiler}
         * @throws IOException if the pattern list isn't syntactically valid; no pattern is added in that case
         */
        public Builder addJson(@Nonnull final String json) throws IOException {
            return addAll(JsonPatternCompiler.compile(json));
        }

        public Builder withConfiguration(@Nonnull final Configuration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            return this;
        }

        public Automaton build() {
            return new Automaton(configuration, patterns);
        }
    }
}
