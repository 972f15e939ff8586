package software.amazon.ahocorasick;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a pattern list described by a JSON array of strings, e.g.
 * <pre>
 *   [ "he", "she", "his", "hers" ]
 * </pre>
 * into the list of patterns in document order. The position of a pattern in the array becomes its identifier once the
 * list is added to an empty {@link Automaton.Builder}. Duplicates and empty strings are kept as they are.
 */
public class JsonPatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern list
     * @param source pattern list, as a String
     * @return null if the pattern list is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (IOException e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (IOException e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (IOException e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (IOException e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern list from its JSON form.
     *
     * @param source pattern list, as a String
     * @return the patterns, in document order
     * @throws IOException if the pattern list isn't syntactically valid
     */
    public static List<String> compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a pattern list that has already been parsed into a tree.
     *
     * @param root the parsed pattern list
     * @return the patterns, in document order
     * @throws IllegalArgumentException if the node is not an array of strings
     */
    public static List<String> compile(final JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Pattern list is not an array");
        }
        final List<String> patterns = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("Patterns must be strings, got " + element.getNodeType());
            }
            patterns.add(element.textValue());
        }
        return patterns;
    }

    private static List<String> doCompile(final JsonParser parser) throws IOException {
        try {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, "Pattern list is not an array");
            }
            final List<String> patterns = new ArrayList<>();
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token != JsonToken.VALUE_STRING) {
                    barf(parser, "Patterns must be strings");
                }
                patterns.add(parser.getText());
            }
            if (parser.nextToken() != null) {
                barf(parser, "Garbage after the pattern list");
            }
            return patterns;
        } finally {
            parser.close();
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
