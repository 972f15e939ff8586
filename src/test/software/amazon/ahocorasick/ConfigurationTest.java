package software.amazon.ahocorasick;

import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertEquals;

public class ConfigurationTest {

    @Test
    public void testDefaults() {
        Configuration configuration = Configuration.defaults();
        assertEquals(StandardCharsets.UTF_8, configuration.getCharset());
        assertEquals(Configuration.DEFAULT_INITIAL_STATE_CAPACITY, configuration.getInitialStateCapacity());
    }

    @Test
    public void testWithCharset() {
        assertEquals(StandardCharsets.UTF_16BE,
                new Configuration.Builder().withCharset(StandardCharsets.UTF_16BE).build().getCharset());
    }

    @Test
    public void testWithInitialStateCapacity() {
        assertEquals(1024, new Configuration.Builder().withInitialStateCapacity(1024).build().getInitialStateCapacity());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInitialStateCapacityMustBePositive() {
        new Configuration.Builder().withInitialStateCapacity(0);
    }

    @Test(expected = NullPointerException.class)
    public void testCharsetIsRequired() {
        new Configuration.Builder().withCharset(null);
    }
}
