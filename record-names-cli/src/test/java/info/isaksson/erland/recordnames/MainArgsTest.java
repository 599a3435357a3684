package info.isaksson.erland.recordnames;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainArgsTest {

    @Test
    void parsesFlagsAndBarePath() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "src", "--exclude", "**/gen/**", "--exclude=legacy", "--include-tests", "--local-types", "no"
        });

        assertEquals("src", a.source);
        assertEquals(List.of("**/gen/**", "legacy"), a.excludes);
        assertTrue(a.includeTests);
        assertFalse(a.localTypes);
        assertNull(a.output);
    }

    @Test
    void rejectsMissingValuesAndExtraPaths() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--output"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--source", "--help"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a", "b"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--local-types", "maybe"}));
    }
}
