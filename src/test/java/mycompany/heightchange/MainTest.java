package mycompany.heightchange;

import mycompany.heightchange.raster.RasterFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static mycompany.heightchange.raster.RasterFixtures.filled;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBytes, true);

    private String err() {
        return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[0], err));
        assertTrue(err().startsWith("Usage:"));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"diff"}, err));
        assertTrue(err().contains("Unknown command: diff"));
    }

    @Test
    void invalidConfigurationFailsBeforeAnyWork() throws IOException {
        Path config = tmp.resolve("config.yml");
        Files.write(config, "copy_tif: true\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"compare", config.toString()}, err));
        assertTrue(err().contains("Configuration error: reference_dir is required"));
        assertFalse(Files.exists(tmp.resolve("changed.txt")));
    }

    @Test
    void compareWritesChangeList() throws IOException {
        Path reference = tmp.resolve("ahn3");
        Path target = tmp.resolve("ahn4");
        Path changeList = tmp.resolve("changed.txt");
        RasterFixtures.writeFloatTiff(reference.resolve("b1.tif"), filled(3, 3, 1.0));
        RasterFixtures.writeFloatTiff(target.resolve("b1.tif"), filled(3, 3, 2.0));
        RasterFixtures.writeFloatTiff(target.resolve("b2.tif"), filled(3, 3, 2.0));
        Path config = tmp.resolve("config.yml");
        Files.write(config, ("reference_dir: " + reference + "\n"
                + "target_dir: " + target + "\n"
                + "change_list: " + changeList + "\n"
                + "threads: 1\n"
                + "metrics:\n"
                + "  maxima: 5.0\n").getBytes(StandardCharsets.UTF_8));

        assertEquals(Main.EXIT_OK, Main.run(new String[] {"compare", config.toString()}, err), err());
        assertEquals(Arrays.asList("b2"), Files.readAllLines(changeList, StandardCharsets.UTF_8));
    }

    @Test
    void cleanRejectsBadThreadCount() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {"clean", tmp.toString(), "-3"}, err));
        assertTrue(err().contains("threads must be a non-negative integer"));
    }

    @Test
    void maskRequiresExistingInput() {
        assertEquals(Main.EXIT_FAILURE,
                Main.run(new String[] {"mask", tmp.resolve("absent").toString(), tmp.toString()}, err));
        assertTrue(err().contains("Not a directory"));
    }
}
