package info.isaksson.erland.recordnames;

import java.nio.file.Files;
import java.nio.file.Path;

/** Locates the bundled samples whether tests run from the module or the repository root. */
final class TestRepoPaths {

    private static final Path SHOP = Path.of("samples", "shop");

    private TestRepoPaths() {}

    static Path resolveSamplesShop() {
        Path start = Path.of("").toAbsolutePath().normalize();
        for (Path p = start; p != null; p = p.getParent()) {
            if (Files.isDirectory(p.resolve(SHOP))) return p.resolve(SHOP);
        }
        throw new IllegalStateException("Could not locate samples/shop above " + start);
    }
}
