package info.isaksson.erland.recordnames;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainSourceModeSmokeTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void namesTheSampleShopIntoAJsonFile(@TempDir Path tmp) throws Exception {
        Path out = tmp.resolve("out/names.json");

        int code = Main.run(new String[] {
                "--source", TestRepoPaths.resolveSamplesShop().toString(),
                "--output", out.toString()
        });

        assertEquals(0, code);
        assertTrue(Files.exists(out), "JSON must be written: " + out);
        JsonNode root = JSON.readTree(out.toFile());

        assertEquals(List.of(
                "com.example.shop.Order",
                "com.example.shop.Order.Subtotal",
                "com.example.shop.Order.Line",
                "com.example.shop.Result",
                "com.example.shop.Result.Err",
                "com.example.shop.Result.Ok",
                "com.example.finance.Amount"
        ), fullNames(root.get("declarations")));
        assertEquals(List.of(
                "java.util.List__Line",
                "com.example.shop.Result__Money_String",
                "java.util.Map__String_Money"
        ), fullNames(root.get("genericUsages")));
        assertEquals(0, root.get("parseErrors").size());
        assertEquals(3, root.get("javaFileCount").asInt());
    }

    @Test
    void jsonGoesToStdoutWhenNoOutputIsGiven() throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream original = System.out;
        int code;
        try {
            System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
            code = Main.run(new String[] {
                    TestRepoPaths.resolveSamplesShop().toString(),
                    "--include-tests",
                    "--local-types", "false",
                    "--exclude=**/pricing/**"
            });
        } finally {
            System.setOut(original);
        }

        assertEquals(0, code);
        JsonNode root = JSON.readTree(buf.toString(StandardCharsets.UTF_8));
        assertEquals(List.of(
                "com.example.shop.Order",
                "com.example.shop.Order.Line",
                "com.example.shop.OrderFixture",
                "com.example.shop.Result",
                "com.example.shop.Result.Err",
                "com.example.shop.Result.Ok"
        ), fullNames(root.get("declarations")));
    }

    @Test
    void missingSourceIsAUsageError(@TempDir Path tmp) {
        assertEquals(1, Main.run(new String[] {"--source", tmp.resolve("nope").toString()}));
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--bogus"}));
        assertEquals(0, Main.run(new String[] {"--help"}));
    }

    private static List<String> fullNames(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : array) out.add(n.get("resolved").get("fullName").asText());
        return out;
    }
}
