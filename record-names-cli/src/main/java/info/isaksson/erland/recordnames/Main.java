package info.isaksson.erland.recordnames;

import info.isaksson.erland.recordnames.core.RecordNamesOptions;
import info.isaksson.erland.recordnames.core.RecordNamesResult;
import info.isaksson.erland.recordnames.core.RecordNamesService;
import info.isaksson.erland.recordnames.model.NameJson;
import info.isaksson.erland.recordnames.model.NameRequest;
import info.isaksson.erland.recordnames.model.ResolvedName;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: prints the record names of a Java source tree, or resolves a JSON batch of descriptors.
 *
 * <p>JSON goes to {@code --output} when given, otherwise to stdout; the summary then moves to stderr
 * so stdout stays machine-readable.</p>
 */
public final class Main {

    private static final RecordNamesService SERVICE = new RecordNamesService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.requests == null && parsed.source == null) {
            System.err.println("Error: --source or --requests is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }
        if (parsed.requests != null && parsed.source != null) {
            System.err.println("Error: --source and --requests cannot be combined.");
            return 1;
        }

        final Path jsonOut = parsed.output == null ? null : Paths.get(parsed.output).toAbsolutePath().normalize();
        final PrintStream summary = jsonOut == null ? System.err : System.out;

        if (parsed.requests != null) {
            return runRequests(parsed, jsonOut, summary);
        }
        return runSource(parsed, jsonOut, summary);
    }

    private static int runSource(CliArgs parsed, Path jsonOut, PrintStream summary) {
        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.exists(sourcePath)) {
            System.err.println("Error: --source does not exist: " + sourcePath);
            return 1;
        }
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: --source must be a directory: " + sourcePath);
            return 1;
        }

        final RecordNamesResult res;
        try {
            res = SERVICE.resolveFromSource(sourcePath, toCoreOptions(parsed));
            emit(res, jsonOut);
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: naming failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        summary.println(
                "record-names\n" +
                "- Source: " + sourcePath + "\n" +
                (jsonOut != null ? "- Output: " + jsonOut + "\n" : "") +
                "- Java files: " + res.javaFileCount + "\n" +
                "- Declarations: " + res.declarations.size() + "\n" +
                "- Generic usages: " + res.genericUsages.size() + "\n" +
                "- Parse errors: " + res.parseErrors.size()
        );
        return 0;
    }

    private static int runRequests(CliArgs parsed, Path jsonOut, PrintStream summary) {
        final Path requestsPath = Paths.get(parsed.requests).toAbsolutePath().normalize();
        if (!Files.exists(requestsPath) || Files.isDirectory(requestsPath)) {
            System.err.println("Error: --requests must point to an existing JSON file: " + requestsPath);
            return 1;
        }

        final List<NameRequest> requests;
        try {
            requests = NameJson.readRequests(requestsPath);
        } catch (IOException e) {
            System.err.println("Error: could not read requests JSON: " + requestsPath);
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            List<ResolvedName> names = SERVICE.resolveRequests(requests);
            emit(names, jsonOut);
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: resolution failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        summary.println(
                "record-names (requests mode)\n" +
                "- Requests: " + requestsPath + "\n" +
                (jsonOut != null ? "- Output: " + jsonOut + "\n" : "") +
                "- Resolved: " + requests.size()
        );
        return 0;
    }

    private static void emit(Object value, Path jsonOut) throws IOException {
        if (jsonOut == null) {
            System.out.print(NameJson.toJsonString(value));
            System.out.flush();
        } else {
            NameJson.write(value, jsonOut);
        }
    }

    private static RecordNamesOptions toCoreOptions(CliArgs parsed) {
        RecordNamesOptions o = new RecordNamesOptions();
        o.includeTests = parsed.includeTests;
        o.excludeGlobs = new ArrayList<>(parsed.excludes);
        o.includeLocalTypes = parsed.localTypes;
        return o;
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        String requests;
        String output;

        boolean includeTests = false;
        boolean localTypes = true;
        final List<String> excludes = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--requests":
                        out.requests = requireValue(args, ++i, "--requests");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--include-tests":
                        out.includeTests = true;
                        break;
                    case "--local-types":
                        out.localTypes = parseBoolean(requireValue(args, ++i, "--local-types"), "--local-types");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "record-names\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar record-names.jar --source <path> [--output <file.json>] [options]\n" +
                    "  java -jar record-names.jar --requests <file.json> [--output <file.json>]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <path>        Root folder containing Java sources\n" +
                    "  --requests <file>      JSON array of {descriptor, overrides} to resolve instead\n" +
                    "  --output <file>        Write JSON here (default: stdout, summary on stderr)\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths *relative to --source* using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --include-tests        Include common test folders (default: excluded)\n" +
                    "  --local-types <bool>   Report types declared in method bodies. Default: true.\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/record-names.jar samples/shop\n" +
                    "  java -jar target/record-names.jar --source . --exclude \"**/generated/**\" --output names.json\n" +
                    "  java -jar target/record-names.jar --requests requests.json\n"
            );
        }
    }
}
