package org.dxworks.markflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        List<String> arguments = Arrays.asList(args);
        boolean parallel = arguments.contains("--parallel");
        List<String> paths = arguments.stream().filter(arg -> !arg.startsWith("--")).toList();

        if (paths.size() < 2) {
            System.err.println("Usage: java -jar markflow.jar <input-file> <output-file> [--parallel]");
            System.err.println("  <input-file>:  Markdown document to lay out");
            System.err.println("  <output-file>: Path to the JSON file receiving the layout elements");
            System.err.println("  --parallel:    Interpret top-level blocks in parallel");
            System.exit(2);
        }

        Path input = Paths.get(paths.get(0));
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            System.exit(1);
        }
        Path output = Paths.get(paths.get(1));

        try {
            RenderedDocument document = render(input, MarkflowConfig.load(), parallel);
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, MAPPER.writeValueAsString(document), StandardCharsets.UTF_8);

            System.out.println("Rendered " + input.getFileName() + ": " + document.elements().size() + " elements");
            if (!document.diagnostics().isEmpty()) {
                System.out.println(document.diagnostics().size() + " problems recovered:");
                document.diagnostics().forEach(diagnostic -> System.out.println("  " + diagnostic));
            }
            System.out.println("Output: " + output.toAbsolutePath());
        } catch (IOException e) {
            System.err.println("Error rendering " + input + ": " + e.getMessage());
            System.exit(1);
        }
    }

    public static RenderedDocument render(Path input, MarkflowConfig config, boolean parallel) throws IOException {
        String markdown = Files.readString(input, StandardCharsets.UTF_8);
        return new MarkdownRenderer(config).render(markdown, parallel);
    }
}
