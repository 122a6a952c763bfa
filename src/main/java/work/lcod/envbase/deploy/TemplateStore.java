package work.lcod.envbase.deploy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Rendered root template on disk: {@code <templatesDirectory>/<global.output>}. Written by the create action and
 * read back as the body of every create/update call.
 */
public final class TemplateStore {
    public static final String TEMPLATES_DIRECTORY = "templates";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Path file;

    public TemplateStore(Path templatesDirectory, String fileName) {
        this.file = templatesDirectory.resolve(fileName);
    }

    public Path file() {
        return file;
    }

    public void write(String document) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, document, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write template " + file, ex);
        }
    }

    /** Template body with whitespace runs collapsed, keeping the request small. */
    public String readBody() {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("Template at " + file + " not found, run the create action first");
        }
        try {
            return WHITESPACE.matcher(Files.readString(file, StandardCharsets.UTF_8)).replaceAll(" ").trim();
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read template " + file, ex);
        }
    }
}
