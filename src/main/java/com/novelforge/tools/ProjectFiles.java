package com.novelforge.tools;

import com.novelforge.ProjectContext;
import com.novelforge.storage.JsonStorage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Text file helpers scoped to one project folder.
 */
public class ProjectFiles {

    private static final Pattern CHUNK_FILE = Pattern.compile("chunk_(\\d+)\\.md");

    private final ProjectContext project;

    public ProjectFiles(ProjectContext project) {
        this.project = project;
    }

    public Path write(String relativePath, String content) throws IOException {
        Path target = project.resolve(relativePath);
        JsonStorage.writeAtomic(target, content);
        return target;
    }

    /**
     * Returns the file content, or null when the file does not exist.
     */
    public String read(String relativePath) throws IOException {
        Path target = project.resolve(relativePath);
        if (!Files.isRegularFile(target)) {
            return null;
        }
        return Files.readString(target, StandardCharsets.UTF_8);
    }

    public boolean exists(String relativePath) {
        return Files.isRegularFile(project.resolve(relativePath));
    }

    public String chunkPath(int item) {
        return String.format("%s/chunk_%02d.md", ProjectContext.MANUSCRIPT_DIR, item);
    }

    public String readChunk(int item) throws IOException {
        return read(chunkPath(item));
    }

    /**
     * Chunk numbers present in the manuscript folder, ascending.
     */
    public List<Integer> listChunks() throws IOException {
        List<Integer> chunks = new ArrayList<>();
        Path dir = project.manuscriptDir();
        if (!Files.isDirectory(dir)) {
            return chunks;
        }
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(p -> {
                Matcher m = CHUNK_FILE.matcher(p.getFileName().toString());
                if (m.matches()) {
                    chunks.add(Integer.parseInt(m.group(1)));
                }
            });
        }
        chunks.sort(Integer::compareTo);
        return chunks;
    }

    /**
     * Highest version N among files named {@code prefix + N + ".md"} in the critiques folder, 0 if none.
     */
    public int latestVersion(String prefix) throws IOException {
        Path dir = project.critiquesDir();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Pattern pattern = Pattern.compile(Pattern.quote(prefix) + "(\\d+)\\.md");
        int latest = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                Matcher m = pattern.matcher(p.getFileName().toString());
                if (m.matches()) {
                    latest = Math.max(latest, Integer.parseInt(m.group(1)));
                }
            }
        }
        return latest;
    }

    public static int wordCount(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
