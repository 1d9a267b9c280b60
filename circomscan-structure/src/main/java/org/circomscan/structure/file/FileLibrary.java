package org.circomscan.structure.file;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/*
All files taking part in an analysis run, indexed by file id (the order in which they were added).
User input files are the ones named explicitly by the user; the others are pulled in as libraries.
 */
public class FileLibrary {

    public record SourceFile(String name, String source, boolean userInput) {
        public byte[] bytes() {
            return source.getBytes(StandardCharsets.UTF_8);
        }
    }

    private final List<SourceFile> files = new ArrayList<>();

    public int addFile(String name, String source, boolean userInput) {
        files.add(new SourceFile(name, source, userInput));
        return files.size() - 1;
    }

    public SourceFile fileOrNull(int fileId) {
        if (fileId < 0 || fileId >= files.size()) return null;
        return files.get(fileId);
    }

    public boolean isKnown(int fileId) {
        return fileOrNull(fileId) != null;
    }

    public boolean isUserInput(int fileId) {
        SourceFile file = fileOrNull(fileId);
        return file != null && file.userInput();
    }

    public String fileName(int fileId) {
        SourceFile file = fileOrNull(fileId);
        return file == null ? "<unknown file " + fileId + ">" : file.name();
    }

    public int size() {
        return files.size();
    }
}
