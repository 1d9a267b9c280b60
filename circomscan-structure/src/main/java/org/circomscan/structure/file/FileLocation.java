package org.circomscan.structure.file;

/*
byte range [start, end) into the source text of a file
 */
public record FileLocation(int start, int end) {

    public FileLocation {
        if (start < 0 || end < 0) {
            throw new IllegalArgumentException("Negative offset in file location " + start + ".." + end);
        }
    }

    public int length() {
        return end - start;
    }

    public FileLocation union(FileLocation other) {
        return new FileLocation(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
