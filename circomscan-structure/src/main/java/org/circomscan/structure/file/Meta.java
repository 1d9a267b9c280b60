package org.circomscan.structure.file;

/*
source position of an AST node or IR element: the file it was parsed from, and its byte range in that file
 */
public record Meta(int fileId, FileLocation location) {

    public static Meta of(int fileId, int start, int end) {
        return new Meta(fileId, new FileLocation(start, end));
    }

    @Override
    public String toString() {
        return fileId + ":" + location;
    }
}
