package com.novelforge.models;

/**
 * A file inside a project folder, relative to the folder root.
 */
public class ProjectFile {
    private final String path;
    private final long size;
    private final String modified;

    public ProjectFile(String path, long size, String modified) {
        this.path = path;
        this.size = size;
        this.modified = modified;
    }

    public String getPath() {
        return path;
    }

    public long getSize() {
        return size;
    }

    public String getModified() {
        return modified;
    }
}
