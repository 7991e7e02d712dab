package com.capsulo.cms.model.git;

/**
 * A blob placed at a path inside a new tree. Always written as a regular file.
 */
public record TreeEntry(String path, String blobSha) {
    public static final String MODE_REGULAR_FILE = "100644";
}
