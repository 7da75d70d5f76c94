package com.nana.ingest.util;

import java.util.Objects;

/**
 * The decoded text of an accepted file together with its metadata.
 */
public final class LoadedFile {

    private final String       content;
    private final FileMetadata metadata;

    public LoadedFile(String content, FileMetadata metadata) {
        this.content  = Objects.requireNonNull(content, "content");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public String getContent() {
        return content;
    }

    public FileMetadata getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "LoadedFile{" + metadata + ", chars=" + content.length() + "}";
    }
}
