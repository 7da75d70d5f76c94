package com.nana.ingest.util;

import java.time.Instant;
import java.util.Objects;

/**
 * Name, size, MIME type and modification time of a file offered for import.
 */
public final class FileMetadata {

    private final String  name;
    private final long    size;
    private final String  mimeType;
    private final Instant lastModified;

    /**
     * @param name         file name, without directory; must not be null
     * @param size         size in bytes
     * @param mimeType     detected MIME type; null is stored as ""
     * @param lastModified last modification time; may be null if unknown
     */
    public FileMetadata(String name, long size, String mimeType, Instant lastModified) {
        this.name         = Objects.requireNonNull(name, "name");
        this.size         = size;
        this.mimeType     = mimeType == null ? "" : mimeType;
        this.lastModified = lastModified;
    }

    public String getName()          { return name; }
    public long getSize()            { return size; }
    public String getMimeType()      { return mimeType; }
    public Instant getLastModified() { return lastModified; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileMetadata)) return false;
        FileMetadata that = (FileMetadata) o;
        return size == that.size
                && name.equals(that.name)
                && mimeType.equals(that.mimeType)
                && Objects.equals(lastModified, that.lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, mimeType, lastModified);
    }

    @Override
    public String toString() {
        return "FileMetadata{name='" + name + "', size=" + size
               + ", mimeType='" + mimeType + "'}";
    }
}
