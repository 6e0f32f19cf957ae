package org.bndpack;

import java.util.Objects;

/** A file of the produced archive, fully loaded in memory. */
public final class ArchiveEntry {
	private final String path;
	private final byte[] content;

	public ArchiveEntry(String path, byte[] content) {
		this.path = Objects.requireNonNull(path, "Path cannot be null");
		this.content = Objects.requireNonNull(content, "Content cannot be null").clone();
	}

	/** Path within the archive, '/' separated, without leading '/'. */
	public String getPath() {
		return path;
	}

	public byte[] getContent() {
		return content.clone();
	}

	public int size() {
		return content.length;
	}

	@Override
	public String toString() {
		return path + " (" + content.length + " bytes)";
	}
}
