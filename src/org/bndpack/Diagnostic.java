package org.bndpack;

import java.util.Objects;

/** A message emitted by the build engine, with its classification. */
public final class Diagnostic {
	/** Whether the build can still produce its archive. */
	public enum Severity {
		/** Reported, the archive is still produced. */
		ADVISORY,
		/** Aborts the build, no archive is written. */
		FATAL;
	}

	/** How the build engine itself reported the message. */
	public enum Kind {
		WARNING, ERROR, EXCEPTION;
	}

	private final Severity severity;
	private final Kind kind;
	private final String message;

	public Diagnostic(Severity severity, Kind kind, String message) {
		this.severity = Objects.requireNonNull(severity);
		this.kind = Objects.requireNonNull(kind);
		this.message = Objects.requireNonNull(message);
	}

	public Severity getSeverity() {
		return severity;
	}

	public Kind getKind() {
		return kind;
	}

	public String getMessage() {
		return message;
	}

	public boolean isFatal() {
		return severity == Severity.FATAL;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Diagnostic))
			return false;
		Diagnostic other = (Diagnostic) obj;
		return severity == other.severity && kind == other.kind && message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(severity, kind, message);
	}

	@Override
	public String toString() {
		return severity + " (" + kind.name().toLowerCase() + "): " + message;
	}
}
