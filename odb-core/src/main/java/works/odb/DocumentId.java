package works.odb;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * The identifier a driver assigns to a document when it is created.
 * Opaque to everything except the driver that issued it.
 */
public final class DocumentId {
	@NotNull
	final String value;

	private DocumentId(@NotNull String value) {
		this.value = value;
	}

	public static DocumentId from(String value) {
		if (value == null) {
			throw new IllegalArgumentException("DocumentId can't be null");
		} else if (value.isEmpty()) {
			throw new IllegalArgumentException("DocumentId can't be empty");
		}
		return new DocumentId(value);
	}

	public static DocumentId from(long value) {
		return new DocumentId(Long.toString(value));
	}

	@Override
	public String toString() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		DocumentId that = (DocumentId) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(value);
	}
}
