package my.loancalculator.app.service;

import java.util.Locale;

public enum ExportFormat {
	CSV("text/csv", "csv"),
	JSON("application/json", "json");

	private final String contentType;
	private final String extension;

	ExportFormat(String contentType, String extension) {
		this.contentType = contentType;
		this.extension = extension;
	}

	public String contentType() {
		return contentType;
	}

	public String extension() {
		return extension;
	}

	public static ExportFormat from(String value) {
		if (value == null || value.isBlank()) {
			return CSV;
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unsupported export format: " + value + " (expected csv or json)", ex);
		}
	}
}
