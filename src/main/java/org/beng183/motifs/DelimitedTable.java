package org.beng183.motifs;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A comma- or tab-separated file read eagerly into memory: a header and its data rows.
 * Fields may be double-quoted; a doubled quote inside a quoted field is a literal quote.
 * @author dmyersturnbull
 */
public final class DelimitedTable {

	/**
	 * A data row and its 1-based line number in the file.
	 */
	public static final class Row {

		private final int lineNumber;
		private final String[] fields;

		Row(int lineNumber, String[] fields) {
			this.lineNumber = lineNumber;
			this.fields = fields;
		}

		public int getLineNumber() {
			return lineNumber;
		}

		/**
		 * @return The trimmed field at {@code index}, or null if the row is too short
		 */
		public String get(int index) {
			if (index < 0 || index >= fields.length) return null;
			return fields[index].trim();
		}

		public int size() {
			return fields.length;
		}
	}

	private final File file;
	private final char delimiter;
	private final List<String> header;
	private final Map<String, Integer> columns;
	private final List<Row> rows;

	private DelimitedTable(File file, char delimiter, List<String> header, List<Row> rows) {
		this.file = file;
		this.delimiter = delimiter;
		this.header = Collections.unmodifiableList(header);
		this.rows = Collections.unmodifiableList(rows);
		this.columns = new HashMap<>();
		for (int i = 0; i < header.size(); i++) {
			String key = header.get(i).trim().toLowerCase(Locale.ROOT);
			if (!columns.containsKey(key)) columns.put(key, i);
		}
	}

	/**
	 * Reads a file with a fixed delimiter.
	 */
	public static DelimitedTable read(File file, char delimiter) throws LoadException {
		return read(file, delimiter, false);
	}

	/**
	 * Reads a file, using a tab delimiter if the header line contains a tab and a comma otherwise.
	 */
	public static DelimitedTable readDetectingDelimiter(File file) throws LoadException {
		return read(file, ',', true);
	}

	private static DelimitedTable read(File file, char defaultDelimiter, boolean detect) throws LoadException {
		List<String> lines = readLines(file);
		int headerIndex = 0;
		while (headerIndex < lines.size() && lines.get(headerIndex).trim().isEmpty()) headerIndex++;
		if (headerIndex == lines.size()) throw new MalformedDataException("File " + file + " has no header");
		String headerLine = lines.get(headerIndex);
		char delimiter = defaultDelimiter;
		if (detect) delimiter = headerLine.indexOf('\t') >= 0 ? '\t' : ',';
		List<String> header = new ArrayList<>();
		for (String name : split(headerLine, delimiter)) header.add(name.trim());
		List<Row> rows = new ArrayList<>();
		for (int i = headerIndex + 1; i < lines.size(); i++) {
			String line = lines.get(i);
			if (line.trim().isEmpty()) continue;
			rows.add(new Row(i + 1, split(line, delimiter)));
		}
		return new DelimitedTable(file, delimiter, header, rows);
	}

	/**
	 * Reads every line of a file, requiring valid UTF-8. A leading byte-order mark is dropped.
	 */
	static List<String> readLines(File file) throws LoadException {
		List<String> lines = new ArrayList<>();
		try (BufferedReader br = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8.newDecoder()))) {
			String line = "";
			while ((line = br.readLine()) != null) {
				if (lines.isEmpty() && !line.isEmpty() && line.charAt(0) == '\uFEFF') line = line.substring(1);
				lines.add(line);
			}
		} catch (FileNotFoundException e) {
			throw new NotFoundException("File " + file + " does not exist", e);
		} catch (CharacterCodingException e) {
			throw new MalformedDataException("File " + file + " is not valid UTF-8", e);
		} catch (IOException e) {
			throw new UnavailableException("Couldn't read file " + file, e);
		}
		return lines;
	}

	/**
	 * Splits one line on {@code delimiter}, honoring double quotes.
	 */
	static String[] split(String line, char delimiter) {
		List<String> fields = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < line.length(); i++) {
			char c = line.charAt(i);
			if (quoted) {
				if (c == '"') {
					if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
						current.append('"');
						i++;
					} else {
						quoted = false;
					}
				} else {
					current.append(c);
				}
			} else if (c == '"') {
				quoted = true;
			} else if (c == delimiter) {
				fields.add(current.toString());
				current.setLength(0);
			} else {
				current.append(c);
			}
		}
		fields.add(current.toString());
		return fields.toArray(new String[fields.size()]);
	}

	/**
	 * @return The index of the first column whose name matches one of {@code names} (ignoring case), or -1
	 */
	public int findColumn(String... names) {
		for (String name : names) {
			Integer index = columns.get(name.toLowerCase(Locale.ROOT));
			if (index != null) return index;
		}
		return -1;
	}

	/**
	 * Like {@link #findColumn(String...)}, but fails the whole file if the column is absent.
	 */
	public int requireColumn(String... names) throws MalformedDataException {
		int index = findColumn(names);
		if (index < 0) {
			throw new MalformedDataException("File " + file + " is missing required column " + names[0] + " in header " + header);
		}
		return index;
	}

	public File getFile() {
		return file;
	}

	public char getDelimiter() {
		return delimiter;
	}

	public List<String> getHeader() {
		return header;
	}

	public List<Row> getRows() {
		return rows;
	}

}
