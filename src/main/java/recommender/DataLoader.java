package recommender;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.opencsv.ICSVParser;
import com.opencsv.RFC4180ParserBuilder;

import common.MLTimer;

public class DataLoader {

	// user_id, artist_name, track_name, playlist_name
	public static final int N_FIELDS = 4;

	public static List<Interaction> load(final String dataFile,
			final boolean hasHeader) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(
				Paths.get(dataFile), StandardCharsets.UTF_8)) {
			return load(reader, hasHeader);
		}
	}

	/**
	 * Reads one record per line. A line that can't be parsed, such as one with
	 * an unterminated quote, is skipped on its own and reading goes on with the
	 * next line.
	 */
	public static List<Interaction> load(final Reader reader,
			final boolean hasHeader) throws IOException {
		MLTimer timer = new MLTimer("load");
		timer.tic();

		BufferedReader lineReader;
		if (reader instanceof BufferedReader) {
			lineReader = (BufferedReader) reader;
		} else {
			lineReader = new BufferedReader(reader);
		}

		List<Interaction> interactions = new ArrayList<Interaction>();
		int nSkipped = 0;
		boolean skipHeader = hasHeader;
		String line;
		while ((line = lineReader.readLine()) != null) {
			if (skipHeader == true) {
				skipHeader = false;
				continue;
			}
			if (line.isEmpty() == true) {
				continue;
			}

			String[] split = parseLine(line);
			if (split == null || split.length > N_FIELDS) {
				nSkipped++;
				continue;
			}

			// short rows are padded with missing fields
			interactions.add(new Interaction(field(split, 0), field(split, 1),
					field(split, 2), field(split, 3)));

			if (interactions.size() % 1_000_000 == 0) {
				timer.tocLoop("rows", interactions.size());
			}
		}

		timer.toc(String.format("loaded rows[%d] skipped[%d]",
				interactions.size(), nSkipped));
		return interactions;
	}

	/**
	 * @return the fields of the line, or null if its quoting is broken
	 */
	public static String[] parseLine(final String line) {
		// quotes are doubled inside fields, backslash is a plain character
		ICSVParser parser = new RFC4180ParserBuilder().build();
		try {
			String[] split = parser.parseLineMulti(line);
			if (parser.isPending() == true) {
				// quote still open at the end of the line
				return null;
			}
			return split;

		} catch (IOException e) {
			return null;
		}
	}

	private static String field(final String[] split, final int index) {
		if (index >= split.length) {
			return null;
		}
		String value = split[index];
		if (value == null || value.isEmpty() == true) {
			return null;
		}
		return value;
	}

}
