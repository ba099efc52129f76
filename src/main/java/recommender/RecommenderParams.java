package recommender;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import net.minidev.json.JSONObject;
import net.minidev.json.parser.JSONParser;
import net.minidev.json.parser.ParseException;

public class RecommenderParams {

	public static final String DEFAULT_RESOURCE = "/recommender.json";

	// raw csv with user_id, artist_name, track_name, playlist_name
	public String dataFile = "./data/spotify_dataset.csv";
	public String cachePath = "./data/cache";
	public boolean hasHeader = true;

	// rows per artist must be strictly above this
	public int minArtistRows = 100;
	// distinct track names per user must be strictly above this
	public int minUserTracks = 100;
	public boolean dropUniformPlaylists = false;
	// distinct artists per playlist name must be strictly above this
	public int minPlaylistArtists = 10;

	public int nRecommendations = 10;
	public int nNeighbors = 10;

	@Override
	public String toString() {
		StringBuilder result = new StringBuilder();
		String newLine = System.getProperty("line.separator");

		result.append(this.getClass().getName());
		result.append(" {");
		result.append(newLine);

		for (Field field : this.getClass().getDeclaredFields()) {
			if (Modifier.isStatic(field.getModifiers())) {
				continue;
			}
			result.append("  ");
			result.append(field.getName());
			result.append(": ");
			try {
				result.append(field.get(this));
			} catch (IllegalAccessException ex) {
				result.append("?");
			}
			result.append(newLine);
		}
		result.append("}");

		return result.toString();
	}

	public static RecommenderParams fromFile(final String paramsFile)
			throws IOException {
		try (Reader reader = Files.newBufferedReader(Paths.get(paramsFile),
				StandardCharsets.UTF_8)) {
			return fromReader(reader, paramsFile);
		}
	}

	public static RecommenderParams fromResource(final String resource)
			throws IOException {
		InputStream stream = RecommenderParams.class
				.getResourceAsStream(resource);
		if (stream == null) {
			throw new IOException("resource doesn't exist " + resource);
		}
		try (Reader reader = new InputStreamReader(stream,
				StandardCharsets.UTF_8)) {
			return fromReader(reader, resource);
		}
	}

	public static RecommenderParams fromJSON(final JSONObject obj) {
		RecommenderParams params = new RecommenderParams();

		if (obj.containsKey("dataFile") == true) {
			params.dataFile = getString(obj, "dataFile");
		}
		if (obj.containsKey("cachePath") == true) {
			params.cachePath = getString(obj, "cachePath");
		}
		if (obj.containsKey("hasHeader") == true) {
			params.hasHeader = getBoolean(obj, "hasHeader");
		}
		if (obj.containsKey("minArtistRows") == true) {
			params.minArtistRows = getInt(obj, "minArtistRows");
		}
		if (obj.containsKey("minUserTracks") == true) {
			params.minUserTracks = getInt(obj, "minUserTracks");
		}
		if (obj.containsKey("dropUniformPlaylists") == true) {
			params.dropUniformPlaylists = getBoolean(obj,
					"dropUniformPlaylists");
		}
		if (obj.containsKey("minPlaylistArtists") == true) {
			params.minPlaylistArtists = getInt(obj, "minPlaylistArtists");
		}
		if (obj.containsKey("nRecommendations") == true) {
			params.nRecommendations = getInt(obj, "nRecommendations");
		}
		if (obj.containsKey("nNeighbors") == true) {
			params.nNeighbors = getInt(obj, "nNeighbors");
		}

		if (params.nRecommendations < 0 || params.nNeighbors < 0) {
			throw new IllegalArgumentException(
					"nRecommendations and nNeighbors must be >= 0");
		}
		return params;
	}

	private static RecommenderParams fromReader(final Reader reader,
			final String source) throws IOException {
		Object parsed;
		try {
			parsed = new JSONParser(JSONParser.MODE_RFC4627).parse(reader);
		} catch (ParseException e) {
			throw new IOException("failed to parse params " + source, e);
		}
		if (parsed instanceof JSONObject == false) {
			throw new IOException("params must be a json object " + source);
		}
		return fromJSON((JSONObject) parsed);
	}

	private static boolean getBoolean(final JSONObject obj, final String key) {
		Object value = obj.get(key);
		if (value instanceof Boolean == false) {
			throw new IllegalArgumentException(
					key + " must be a boolean, got " + value);
		}
		return (Boolean) value;
	}

	private static int getInt(final JSONObject obj, final String key) {
		Object value = obj.get(key);
		if (value instanceof Number == false) {
			throw new IllegalArgumentException(
					key + " must be a number, got " + value);
		}
		return ((Number) value).intValue();
	}

	private static String getString(final JSONObject obj, final String key) {
		Object value = obj.get(key);
		if (value instanceof String == false) {
			throw new IllegalArgumentException(
					key + " must be a string, got " + value);
		}
		return (String) value;
	}

}
