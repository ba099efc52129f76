package recommender;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import common.MLTimer;

public class DatasetPreparer {

	private static final Pattern NON_KEY_CHARS = Pattern
			.compile("[^A-Za-z0-9äöüÄÖÜß]+");

	private static class TrackKey {
		private final String artist;
		private final String track;

		private TrackKey(final String artistP, final String trackP) {
			this.artist = artistP;
			this.track = trackP;
		}

		@Override
		public boolean equals(final Object obj) {
			if (obj instanceof TrackKey == false) {
				return false;
			}
			TrackKey other = (TrackKey) obj;
			return this.artist.equals(other.artist)
					&& this.track.equals(other.track);
		}

		@Override
		public int hashCode() {
			return 31 * this.artist.hashCode() + this.track.hashCode();
		}
	}

	private static class Spelling {
		private final TrackKey key;
		private final int count;

		private Spelling(final TrackKey keyP, final int countP) {
			this.key = keyP;
			this.count = countP;
		}
	}

	private RecommenderParams params;
	private MLTimer timer;

	public DatasetPreparer(final RecommenderParams paramsP) {
		this.params = paramsP;
		this.timer = new MLTimer("prepare");
	}

	public FilteredDataset prepare(final List<Interaction> raw,
			final String buildId) {
		this.timer.tic();

		List<Interaction> rows = removeIncompleteAndDuplicates(raw);
		this.timer.toc(String.format("complete unique rows[%d] of [%d]",
				rows.size(), raw.size()));

		rows = canonicalizeTracks(rows);
		this.timer.toc(String.format("canonical rows[%d]", rows.size()));

		rows = removeUnpopularArtists(rows, this.params.minArtistRows);
		this.timer.toc(String.format("popular artist rows[%d]", rows.size()));

		rows = removeInactiveUsers(rows, this.params.minUserTracks);
		this.timer.toc(String.format("active user rows[%d]", rows.size()));

		if (this.params.dropUniformPlaylists == true) {
			rows = removeUniformPlaylists(rows,
					this.params.minPlaylistArtists);
			this.timer.toc(
					String.format("varied playlist rows[%d]", rows.size()));
		}

		// canonical spellings can repeat a row, the filters count each copy
		rows = removeDuplicates(rows);
		this.timer.toc(String.format("unique rows[%d]", rows.size()));

		return new FilteredDataset(buildId, rows);
	}

	public static List<Interaction> removeIncompleteAndDuplicates(
			final List<Interaction> raw) {
		List<Interaction> complete = new ArrayList<Interaction>(raw.size());
		for (Interaction interaction : raw) {
			if (interaction.isComplete() == true) {
				complete.add(interaction);
			}
		}
		return removeDuplicates(complete);
	}

	public static List<Interaction> removeDuplicates(
			final List<Interaction> rows) {
		// first occurrence wins, order is kept
		return new ArrayList<Interaction>(
				new LinkedHashSet<Interaction>(rows));
	}

	/**
	 * Replaces every artist/track spelling with the most frequent spelling of
	 * its normalized form. Among equally frequent spellings the one seen first
	 * wins. Every row is kept in place, even when it now repeats another.
	 */
	public static List<Interaction> canonicalizeTracks(
			final List<Interaction> rows) {
		Map<TrackKey, Integer> spellingCounts = new HashMap<TrackKey, Integer>();
		for (Interaction row : rows) {
			spellingCounts.merge(
					new TrackKey(row.getArtistName(), row.getTrackName()), 1,
					Integer::sum);
		}

		Map<TrackKey, Spelling> canonical = new HashMap<TrackKey, Spelling>();
		for (Interaction row : rows) {
			TrackKey spelling = new TrackKey(row.getArtistName(),
					row.getTrackName());
			int count = spellingCounts.get(spelling);
			TrackKey normalized = new TrackKey(normalize(row.getArtistName()),
					normalize(row.getTrackName()));

			Spelling best = canonical.get(normalized);
			if (best == null || count > best.count) {
				canonical.put(normalized, new Spelling(spelling, count));
			}
		}

		List<Interaction> result = new ArrayList<Interaction>(rows.size());
		for (Interaction row : rows) {
			TrackKey normalized = new TrackKey(normalize(row.getArtistName()),
					normalize(row.getTrackName()));
			TrackKey best = canonical.get(normalized).key;
			result.add(row.withTrack(best.artist, best.track));
		}
		return result;
	}

	public static String normalize(final String name) {
		return NON_KEY_CHARS.matcher(name.toLowerCase(Locale.ROOT))
				.replaceAll("");
	}

	public static List<Interaction> removeInactiveUsers(
			final List<Interaction> rows, final int minTracks) {
		Map<String, Set<String>> userTracks = new HashMap<String, Set<String>>();
		for (Interaction row : rows) {
			userTracks.computeIfAbsent(row.getUserId(), k -> new HashSet<String>())
					.add(row.getTrackName());
		}

		List<Interaction> result = new ArrayList<Interaction>();
		for (Interaction row : rows) {
			if (userTracks.get(row.getUserId()).size() > minTracks) {
				result.add(row);
			}
		}
		return result;
	}

	public static List<Interaction> removeUniformPlaylists(
			final List<Interaction> rows, final int minArtists) {
		Map<String, Set<String>> playlistArtists = new HashMap<String, Set<String>>();
		for (Interaction row : rows) {
			playlistArtists
					.computeIfAbsent(row.getPlaylistName(),
							k -> new HashSet<String>())
					.add(row.getArtistName());
		}

		List<Interaction> result = new ArrayList<Interaction>();
		for (Interaction row : rows) {
			if (playlistArtists.get(row.getPlaylistName()).size() > minArtists) {
				result.add(row);
			}
		}
		return result;
	}

	public static List<Interaction> removeUnpopularArtists(
			final List<Interaction> rows, final int minRows) {
		Map<String, Integer> artistCounts = new HashMap<String, Integer>();
		for (Interaction row : rows) {
			artistCounts.merge(row.getArtistName(), 1, Integer::sum);
		}

		List<Interaction> result = new ArrayList<Interaction>();
		for (Interaction row : rows) {
			if (artistCounts.get(row.getArtistName()) > minRows) {
				result.add(row);
			}
		}
		return result;
	}

}
