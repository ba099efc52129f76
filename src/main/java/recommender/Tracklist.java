package recommender;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Distinct artist/track pairs sorted by artist name, used to populate a
 * selection list. The order here is unrelated to the matrix artist index.
 */
public class Tracklist implements Serializable {

	public static class Entry implements Serializable {

		private static final long serialVersionUID = -1482311805617004317L;
		private final String artistName;
		private final String trackName;
		private final String fullName;

		public Entry(final String artistNameP, final String trackNameP) {
			this.artistName = artistNameP;
			this.trackName = trackNameP;
			this.fullName = artistNameP + " - " + trackNameP;
		}

		public String getArtistName() {
			return this.artistName;
		}

		public String getFullName() {
			return this.fullName;
		}

		public String getTrackName() {
			return this.trackName;
		}

		@Override
		public boolean equals(final Object obj) {
			if (this == obj) {
				return true;
			}
			if (obj instanceof Entry == false) {
				return false;
			}
			Entry other = (Entry) obj;
			return this.artistName.equals(other.artistName)
					&& this.trackName.equals(other.trackName);
		}

		@Override
		public int hashCode() {
			return 31 * this.artistName.hashCode() + this.trackName.hashCode();
		}

		@Override
		public String toString() {
			return this.fullName;
		}
	}

	private static final long serialVersionUID = -7706010949466521903L;

	private final String buildId;
	private final Entry[] entries;

	public Tracklist(final String buildIdP, final List<Entry> entriesP) {
		this.buildId = buildIdP;
		this.entries = entriesP.toArray(new Entry[0]);
	}

	/**
	 * Maps selected display names back to artist names. Artists are returned
	 * in tracklist order, once per selected track, so an artist with two
	 * selected tracks appears twice. Unknown display names are ignored.
	 */
	public List<String> getArtistNames(final Collection<String> fullNames) {
		Set<String> selected = new HashSet<String>(fullNames);
		List<String> artistNames = new ArrayList<String>();
		for (Entry entry : this.entries) {
			if (selected.contains(entry.getFullName()) == true) {
				artistNames.add(entry.getArtistName());
			}
		}
		return artistNames;
	}

	public String getBuildId() {
		return this.buildId;
	}

	public Entry getEntry(final int index) {
		return this.entries[index];
	}

	/**
	 * Distinct display names in tracklist order.
	 */
	public List<String> getFullNames() {
		Set<String> seen = new HashSet<String>();
		List<String> fullNames = new ArrayList<String>(this.entries.length);
		for (Entry entry : this.entries) {
			if (seen.add(entry.getFullName()) == true) {
				fullNames.add(entry.getFullName());
			}
		}
		return fullNames;
	}

	public int size() {
		return this.entries.length;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof Tracklist == false) {
			return false;
		}
		Tracklist other = (Tracklist) obj;
		return this.buildId.equals(other.buildId)
				&& Arrays.equals(this.entries, other.entries);
	}

	@Override
	public int hashCode() {
		return 31 * this.buildId.hashCode() + Arrays.hashCode(this.entries);
	}

}
