package recommender;

import java.io.Serializable;
import java.util.Objects;

/**
 * One play record: a user added a track of an artist to a playlist. Fields
 * are null when missing in the source.
 */
public class Interaction implements Serializable {

	private static final long serialVersionUID = -5017623904521781374L;

	private final String userId;
	private final String artistName;
	private final String trackName;
	private final String playlistName;

	public Interaction(final String userIdP, final String artistNameP,
			final String trackNameP, final String playlistNameP) {
		this.userId = userIdP;
		this.artistName = artistNameP;
		this.trackName = trackNameP;
		this.playlistName = playlistNameP;
	}

	public String getArtistName() {
		return this.artistName;
	}

	public String getPlaylistName() {
		return this.playlistName;
	}

	public String getTrackName() {
		return this.trackName;
	}

	public String getUserId() {
		return this.userId;
	}

	public boolean isComplete() {
		return this.userId != null && this.artistName != null
				&& this.trackName != null && this.playlistName != null;
	}

	public Interaction withTrack(final String artistNameP,
			final String trackNameP) {
		if (this.artistName.equals(artistNameP) == true
				&& this.trackName.equals(trackNameP) == true) {
			return this;
		}
		return new Interaction(this.userId, artistNameP, trackNameP,
				this.playlistName);
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj instanceof Interaction == false) {
			return false;
		}
		Interaction other = (Interaction) obj;
		return Objects.equals(this.userId, other.userId)
				&& Objects.equals(this.artistName, other.artistName)
				&& Objects.equals(this.trackName, other.trackName)
				&& Objects.equals(this.playlistName, other.playlistName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.userId, this.artistName, this.trackName,
				this.playlistName);
	}

	@Override
	public String toString() {
		return "[" + this.userId + ", " + this.artistName + ", "
				+ this.trackName + ", " + this.playlistName + "]";
	}

}
