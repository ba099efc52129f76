package recommender;

/**
 * A selected artist name is not part of the artist index of the build.
 */
public class UnknownArtistException extends IllegalArgumentException {

	private static final long serialVersionUID = 6190473366251735021L;
	private final String artistName;

	public UnknownArtistException(final String artistNameP) {
		super("artist not in index: " + artistNameP);
		this.artistName = artistNameP;
	}

	public String getArtistName() {
		return this.artistName;
	}

}
