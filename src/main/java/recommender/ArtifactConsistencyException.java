package recommender;

import java.io.IOException;

/**
 * The cached artifacts are partial, corrupt or come from different builds.
 * The cache has to be rebuilt from the raw data.
 */
public class ArtifactConsistencyException extends IOException {

	private static final long serialVersionUID = -4093121648270591342L;

	public ArtifactConsistencyException(final String message) {
		super(message);
	}

	public ArtifactConsistencyException(final String message,
			final Throwable cause) {
		super(message, cause);
	}

}
