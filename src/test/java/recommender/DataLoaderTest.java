package recommender;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;

class DataLoaderTest {

	private static final String CSV = String.join("\n",
			"\"user_id\",\"artistname\",\"trackname\",\"playlistname\"",
			"u1,Artist A,Track 1,pl1",
			"u1,\"Artist, B\",\"Track \"\"2\"\"\",pl1",
			"u2,Artist C,Track 3",
			"u2,Artist C,Track 3,pl,extra",
			"u3,,Track 4,pl2",
			"u4,Back\\slash,Track 5,pl3", "");

	@Test
	void loadsQuotedFields() throws IOException {
		List<Interaction> rows = DataLoader.load(new StringReader(CSV), true);

		assertEquals(5, rows.size());
		assertEquals(new Interaction("u1", "Artist A", "Track 1", "pl1"),
				rows.get(0));
		assertEquals(new Interaction("u1", "Artist, B", "Track \"2\"", "pl1"),
				rows.get(1));
		assertEquals("Back\\slash", rows.get(4).getArtistName());
	}

	@Test
	void missingFieldsBecomeNull() throws IOException {
		List<Interaction> rows = DataLoader.load(new StringReader(CSV), true);

		assertNull(rows.get(2).getPlaylistName());
		assertEquals("Track 3", rows.get(2).getTrackName());
		assertNull(rows.get(3).getArtistName());
	}

	@Test
	void headerIsOptional() throws IOException {
		List<Interaction> rows = DataLoader
				.load(new StringReader("u1,a,t,p\nu2,b,t,p\n"), false);

		assertEquals(2, rows.size());
		assertEquals("u1", rows.get(0).getUserId());
	}

	@Test
	void brokenQuoteOnlySkipsItsLine() throws IOException {
		List<Interaction> rows = DataLoader.load(new StringReader(
				"u1,a,t,p\nu2,\"bad,t,p\nu3,b,t,p\nu4,c,t,p\n"), false);

		assertEquals(3, rows.size());
		assertEquals(new Interaction("u1", "a", "t", "p"), rows.get(0));
		assertEquals(new Interaction("u3", "b", "t", "p"), rows.get(1));
		assertEquals(new Interaction("u4", "c", "t", "p"), rows.get(2));
	}

	@Test
	void parseLine() {
		assertArrayEquals(new String[] { "u1", "a, b", "t", "p" },
				DataLoader.parseLine("u1,\"a, b\",t,p"));
		assertNull(DataLoader.parseLine("u2,\"bad,t,p"));
	}

}
