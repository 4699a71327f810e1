package gdreader.util;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SourceLocationTest {

	// "var x" on the second line of "a\nvar x = 1"
	private final SourceLocation location = new SourceLocation(2, 7, 1, 1, 0, 5);

	@Test
	public void testContains() {
		assertTrue(location.contains(1, 0));
		assertTrue(location.contains(1, 4));
		assertFalse(location.contains(1, 5));
		assertFalse(location.contains(0, 1));
		assertFalse(SourceLocation.unknown().contains(0, 0));
	}

	@Test
	public void testInsideAndOverlaps() {
		assertTrue(location.isInside(1, 0, 1, 10));
		assertFalse(location.isInside(1, 1, 1, 10));
		assertTrue(location.overlaps(1, 4, 2, 0));
		assertFalse(location.overlaps(1, 5, 2, 0));
	}

	@Test
	public void testCombine() {
		SourceLocation other = new SourceLocation(8, 9, 1, 1, 6, 7);
		SourceLocation combined = location.combine(other);
		assertThat(combined.getStartOffset(), is(2));
		assertThat(combined.getEndOffset(), is(9));
		assertThat(combined.getEndColumn(), is(7));
		assertThat(SourceLocation.unknown().combine(location), is(location));
	}

	@Test
	public void testPrettyString() {
		assertThat(location.prettyString("a\nvar x = 1"), is("at 2:1-5\nvar x = 1\n^^^^^"));
		assertThat(location.prettyString(null), is("at 2:1-5"));
	}
}
