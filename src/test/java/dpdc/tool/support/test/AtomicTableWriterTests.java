package dpdc.tool.support.test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.BDDAssertions.then;
import static org.assertj.core.api.BDDAssertions.thenThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dpdc.tool.domain.KeyedRow;
import dpdc.tool.domain.Schema;
import dpdc.tool.domain.Table;
import dpdc.tool.support.AtomicTableWriter;

/**
 * Test cases for the {@link AtomicTableWriter} class.
 */
public class AtomicTableWriterTests {

	@TempDir
	Path dir;

	private final AtomicTableWriter writer = new AtomicTableWriter();

	private static Table table(String load) {
		return Table.fromRecords(Schema.of("load"), List.of(new KeyedRow("2024-01-01 00:00:00+06:00", List.of(load))));
	}

	private List<Path> listing() throws IOException {
		try (Stream<Path> s = Files.list(dir)) {
			return s.toList();
		}
	}

	@Test
	public void write() throws IOException {
		// GIVEN
		Path dest = dir.resolve("out.csv");

		// WHEN
		writer.write(dest, table("1.5"));

		// THEN
		then(Files.readAllLines(dest, UTF_8)).containsExactly("date_time,load", "2024-01-01 00:00:00+06:00,1.5");
		then(listing()).as("No temporary files remain").containsExactly(dest);
	}

	@Test
	public void write_replace() throws IOException {
		// GIVEN
		Path dest = dir.resolve("out.csv");
		writer.write(dest, table("1"));

		// WHEN
		writer.write(dest, table("2"));

		// THEN
		then(Files.readAllLines(dest, UTF_8)).containsExactly("date_time,load", "2024-01-01 00:00:00+06:00,2");
	}

	@Test
	public void commit_failureKeepsOriginal() throws IOException {
		// GIVEN
		Path dest = dir.resolve("out.csv");
		Files.writeString(dest, "original", UTF_8);

		// WHEN
		thenThrownBy(() -> writer.commit(dest, temp -> {
			Files.writeString(temp, "partial", UTF_8);
			throw new IOException("boom");
		})).isInstanceOf(IOException.class).hasMessage("boom");

		// THEN
		then(Files.readString(dest, UTF_8)).as("Destination untouched").isEqualTo("original");
		then(listing()).as("Temporary file removed").containsExactly(dest);
	}

	@Test
	public void commit_failureLeavesNoDestination() throws IOException {
		// GIVEN
		Path dest = dir.resolve("out.csv");

		// WHEN
		thenThrownBy(() -> writer.commit(dest, temp -> {
			throw new IllegalStateException("boom");
		})).isInstanceOf(IllegalStateException.class);

		// THEN
		then(dest).doesNotExist();
		then(listing()).isEmpty();
	}

	@Test
	public void copy() throws IOException {
		// GIVEN
		Path src = Files.writeString(dir.resolve("src.csv"), "a,b\r\n1,2\r\n", UTF_8);
		Path dest = dir.resolve("dest.csv");

		// WHEN
		writer.copy(src, dest);

		// THEN
		then(Files.readAllBytes(dest)).isEqualTo(Files.readAllBytes(src));
	}

	private void assumePosix() {
		assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"), "POSIX file system");
	}

	@Test
	public void write_newFilePermissions() throws IOException {
		// GIVEN
		assumePosix();
		Path dest = dir.resolve("out.csv");

		// WHEN
		writer.write(dest, table("1"));

		// THEN
		then(Files.getPosixFilePermissions(dest)).as("Readable beyond the owner")
				.isEqualTo(AtomicTableWriter.DEFAULT_PERMISSIONS);
	}

	@Test
	public void write_replaceKeepsPermissions() throws IOException {
		// GIVEN
		assumePosix();
		Path dest = Files.writeString(dir.resolve("out.csv"), "old", UTF_8);
		Files.setPosixFilePermissions(dest, PosixFilePermissions.fromString("rw-rw----"));

		// WHEN
		writer.write(dest, table("2"));

		// THEN
		then(Files.readString(dest, UTF_8)).contains("2024-01-01 00:00:00+06:00,2");
		then(PosixFilePermissions.toString(Files.getPosixFilePermissions(dest))).isEqualTo("rw-rw----");
	}

}
