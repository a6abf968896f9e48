package dpdc.tool.support;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.supercsv.prefs.CsvPreference.STANDARD_PREFERENCE;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;

import dpdc.tool.domain.Row;
import dpdc.tool.domain.Table;

/**
 * Persist tables so that a partially written file is never visible under its
 * final name.
 *
 * <p>
 * Content is written to a new temporary file in the destination directory,
 * which is then renamed over the destination. If anything fails before the
 * rename, the temporary file is deleted and any existing destination is left
 * untouched.
 * </p>
 *
 * <p>
 * On POSIX file systems the destination keeps the permissions of the file it
 * replaces, and a new destination gets {@link #DEFAULT_PERMISSIONS}.
 * </p>
 */
public class AtomicTableWriter {

	private static final Logger log = LoggerFactory.getLogger(AtomicTableWriter.class);

	/** The temporary file suffix. */
	public static final String TEMP_SUFFIX = ".tmp";

	/** The permissions given to new files on POSIX file systems. */
	public static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

	/**
	 * Write a table, with the key column first.
	 *
	 * @param destination the destination path
	 * @param table       the table to write
	 * @throws IOException if any IO error occurs
	 */
	public void write(Path destination, Table table) throws IOException {
		final Iterable<List<String>> rows = () -> new TableRowIterator(table);
		write(destination, table.schema().header(), rows);
	}

	/**
	 * Write a header and rows.
	 *
	 * @param destination the destination path
	 * @param header      the header names
	 * @param rows        the rows; every row should have as many values as
	 *                    {@code header}
	 * @throws IOException if any IO error occurs
	 */
	public void write(Path destination, List<String> header, Iterable<? extends List<?>> rows) throws IOException {
		commit(destination, temp -> {
			try (ICsvListWriter csv = new CsvListWriter(Files.newBufferedWriter(temp, UTF_8), STANDARD_PREFERENCE)) {
				csv.writeHeader(header.toArray(String[]::new));
				for (List<?> row : rows) {
					csv.write(row);
				}
			}
		});
	}

	/**
	 * Copy a file to a destination.
	 *
	 * @param source      the file to copy
	 * @param destination the destination path
	 * @throws IOException if any IO error occurs
	 */
	public void copy(Path source, Path destination) throws IOException {
		commit(destination, temp -> {
			try (InputStream in = Files.newInputStream(source)) {
				Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
			}
		});
	}

	/**
	 * API for producing the content of a temporary file.
	 */
	@FunctionalInterface
	public interface ContentWriter {

		/**
		 * Write the content.
		 *
		 * @param temp the temporary file to write to
		 * @throws IOException if any IO error occurs
		 */
		void writeTo(Path temp) throws IOException;

	}

	/**
	 * Produce content in a temporary file, then rename it to the destination.
	 *
	 * @param destination the destination path
	 * @param content     the content producer
	 * @throws IOException if any IO error occurs
	 */
	public void commit(Path destination, ContentWriter content) throws IOException {
		final Path target = destination.toAbsolutePath();
		final Path dir = target.getParent();
		final Path temp = Files.createTempFile(dir, "." + target.getFileName() + ".", TEMP_SUFFIX);
		try {
			content.writeTo(temp);
			applyPermissions(temp, target);
			move(temp, target);
		} catch (IOException | RuntimeException e) {
			try {
				Files.deleteIfExists(temp);
			} catch (IOException e2) {
				e.addSuppressed(e2);
			}
			throw e;
		}
		log.debug("Committed {}", target);
	}

	private static void applyPermissions(Path temp, Path target) throws IOException {
		if (!temp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
			return;
		}
		final Set<PosixFilePermission> perms = (Files.exists(target) ? Files.getPosixFilePermissions(target)
				: DEFAULT_PERMISSIONS);
		Files.setPosixFilePermissions(temp, perms);
	}

	private static void move(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException e) {
			log.warn("Atomic rename not supported for {}; replacing non-atomically", target);
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static final class TableRowIterator implements Iterator<List<String>> {

		private final Iterator<Map.Entry<String, Row>> delegate;

		private TableRowIterator(Table table) {
			super();
			this.delegate = table.entries().iterator();
		}

		@Override
		public boolean hasNext() {
			return delegate.hasNext();
		}

		@Override
		public List<String> next() {
			Map.Entry<String, Row> e = delegate.next();
			var result = new ArrayList<String>(e.getValue().values().size() + 1);
			result.add(e.getKey());
			result.addAll(e.getValue().values());
			return result;
		}

	}

}
