package cal.prim.storage;

import cal.snapfind.Util;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * A directory on the local filesystem.  Only regular files directly inside
 * the directory are entries; subdirectories and temporary files are ignored.
 */
public class LocalDirectory implements EventuallyConsistentDirectory {

  private static final String TMP_SUFFIX = ".tmp";

  private final Path dir;

  /**
   * @param dir an existing directory
   * @throws NoSuchFileException if <code>dir</code> does not exist
   * @throws NotDirectoryException if <code>dir</code> is not a directory
   */
  public LocalDirectory(Path dir) throws IOException {
    if (!Files.exists(dir)) {
      throw new NoSuchFileException(dir.toString());
    }
    if (!Files.isDirectory(dir)) {
      throw new NotDirectoryException(dir.toString());
    }
    this.dir = dir;
  }

  @Override
  public Stream<String> list() throws IOException {
    List<String> result;
    try (Stream<Path> entries = Files.list(dir)) {
      result = entries
          .filter(Files::isRegularFile)
          .map(p -> p.getFileName().toString())
          .filter(name -> !name.endsWith(TMP_SUFFIX))
          .toList();
    }
    return result.stream();
  }

  @Override
  public void createOrReplace(String name, InputStream data) throws IOException {
    Path tmp = Files.createTempFile(dir, name, TMP_SUFFIX);
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
        Util.copyStream(data, out);
      }
      Files.move(tmp, dir.resolve(name), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  @Override
  public InputStream open(String name) throws IOException {
    return Files.newInputStream(dir.resolve(name));
  }

  @Override
  public void delete(String name) throws IOException {
    Files.delete(dir.resolve(name));
  }

  @Override
  public String toString() {
    return dir.toString();
  }

}
