package cal.prim.storage;

import cal.snapfind.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * A strongly-consistent in-memory directory.  Every modification is visible
 * to the next query.  Entries are listed in name order.
 */
public class ConsistentInMemoryDir implements EventuallyConsistentDirectory {

  private final Map<String, byte[]> entries = new TreeMap<>();

  @Override
  public synchronized Stream<String> list() {
    return new ArrayList<>(entries.keySet()).stream();
  }

  @Override
  public void createOrReplace(String name, InputStream stream) throws IOException {
    byte[] data = Util.read(stream);
    synchronized (this) {
      entries.put(name, data);
    }
  }

  public synchronized void createOrReplace(String name, byte[] data) {
    entries.put(name, data.clone());
  }

  @Override
  public InputStream open(String name) throws NoSuchFileException {
    byte[] data;
    synchronized (this) {
      data = entries.get(name);
    }
    if (data == null) {
      throw new NoSuchFileException(name);
    }
    return new ByteArrayInputStream(data);
  }

  @Override
  public synchronized void delete(String name) throws NoSuchFileException {
    if (entries.remove(name) == null) {
      throw new NoSuchFileException(name);
    }
  }

  @Override
  public synchronized String toString() {
    return entries.keySet().toString();
  }

}
