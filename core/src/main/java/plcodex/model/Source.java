//
// PLCodex - a framework for grokking PLC code
// http://github.com/scaled/codex/blob/master/LICENSE

package plcodex.model;

/**
 * Defines the different places from which source comes.
 */
public abstract class Source {

  /** Models a source file in the file system. */
  public static class File extends Source {

    /** The path to the source file. */
    public final String path;

    public File (String path) {
      this.path = path;
    }

    @Override public boolean equals (Object other) {
      return (other instanceof File) && path.equals(((File)other).path);
    }
    @Override public int hashCode () {
      return path.hashCode();
    }
    @Override public String toString () {
      return path;
    }

    @Override protected String path () {
      return path;
    }
    @Override protected char pathSeparator () {
      return java.io.File.separatorChar;
    }
  }

  /** Models a unit declared inside a project container (a project or solution file). */
  public static class Item extends Source {

    /** The path to the container which declares the unit. */
    public final String containerPath;

    /** The path (or name) of the unit, relative to its container. */
    public final String itemPath;

    public Item (String containerPath, String itemPath) {
      this.containerPath = containerPath;
      this.itemPath = itemPath;
    }

    @Override public boolean equals (Object other) {
      return ((other instanceof Item) &&
              containerPath.equals(((Item)other).containerPath) &&
              itemPath.equals(((Item)other).itemPath));
    }
    @Override public int hashCode () {
      return containerPath.hashCode() ^ itemPath.hashCode();
    }
    @Override public String toString () {
      return containerPath + "!" + itemPath;
    }

    @Override protected String path () {
      return itemPath;
    }
    @Override protected char pathSeparator () {
      return '/'; // item paths are normalized to '/'
    }
  }

  /**
   * Creates a source from the supplied string representation. {@code string} should be the result
   * of calling {@link Source#toString} on an existing source.
   */
  public static Source fromString (String string) {
    int eidx = string.indexOf('!');
    if (eidx == -1) return new File(string);
    else return new Item(string.substring(0, eidx), string.substring(eidx+1));
  }

  /** Returns the name of the file represented by this source. */
  public String fileName () {
    String path = path();
    return path.substring(path.lastIndexOf(pathSeparator())+1);
  }

  /** Returns the extension of the file represented by this source, or "" if it has none. */
  public String fileExt () {
    String path = path();
    int didx = path.lastIndexOf('.');
    return (didx == -1) ? "" : path.substring(didx+1);
  }

  protected abstract String path ();
  protected abstract char pathSeparator ();

  private Source () {} // seal it!
}
