package dev.xmlforge.source;

/** How an input location is enumerated, resolved once when the location is opened. */
public enum SourceKind {
  /** A single XML document. */
  FILE,
  /** A directory scanned with a glob pattern, optionally recursively. */
  DIRECTORY,
  /** A ZIP archive whose XML entries are read in archive order. */
  ARCHIVE
}
