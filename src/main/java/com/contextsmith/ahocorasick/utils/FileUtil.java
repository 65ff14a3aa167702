package com.contextsmith.ahocorasick.utils;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.ByteSource;
import com.google.common.io.CharSource;
import com.google.common.io.Files;
import com.google.common.io.Resources;

public class FileUtil {

  private static final Logger log = LoggerFactory.getLogger(FileUtil.class);

  public static final String COMPRESSED_FILE_RE = ".+?\\.(gz|gzip)";

  /**
   * Looks the file up on the file system first, then on the class path.
   * Compressed files are transparently decompressed.  Content is read as
   * UTF-8.
   *
   * @throws FileNotFoundException if the file can be found in neither place
   */
  public static CharSource findResourceAsCharSource(String filename)
      throws FileNotFoundException {
    return findResourceAsByteSource(filename).asCharSource(StandardCharsets.UTF_8);
  }

  public static ByteSource findResourceAsByteSource(String filename)
      throws FileNotFoundException {
    checkNotNull(filename, "File name cannot be null");
    ByteSource source = null;

    // First, lookup the file directly.
    File f = new File(filename);
    if (f.isFile()) {
      source = Files.asByteSource(f);
    } else {
      // Second, lookup the file in class-path.
      ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
      URL url = classLoader.getResource(filename);
      if (url == null) url = classLoader.getResource(f.getName());
      if (url != null) source = Resources.asByteSource(url);
    }
    if (source == null) {
      throw new FileNotFoundException("Could not locate: " + filename);
    }
    log.debug("Found {} at {}", filename, source);

    // If this is a compressed file, de-compress it.
    return filename.matches(COMPRESSED_FILE_RE) ? gunzip(source) : source;
  }

  private static ByteSource gunzip(final ByteSource compressed) {
    return new ByteSource() {
      @Override
      public InputStream openStream() throws IOException {
        InputStream stream = compressed.openStream();
        try {
          return new GZIPInputStream(stream);
        } catch (IOException e) {
          stream.close();
          throw e;
        }
      }
    };
  }

  private FileUtil() {
  }
}
