package com.contextsmith.daac.utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;
import java.util.zip.GZIPInputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.io.CharSource;

public class FileUtil {

  static final Logger log = LogManager.getLogger(FileUtil.class);

  public static final String COMPRESSED_FILE_RE = ".+?\\.(gz|gzip)";

  /**
   * Opens the named file as UTF-8 text, looking on the file system first and
   * then on the class path. Gzip files are decompressed on the fly.
   */
  public static CharSource findResourceAsCharSource(final String filename) {
    return new CharSource() {
      @Override
      public Reader openStream() throws IOException {
        InputStream stream = findResourceAsStream(filename);
        if (stream == null) {
          throw new FileNotFoundException("Could not locate: " + filename);
        }
        return new BufferedReader(new InputStreamReader(stream,
                                  StandardCharsets.UTF_8));
      }
    };
  }

  /** Returns null if the file is neither on the file system nor the class path. */
  public static InputStream findResourceAsStream(String filename)
      throws IOException {
    InputStream stream = null;

    // First, lookup the file directly.
    File f = new File(filename);
    if (f.isFile()) {
      stream = new FileInputStream(f);
    }
    if (stream == null) {
      // Second, lookup the file in class-path.
      ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
      stream = classLoader.getResourceAsStream(filename);
    }
    if (stream == null) {
      log.debug("Could not locate: {}", filename);
      return null;
    }
    // If this is a compressed file, de-compress it.
    if (filename.matches(COMPRESSED_FILE_RE)) {
      try {
        stream = new GZIPInputStream(stream);
      } catch (IOException e) {
        stream.close();
        throw e;
      }
    }
    return stream;
  }

  public static String getReadableFileSize(String filePath) {
    long size = new File(filePath).length();
    if (size < 1024) return size + " B";
    int exp = (int) (Math.log(size) / Math.log(1024));
    return String.format(Locale.ROOT, "%.1f %sB", size / Math.pow(1024, exp), "KMGTPE".charAt(exp - 1));
  }

  /**
   * Loads the named properties file. A missing file yields empty properties;
   * an unreadable one is an error.
   */
  public static Properties loadProperties(String filename) {
    Properties prop = new Properties();
    try (InputStream stream = findResourceAsStream(filename)) {
      if (stream == null) {
        log.warn("Could not find '{}', using built-in defaults", filename);
        return prop;
      }
      prop.load(stream);
    } catch (IOException e) {
      log.error("Error reading file: {}", filename);
      throw new UncheckedIOException(e);
    }
    return prop;
  }

  private FileUtil() {
  }
}
