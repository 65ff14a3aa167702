package com.contextsmith.ahocorasick.tools;

import static com.contextsmith.ahocorasick.utils.Args.options;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.ahocorasick.keyword.KeywordMatch;
import com.contextsmith.ahocorasick.keyword.KeywordMatcher;
import com.contextsmith.ahocorasick.utils.Args;
import com.contextsmith.ahocorasick.utils.FileUtil;

/**
 * Scans a text file, or lines typed on standard input, for the keywords of
 * a dictionary file and prints every match as
 * {@code <begin>\t<end>\t<keyword>}.
 */
public class AhoCorasickMain {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasickMain.class);

  public static final String USAGE =
      "Usage: AhoCorasickMain --patterns <file> [--text <file>] [--deterministic]";

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_ERROR = 2;

  public static void main(String... args) {
    int status = run(args, System.in, System.out, System.err);
    if (status != EXIT_OK) System.exit(status);
  }

  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    Settings settings = new Settings();
    Args.match()
        .on(options("--patterns", "-p"), value -> settings.patternPath = value)
        .on(options("--text", "-t"), value -> settings.textPath = value)
        .on(options("--deterministic", "-d"), () -> settings.deterministic = true)
        .rest(rest -> settings.unknown = rest)
        .parse(args);

    if (settings.patternPath == null || !settings.unknown.isEmpty()) {
      if (!settings.unknown.isEmpty()) {
        err.println("Unknown arguments: " + settings.unknown);
      }
      err.println(USAGE);
      return EXIT_USAGE;
    }

    try {
      KeywordMatcher matcher = new KeywordMatcher();
      matcher.loadData(settings.patternPath);
      matcher.compile(settings.deterministic);

      if (settings.textPath != null) {
        String text = FileUtil.findResourceAsCharSource(settings.textPath).read();
        int count = printMatches(matcher, text, out);
        out.println("Found " + count + " match(es)!");
      } else {
        interactiveRun(matcher, in, out);
      }
    } catch (IOException e) {
      log.error("Error reading input: {}", e.getMessage());
      err.println(e.getMessage());
      return EXIT_ERROR;
    }
    return EXIT_OK;
  }

  static void interactiveRun(KeywordMatcher matcher, InputStream in,
                             PrintStream out) throws IOException {
    BufferedReader reader = new BufferedReader(
        new InputStreamReader(in, StandardCharsets.UTF_8));
    while (true) {
      out.print("Enter a sentence: ");
      String text = reader.readLine();
      if (text == null || text.isEmpty()) break;
      if ("exit".equalsIgnoreCase(text)) break;
      int count = printMatches(matcher, text, out);
      out.println("Found " + count + " match(es)!");
    }
  }

  static int printMatches(KeywordMatcher matcher, CharSequence text,
                          PrintStream out) {
    int count = 0;
    for (Iterator<KeywordMatch> iter = matcher.search(text); iter.hasNext();) {
      KeywordMatch match = iter.next();
      out.println(match.getBeginOffset() + "\t" + match.getEndOffset() + "\t" +
                  match.getKeyword());
      ++count;
    }
    return count;
  }

  private static class Settings {
    String patternPath;
    String textPath;
    boolean deterministic;
    List<String> unknown;
  }
}
