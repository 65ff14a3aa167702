package com.contextsmith.ahocorasick.keyword;

import java.io.IOException;
import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.ahocorasick.utils.ProcessUtil;
import com.google.common.base.Splitter;
import com.google.common.io.LineProcessor;

/**
 * Adds one keyword per dictionary line to a {@link KeywordMatcher}.
 * Lines are trimmed, blank lines and lines starting with '#' are skipped,
 * and only the first tab-separated column is used.
 */
public class KeywordLineProcessor implements LineProcessor<Integer> {
  private static final Logger log = LoggerFactory.getLogger(KeywordLineProcessor.class);

  public static final String COMMENT_PREFIX = "#";
  public static final int PROGRESS_INTERVAL = 10000;

  private static final Splitter COLUMN_SPLITTER = Splitter.on('\t').trimResults();

  private final KeywordMatcher matcher;
  private int count;

  public KeywordLineProcessor(KeywordMatcher matcher) {
    this.matcher = matcher;
    this.count = 0;
  }

  @Override
  public Integer getResult() {
    return this.count;
  }

  @Override
  public boolean processLine(String line) throws IOException {
    line = line.trim();
    if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) return true;

    Iterator<String> columns = COLUMN_SPLITTER.split(line).iterator();
    String keyword = columns.next();
    if (keyword.isEmpty()) return true;  // No keyword? Invalid entry.

    this.matcher.add(keyword);
    if (++this.count % PROGRESS_INTERVAL == 0) {
      log.info("{}. {}, Storing: {}", this.count,
               ProcessUtil.getHeapConsumption(), keyword);
    }
    return true;
  }
}
