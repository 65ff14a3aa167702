package com.contextsmith.ahocorasick.keyword;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.ahocorasick.AhoCorasick;
import com.contextsmith.ahocorasick.SearchResult;
import com.contextsmith.ahocorasick.utils.FileUtil;
import com.contextsmith.ahocorasick.utils.ProcessUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;

/**
 * Finds keywords in text.  A thin layer over {@link AhoCorasick} with
 * characters as symbols; it follows the same add, compile, search lifecycle
 * and throws the same exceptions.
 */
public class KeywordMatcher {
  private static final Logger log = LoggerFactory.getLogger(KeywordMatcher.class);

  private final AhoCorasick<Character> ahoCorasick;
  // Indexed like the automaton's patterns, to avoid rebuilding strings.
  private final List<String> keywords;

  public KeywordMatcher() {
    this.ahoCorasick = new AhoCorasick<>();
    this.keywords = new ArrayList<>();
  }

  public void add(String keyword) {
    checkNotNull(keyword, "Keyword cannot be null");
    int patternCount = this.ahoCorasick.getPatternCount();
    this.ahoCorasick.insert(Lists.charactersOf(keyword));
    if (this.ahoCorasick.getPatternCount() > patternCount) {
      this.keywords.add(keyword);
    }
  }

  public void compile() {
    compile(false);
  }

  public void compile(boolean deterministic) {
    this.ahoCorasick.compile(deterministic);
    log.debug("Compiled {} keywords ({})", size(),
              ProcessUtil.getHeapConsumption());
  }

  public boolean contains(String keyword) {
    if (keyword == null) return false;
    return this.ahoCorasick.contains(Lists.charactersOf(keyword));
  }

  /**
   * Returns every keyword occurrence in the text, overlapping ones
   * included, ordered by end offset.
   */
  public List<KeywordMatch> findAll(CharSequence text) {
    return ImmutableList.copyOf(search(text));
  }

  public boolean hasPrefix(String prefix) {
    if (prefix == null) return false;
    return this.ahoCorasick.hasPrefix(Lists.charactersOf(prefix));
  }

  /**
   * Adds every keyword listed in a dictionary file, see
   * {@link KeywordLineProcessor} for the format.
   *
   * @return the number of keywords read
   */
  public int loadData(String dataPath) throws IOException {
    log.info("Loading keywords from: {}", dataPath);
    int count = FileUtil.findResourceAsCharSource(dataPath)
        .readLines(new KeywordLineProcessor(this));
    log.info("Loaded {} keywords from: {}", count, dataPath);
    return count;
  }

  /**
   * Lazily scans the text.  Characters are read only as matches are
   * requested.
   */
  public Iterator<KeywordMatch> search(CharSequence text) {
    checkNotNull(text, "Text cannot be null");
    Iterator<SearchResult<Character>> iter =
        this.ahoCorasick.search(Lists.charactersOf(text));
    return Iterators.transform(iter, result -> new KeywordMatch(
        this.keywords.get(result.getPatternIndex()),
        (int) result.getStartIndex()));
  }

  /** Returns the number of distinct keywords. */
  public int size() {
    return this.keywords.size();
  }
}
