package com.contextsmith.ahocorasick;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
   <p>A single occurrence of an inserted pattern: the pattern itself and the
   span of input positions it occupies, {@code [startIndex, endIndex)}.</p>
 */
public class SearchResult<T> {
  private final List<T> pattern;
  private final int patternIndex;
  private final long endIndex;

  SearchResult(List<T> pattern, int patternIndex, long endIndex) {
    this.pattern = pattern;
    this.patternIndex = patternIndex;
    this.endIndex = endIndex;
  }

  /**
       Returns the matched pattern.  The list is immutable.
   */
  public List<T> getPattern() {
    return this.pattern;
  }

  /**
       Returns the index of the pattern among all distinct patterns, in
       order of first insertion (the first distinct pattern has index 0).
   */
  public int getPatternIndex() {
    return this.patternIndex;
  }

  /**
       Returns the 0-based position of the first symbol of the match.
   */
  public long getStartIndex() {
    return this.endIndex - this.pattern.size();
  }

  /**
       Returns the index where the match terminates.  Note that this
       is one symbol after the last matching symbol.
   */
  public long getEndIndex() {
    return this.endIndex;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof SearchResult)) return false;
    SearchResult<?> other = (SearchResult<?>) obj;
    return this.endIndex == other.endIndex &&
           Objects.equal(this.pattern, other.pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.pattern, this.endIndex);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("pattern", this.pattern)
        .add("start", getStartIndex())
        .add("end", this.endIndex)
        .toString();
  }
}
