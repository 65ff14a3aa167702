package com.contextsmith.ahocorasick.keyword;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A keyword found in a text, spanning {@code [beginOffset, endOffset)}.
 */
public class KeywordMatch {
  private final String keyword;
  private final int beginOffset;

  public KeywordMatch(String keyword, int beginOffset) {
    this.keyword = keyword;
    this.beginOffset = beginOffset;
  }

  public int getBeginOffset() {
    return this.beginOffset;
  }

  public int getEndOffset() {
    return this.beginOffset + this.keyword.length();
  }

  public String getKeyword() {
    return this.keyword;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof KeywordMatch)) return false;
    KeywordMatch other = (KeywordMatch) obj;
    return this.beginOffset == other.beginOffset &&
           Objects.equal(this.keyword, other.keyword);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.keyword, this.beginOffset);
  }

  public String toDebugString() {
    return String.format("[%d,%d) %s", this.beginOffset, getEndOffset(),
                         this.keyword);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("keyword", this.keyword)
        .add("begin", this.beginOffset)
        .add("end", getEndOffset())
        .toString();
  }
}
