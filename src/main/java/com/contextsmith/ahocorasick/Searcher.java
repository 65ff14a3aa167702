package com.contextsmith.ahocorasick;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
   Iterator over the matches of a compiled automaton in a sequence of
   symbols.  Symbols are pulled from the input only when the next match is
   requested, so the input may be unbounded.  Not thread-safe; every search
   gets its own Searcher.
 */
public class Searcher<T> implements Iterator<SearchResult<T>> {
  private static final int[] EMPTY_INTS = new int[0];

  private final AhoCorasick<T> automaton;
  private final Iterator<? extends T> symbols;

  private int state;
  private long position;  // Number of symbols consumed so far.
  private int[] pendingOutputs;
  private int pendingIndex;

  Searcher(AhoCorasick<T> automaton, Iterator<? extends T> symbols) {
    this.automaton = automaton;
    this.symbols = symbols;
    this.state = TransitionTable.ROOT;
    this.position = 0;
    this.pendingOutputs = EMPTY_INTS;
    this.pendingIndex = 0;
  }

  /**
   * Returns the number of input symbols consumed so far.
   */
  public long getPosition() {
    return this.position;
  }

  @Override
  public boolean hasNext() {
    // Consume symbols until some pattern ends at the current position.
    while (this.pendingIndex >= this.pendingOutputs.length) {
      if (!this.symbols.hasNext()) return false;
      T symbol = this.symbols.next();
      ++this.position;
      this.state = this.automaton.nextState(this.state, symbol);
      this.pendingOutputs = this.automaton.getOutputs(this.state);
      this.pendingIndex = 0;
    }
    return true;
  }

  @Override
  public SearchResult<T> next() {
    if (!hasNext()) throw new NoSuchElementException();
    int patternIndex = this.pendingOutputs[this.pendingIndex++];
    return new SearchResult<>(this.automaton.getPattern(patternIndex),
                              patternIndex, this.position);
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }
}
