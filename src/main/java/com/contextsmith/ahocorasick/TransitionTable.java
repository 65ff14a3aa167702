package com.contextsmith.ahocorasick;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a (state, symbol) pair to a destination state.  States are plain
 * integers handed out by this table, starting with {@link #ROOT}.
 */
class TransitionTable<T> {
  static final int ROOT = 0;
  static final int NO_STATE = -1;

  // One map per state, indexed by state id.  Null while the state has no
  // outgoing transition, which is the case for most leaves.
  private final List<Map<T, Integer>> stateMaps;
  // Trie depth of every state, used to tell trie edges from closure edges.
  private int[] depths;
  private int transitionCount;

  TransitionTable() {
    this.stateMaps = new ArrayList<>();
    this.depths = new int[16];
    this.transitionCount = 0;
    this.stateMaps.add(null);  // The root.
  }

  /**
   * Returns the destination of (state, symbol), allocating a fresh state
   * one level deeper than {@code state} when the transition does not exist.
   */
  int getOrCreate(int state, T symbol) {
    int next = get(state, symbol);
    if (next != NO_STATE) return next;

    next = this.stateMaps.size();
    this.stateMaps.add(null);
    if (next == this.depths.length) {
      this.depths = Arrays.copyOf(this.depths, this.depths.length * 2);
    }
    this.depths[next] = this.depths[state] + 1;
    put(state, symbol, next);
    return next;
  }

  /** Returns the destination of (state, symbol), or {@link #NO_STATE}. */
  int get(int state, T symbol) {
    Map<T, Integer> map = this.stateMaps.get(state);
    if (map == null) return NO_STATE;
    Integer next = map.get(symbol);
    return next == null ? NO_STATE : next;
  }

  boolean contains(int state, T symbol) {
    Map<T, Integer> map = this.stateMaps.get(state);
    return map != null && map.containsKey(symbol);
  }

  void put(int state, T symbol, int target) {
    Map<T, Integer> map = this.stateMaps.get(state);
    if (map == null) {
      map = new HashMap<>(4);
      this.stateMaps.set(state, map);
    }
    if (map.put(symbol, target) == null) ++this.transitionCount;
  }

  int getDepth(int state) {
    return this.depths[state];
  }

  int getStateCount() {
    return this.stateMaps.size();
  }

  int getTransitionCount() {
    return this.transitionCount;
  }
}
