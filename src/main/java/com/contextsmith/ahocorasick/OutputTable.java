package com.contextsmith.ahocorasick;

import static com.google.common.base.Preconditions.checkState;

import java.util.Arrays;

/**
 * Maps a state to the set of pattern indices recognized in that state.
 * Sets only grow until {@link #freeze()} is called; afterwards the table is
 * read-only.
 */
class OutputTable {
  private static final int[] EMPTY_INTS = new int[0];

  // Here's an inlined set of ints per state, backed by an array of ints:
  // null when empty
  // an Integer when size 1
  // an int[] when size > 1 (always an int[] once frozen)
  private Object[] outputs;
  private boolean isFrozen;

  OutputTable() {
    this.outputs = new Object[16];
    this.isFrozen = false;
  }

  void add(int state, int value) {
    checkState(!this.isFrozen, "Output table is frozen.");
    ensureCapacity(state + 1);

    Object current = this.outputs[state];
    if (current == null) {
      this.outputs[state] = value;
    } else if (current instanceof Integer) {
      int v = ((Integer) current).intValue();
      if (value != v) {
        this.outputs[state] = new int[] {v, value};
      }
    } else {
      int[] values = (int[]) current;
      for (int v : values) {
        if (v == value) return;
      }
      int[] newValues = Arrays.copyOf(values, values.length + 1);
      newValues[newValues.length - 1] = value;
      this.outputs[state] = newValues;
    }
  }

  void addAll(int state, int[] values) {
    for (int value : values) {
      add(state, value);
    }
  }

  /**
   * Returns the pattern indices of the state, in insertion order.  The
   * returned array must not be modified.
   */
  int[] get(int state) {
    if (state >= this.outputs.length) return EMPTY_INTS;
    Object current = this.outputs[state];
    if (current == null) {
      return EMPTY_INTS;
    } else if (current instanceof Integer) {
      return new int[] { ((Integer) current).intValue() };
    } else {
      return (int[]) current;
    }
  }

  /**
   * Makes the table read-only and normalizes every set to an array, so that
   * lookups no longer allocate.
   */
  void freeze() {
    for (int i = 0; i < this.outputs.length; ++i) {
      if (this.outputs[i] instanceof Integer) {
        this.outputs[i] = new int[] { ((Integer) this.outputs[i]).intValue() };
      }
    }
    this.isFrozen = true;
  }

  boolean isFrozen() {
    return this.isFrozen;
  }

  private void ensureCapacity(int size) {
    if (size <= this.outputs.length) return;
    this.outputs = Arrays.copyOf(this.outputs,
                                 Math.max(size, this.outputs.length * 2));
  }
}
