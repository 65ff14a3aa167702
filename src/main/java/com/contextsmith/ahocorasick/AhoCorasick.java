package com.contextsmith.ahocorasick;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.contextsmith.ahocorasick.TransitionTable.NO_STATE;
import static com.contextsmith.ahocorasick.TransitionTable.ROOT;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

/**
   <p>An implementation of the Aho-Corasick string searching
   automaton.  This implementation of the <a
   href="http://portal.acm.org/citation.cfm?id=360855&dl=ACM&coll=GUIDE"
   target="_blank">Aho-Corasick</a> algorithm is generic over the symbol
   type: anything with consistent {@code equals} and {@code hashCode} can be
   used, characters being the most common case.</p>

   <p>The automaton goes through three phases, strictly in order: patterns
   are inserted with {@link #insert}, the automaton is compiled once with
   {@link #compile(boolean)}, then it can be searched any number of times
   with {@link #search}.  A compiled automaton is immutable and may be
   searched from several threads at once.</p>

   <p>Two compiled forms are available.  The default one keeps only the trie
   transitions and follows failure links while matching.  The deterministic
   one adds, for every state, a direct transition for every symbol seen in
   any pattern, so that each input symbol costs exactly one lookup.  This
   can add up to (number of states) x (alphabet size) transitions and should
   be avoided for large alphabets; {@link #getTransitionCount()} reports the
   actual cost.  Both forms report exactly the same matches.</p>

   <p>
   Example usage:
   <code><pre>
       AhoCorasick&lt;Character&gt; tree = new AhoCorasick&lt;&gt;();
       tree.insert(Lists.charactersOf("he"));
       tree.insert(Lists.charactersOf("she"));
       tree.compile();

       Iterator&lt;SearchResult&lt;Character&gt;&gt; searcher =
           tree.search(Lists.charactersOf("ushers"));
       while (searcher.hasNext()) {
           SearchResult&lt;Character&gt; result = searcher.next();
           System.out.println(result.getPattern());
           System.out.println("Found at index: " + result.getStartIndex());
       }
   </pre></code>
   </p>
 */
public class AhoCorasick<T> {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasick.class);

  public static <T> AhoCorasick<T> create() {
    return new AhoCorasick<>();
  }

  private final TransitionTable<T> transitions;
  private final OutputTable outputs;
  private final List<ImmutableList<T>> patterns;
  private final Map<List<T>, Integer> patternIndices;

  // Symbols of the trie edges leaving each state.  Only needed until the
  // automaton is compiled.
  private List<Set<T>> alphabets;
  // Null once compiled in deterministic mode.
  private int[] failures;
  private boolean isDeterministic;
  private volatile boolean isBuilt;

  public AhoCorasick() {
    this.transitions = new TransitionTable<>();
    this.outputs = new OutputTable();
    this.patterns = new ArrayList<>();
    this.patternIndices = new HashMap<>();
    this.alphabets = new ArrayList<>();
    this.failures = null;
    this.isDeterministic = false;
    this.isBuilt = false;
  }

  /**
   * Adds a new pattern.  During search, every occurrence of the pattern
   * is yielded as a {@link SearchResult}.  Inserting the same pattern twice
   * has no further effect.
   *
   * @throws AlreadyBuiltException if the automaton is already compiled
   * @throws EmptyPatternException if the pattern has no symbol
   * @throws NullPointerException if the pattern or one of its symbols is null
   */
  public void insert(Iterable<? extends T> pattern) {
    checkNotNull(pattern, "Pattern cannot be null");
    if (this.isBuilt) throw new AlreadyBuiltException(
        "Can't insert patterns after compile() is called.");

    ImmutableList<T> symbols = ImmutableList.copyOf(pattern);
    int state = ROOT;
    for (T symbol : symbols) {
      getOrCreateAlphabet(state).add(symbol);
      state = this.transitions.getOrCreate(state, symbol);
    }
    if (state == ROOT) throw new EmptyPatternException(
        "Can't insert an empty pattern.");

    this.outputs.add(state, intern(symbols));
  }

  /**
   * Same as {@link #insert(Iterable)}.
   */
  @SafeVarargs
  public final void insert(T... pattern) {
    checkNotNull(pattern, "Pattern cannot be null");
    insert(ImmutableList.copyOf(pattern));
  }

  /**
   * Compiles the automaton with failure links only.
   */
  public void compile() {
    compile(false);
  }

  /**
   * Prepares the automaton for searching.  This must be called exactly
   * once, after all patterns are inserted and before any search.
   *
   * DANGER DANGER: dense algorithm code ahead.  Very order
   * dependent.  States are visited breadth-first, so the failure link and
   * the output set of every shallower state are final by the time a state
   * reads them.
   *
   * @param deterministic whether to add a direct transition for every
   *     (state, symbol) pair, trading memory for matching speed
   * @throws AlreadyBuiltException if the automaton is already compiled
   */
  public void compile(boolean deterministic) {
    if (this.isBuilt) throw new AlreadyBuiltException(
        "compile() can only be called once.");
    Stopwatch stopwatch = Stopwatch.createStarted();

    int[] failures = new int[this.transitions.getStateCount()];
    Queue<Integer> queue = new ArrayDeque<>();
    for (T symbol : getAlphabet(ROOT)) {
      int state = this.transitions.get(ROOT, symbol);
      failures[state] = ROOT;
      queue.add(state);
    }

    while (!queue.isEmpty()) {
      int currState = queue.remove();

      for (T symbol : getAlphabet(currState)) {
        int nextState = this.transitions.get(currState, symbol);
        queue.add(nextState);

        // This is probably where most time is consumed in this method.
        int failState = failures[currState];
        while (failState != ROOT &&
               !this.transitions.contains(failState, symbol)) {
          failState = failures[failState];
        }
        int nextStateFail = this.transitions.get(failState, symbol);
        if (nextStateFail == NO_STATE) nextStateFail = ROOT;

        failures[nextState] = nextStateFail;
        this.outputs.addAll(nextState, this.outputs.get(nextStateFail));
      }

      if (deterministic) closeTransitions(currState, failures);
    }

    this.alphabets = null;
    this.outputs.freeze();
    this.failures = deterministic ? null : failures;
    this.isDeterministic = deterministic;
    this.isBuilt = true;

    log.info("Compiled {} automaton with {} patterns, {} states and {} "
             + "transitions in {}", deterministic ? "deterministic" : "failure-link",
             this.patterns.size(), this.transitions.getStateCount(),
             this.transitions.getTransitionCount(), stopwatch);
  }

  /**
   * Starts a new search over the given symbols.  Symbols never seen in a
   * pattern are allowed; no match goes through them.
   *
   * @throws NotBuiltException if the automaton is not compiled yet
   */
  public Searcher<T> search(Iterable<? extends T> text) {
    checkNotNull(text, "Text cannot be null");
    return search(text.iterator());
  }

  /**
   * Starts a new search, pulling symbols from the iterator only as matches
   * are requested.
   *
   * @throws NotBuiltException if the automaton is not compiled yet
   */
  public Searcher<T> search(Iterator<? extends T> text) {
    checkNotNull(text, "Text cannot be null");
    if (!this.isBuilt) throw new NotBuiltException(
        "Can't start search until compile() is called.");
    return new Searcher<>(this, text);
  }

  /**
   * Returns true if the symbols are a prefix of one of the patterns.  The
   * empty sequence is a prefix of everything.
   */
  public boolean hasPrefix(Iterable<? extends T> symbols) {
    return walkTrie(symbols) != NO_STATE;
  }

  /**
   * Returns true if exactly this pattern was inserted.
   */
  public boolean contains(Iterable<? extends T> pattern) {
    int state = walkTrie(pattern);
    if (state == NO_STATE || state == ROOT) return false;
    int depth = this.transitions.getDepth(state);
    for (int index : this.outputs.get(state)) {
      // Inherited outputs are always shorter than the state's own pattern.
      if (this.patterns.get(index).size() == depth) return true;
    }
    return false;
  }

  public int getPatternCount() {
    return this.patterns.size();
  }

  public int getStateCount() {
    return this.transitions.getStateCount();
  }

  /**
   * Returns the number of stored transitions, including the ones added by
   * a deterministic compilation.
   */
  public int getTransitionCount() {
    return this.transitions.getTransitionCount();
  }

  public boolean isBuilt() {
    return this.isBuilt;
  }

  public boolean isDeterministic() {
    return this.isDeterministic;
  }

  int nextState(int state, T symbol) {
    int next;
    if (this.isDeterministic) {
      next = this.transitions.get(state, symbol);
    } else {
      while ((next = this.transitions.get(state, symbol)) == NO_STATE &&
             state != ROOT) {
        state = this.failures[state];
      }
    }
    return next == NO_STATE ? ROOT : next;
  }

  int[] getOutputs(int state) {
    return this.outputs.get(state);
  }

  ImmutableList<T> getPattern(int index) {
    return this.patterns.get(index);
  }

  /**
   * Copies, for every symbol known along the failure chain of the state,
   * the transition of the deepest state in the chain that has one.
   */
  private void closeTransitions(int state, int[] failures) {
    int failState = failures[state];
    while (true) {
      for (T symbol : getAlphabet(failState)) {
        if (!this.transitions.contains(state, symbol)) {
          this.transitions.put(state, symbol,
                               this.transitions.get(failState, symbol));
        }
      }
      if (failState == ROOT) break;
      failState = failures[failState];
    }
  }

  private Set<T> getAlphabet(int state) {
    if (state >= this.alphabets.size()) return Collections.emptySet();
    Set<T> alphabet = this.alphabets.get(state);
    return alphabet == null ? Collections.<T>emptySet() : alphabet;
  }

  private Set<T> getOrCreateAlphabet(int state) {
    while (this.alphabets.size() <= state) this.alphabets.add(null);
    Set<T> alphabet = this.alphabets.get(state);
    if (alphabet == null) {
      alphabet = new LinkedHashSet<>();
      this.alphabets.set(state, alphabet);
    }
    return alphabet;
  }

  private int intern(ImmutableList<T> pattern) {
    Integer index = this.patternIndices.get(pattern);
    if (index == null) {
      index = this.patterns.size();
      this.patterns.add(pattern);
      this.patternIndices.put(pattern, index);
    }
    return index;
  }

  /**
   * Follows trie edges only and returns the state reached, or NO_STATE.
   * Edges added by a deterministic compilation never go one level deeper,
   * which is how they are told apart.
   */
  private int walkTrie(Iterable<? extends T> symbols) {
    checkNotNull(symbols, "Symbols cannot be null");
    int state = ROOT;
    for (T symbol : symbols) {
      int next = this.transitions.get(state, symbol);
      if (next == NO_STATE ||
          this.transitions.getDepth(next) != this.transitions.getDepth(state) + 1) {
        return NO_STATE;
      }
      state = next;
    }
    return state;
  }
}
