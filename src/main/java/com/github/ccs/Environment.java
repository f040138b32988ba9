package com.github.ccs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.ccs.CcsException.Code;

/**
 * Immutable mapping from process names to their defining terms, shared read-only by every
 * derivation. Definitions may be mutually recursive.
 *
 * Notes for users:<br>
 * 1. an environment is validated once when it is built: every referenced name must be defined, the
 * anonymous name {@code _} is never referenced and no definition reaches itself without passing
 * through an action prefix. After a successful build, resolution of any name used inside the
 * environment cannot fail and {@link Semantics#step(Process, Environment)} always terminates<br>
 *
 * 2. references are resolved one level at a time by lookup. Nothing is ever inlined, so the
 * environment stays a flat table no matter how the definitions refer to each other<br>
 *
 * 3. the first definition is the distinguished process of a specification<br>
 */
public final class Environment {
  private static final Logger logger = LogManager.getLogger(Environment.class.getSimpleName());

  private static final Environment empty = new Environment(Collections.<Definition>emptyList());

  // in declaration order, anonymous definitions included
  private final List<Definition> declarations;
  // K=process name, V=defining term. Anonymous definitions are not addressable.
  private final Map<String, Process> definitions;

  private Environment(final List<Definition> declarations) {
    this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    final Map<String, Process> named = new LinkedHashMap<>();
    for (final Definition definition : declarations) {
      if (!definition.isAnonymous()) {
        named.put(definition.name, definition.term);
      }
    }
    this.definitions = Collections.unmodifiableMap(named);
  }

  public static Environment empty() {
    return empty;
  }

  /**
   * Look up the defining term of a process name.
   */
  public Process lookup(final String name) throws CcsException {
    final Process term = definitions.get(name);
    if (term == null) {
      if (Process.ANONYMOUS_NAME.equals(name)) {
        throw new CcsException(Code.ANONYMOUS_PROCESS_REFERENCE);
      }
      throw new CcsException(Code.UNDEFINED_PROCESS, "Process " + name + " is not defined");
    }
    return term;
  }

  /**
   * One level of resolution: a reference becomes its defining term, any other term is returned
   * as-is. Callers re-resolve since a defining term may itself be a reference.
   */
  public Process resolve(final Process term) throws CcsException {
    if (term.getKind() == Process.Kind.REFERENCE) {
      return lookup(((Process.Reference) term).getName());
    }
    return term;
  }

  /**
   * Resolve top-level references until the head of the term is a semantic form. Terminates on any
   * built environment because reference-only cycles are rejected as unguarded recursion.
   */
  public Process resolveHead(final Process term) throws CcsException {
    Process resolved = term;
    while (resolved.getKind() == Process.Kind.REFERENCE) {
      resolved = resolve(resolved);
    }
    return resolved;
  }

  /**
   * Check that a term built outside this environment only refers to names defined in it.
   */
  public void validate(final Process term) throws CcsException {
    for (final String name : referencedNames(term, false)) {
      lookup(name);
    }
  }

  public boolean contains(final String name) {
    return definitions.containsKey(name);
  }

  public Set<String> getNames() {
    return definitions.keySet();
  }

  public Map<String, Process> getDefinitions() {
    return definitions;
  }

  public List<Process> getAnonymousDefinitions() {
    final List<Process> anonymous = new ArrayList<>();
    for (final Definition definition : declarations) {
      if (definition.isAnonymous()) {
        anonymous.add(definition.term);
      }
    }
    return anonymous;
  }

  public int size() {
    return declarations.size();
  }

  /**
   * The first definition of the specification: a reference to its name, or the term itself if
   * the first definition is anonymous.
   */
  public Optional<Process> getMainProcess() {
    if (declarations.isEmpty()) {
      return Optional.empty();
    }
    final Definition first = declarations.get(0);
    return Optional.of(first.isAnonymous() ? first.term : Process.reference(first.name));
  }

  /**
   * Union of two specifications, eg. to compare processes defined in different files. The main
   * process of the result is this environment's.
   */
  public Environment merge(final Environment other) throws CcsException {
    final EnvironmentBuilder builder = EnvironmentBuilder.newBuilder();
    for (final Definition definition : declarations) {
      builder.define(definition.name, definition.term);
    }
    for (final Definition definition : other.declarations) {
      builder.define(definition.name, definition.term);
    }
    return builder.build();
  }

  @Override
  public int hashCode() {
    return declarations.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return declarations.equals(((Environment) obj).declarations);
  }

  /**
   * The specification in the input language, one definition per line.
   */
  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    for (final Definition definition : declarations) {
      if (builder.length() > 0) {
        builder.append('\n');
      }
      builder.append(definition.name).append(" = ").append(definition.term);
    }
    return builder.toString();
  }

  private static Set<String> referencedNames(final Process term, final boolean unguardedOnly)
      throws CcsException {
    final Set<String> names = new LinkedHashSet<>();
    term.accept(new ReferenceCollector(names, unguardedOnly));
    return names;
  }

  private static final class Definition {
    private final String name;
    private final Process term;

    private Definition(final String name, final Process term) {
      this.name = name;
      this.term = term;
    }

    private boolean isAnonymous() {
      return Process.ANONYMOUS_NAME.equals(name);
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + term.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Definition)) {
        return false;
      }
      final Definition other = (Definition) obj;
      return name.equals(other.name) && term.equals(other.term);
    }
  }

  /**
   * Collects referenced names. In unguarded mode it stops at action prefixes, which leaves exactly
   * the names a derivation step would have to resolve.
   */
  private static final class ReferenceCollector implements Process.Visitor<Void> {
    private final Set<String> names;
    private final boolean unguardedOnly;

    private ReferenceCollector(final Set<String> names, final boolean unguardedOnly) {
      this.names = names;
      this.unguardedOnly = unguardedOnly;
    }

    @Override
    public Void visitDeadlock(final Process.Deadlock deadlock) {
      return null;
    }

    @Override
    public Void visitPrefix(final Process.Prefix prefix) throws CcsException {
      if (!unguardedOnly) {
        prefix.getContinuation().accept(this);
      }
      return null;
    }

    @Override
    public Void visitChoice(final Process.Choice choice) throws CcsException {
      choice.getLeft().accept(this);
      choice.getRight().accept(this);
      return null;
    }

    @Override
    public Void visitParallel(final Process.Parallel parallel) throws CcsException {
      parallel.getLeft().accept(this);
      parallel.getRight().accept(this);
      return null;
    }

    @Override
    public Void visitRestriction(final Process.Restriction restriction) throws CcsException {
      return restriction.getInner().accept(this);
    }

    @Override
    public Void visitRelabel(final Process.Relabel relabel) throws CcsException {
      return relabel.getInner().accept(this);
    }

    @Override
    public Void visitReference(final Process.Reference reference) {
      names.add(reference.getName());
      return null;
    }
  }

  /**
   * A simple builder to let users use fluent APIs to build environments.
   */
  public final static class EnvironmentBuilder {
    private final List<Definition> declarations = new ArrayList<>();

    public static EnvironmentBuilder newBuilder() {
      return new EnvironmentBuilder();
    }

    public EnvironmentBuilder define(final String name, final Process term) {
      if (!Process.isValidProcessName(name)) {
        throw new IllegalArgumentException("Illegal process name: " + name);
      }
      if (term == null) {
        throw new IllegalArgumentException("Definition of " + name + " cannot be null");
      }
      declarations.add(new Definition(name, term));
      return this;
    }

    public EnvironmentBuilder anonymous(final Process term) {
      return define(Process.ANONYMOUS_NAME, term);
    }

    public Environment build() throws CcsException {
      final Environment environment = new Environment(declarations);
      checkUniqueNames();
      checkReferences(environment);
      checkGuardedness(environment);
      if (logger.isDebugEnabled()) {
        logger.debug("Built environment with " + environment.size() + " definitions");
      }
      return environment;
    }

    private void checkUniqueNames() throws CcsException {
      final Set<String> seen = new LinkedHashSet<>();
      for (final Definition definition : declarations) {
        if (!definition.isAnonymous() && !seen.add(definition.name)) {
          throw new CcsException(Code.OVERLAPPING_PROCESS,
              "Process " + definition.name + " is defined more than once");
        }
      }
    }

    private void checkReferences(final Environment environment) throws CcsException {
      for (final Definition definition : declarations) {
        for (final String name : referencedNames(definition.term, false)) {
          if (Process.ANONYMOUS_NAME.equals(name)) {
            throw new CcsException(Code.ANONYMOUS_PROCESS_REFERENCE,
                "Definition of " + definition.name + " refers to the anonymous process _");
          }
          if (!environment.contains(name)) {
            throw new CcsException(Code.UNDEFINED_PROCESS,
                "Process " + name + " referenced by " + definition.name + " is not defined");
          }
        }
      }
    }

    /**
     * Depth-first search for a cycle in the graph of unguarded references.
     */
    private void checkGuardedness(final Environment environment) throws CcsException {
      final Map<String, Set<String>> unguarded = new HashMap<>();
      for (final Map.Entry<String, Process> entry : environment.definitions.entrySet()) {
        unguarded.put(entry.getKey(), referencedNames(entry.getValue(), true));
      }
      // absent=unvisited, FALSE=on current path, TRUE=done
      final Map<String, Boolean> marks = new HashMap<>();
      for (final String start : unguarded.keySet()) {
        if (marks.containsKey(start)) {
          continue;
        }
        final Deque<String> path = new ArrayDeque<>();
        final Deque<Iterator<String>> pending = new ArrayDeque<>();
        marks.put(start, Boolean.FALSE);
        path.addLast(start);
        pending.addLast(unguarded.get(start).iterator());
        while (!pending.isEmpty()) {
          final Iterator<String> successors = pending.peekLast();
          if (!successors.hasNext()) {
            marks.put(path.removeLast(), Boolean.TRUE);
            pending.removeLast();
            continue;
          }
          final String next = successors.next();
          final Boolean mark = marks.get(next);
          if (mark == null) {
            marks.put(next, Boolean.FALSE);
            path.addLast(next);
            pending.addLast(unguarded.get(next).iterator());
          } else if (!mark) {
            throw new CcsException(Code.UNGUARDED_RECURSION,
                "Unguarded recursion: " + describeCycle(path, next));
          }
        }
      }
    }

    private static String describeCycle(final Deque<String> path, final String repeated) {
      final StringBuilder builder = new StringBuilder();
      boolean inCycle = false;
      for (final String name : path) {
        if (name.equals(repeated)) {
          inCycle = true;
        }
        if (inCycle) {
          builder.append(name).append(" -> ");
        }
      }
      return builder.append(repeated).toString();
    }

    private EnvironmentBuilder() {}
  }

}
