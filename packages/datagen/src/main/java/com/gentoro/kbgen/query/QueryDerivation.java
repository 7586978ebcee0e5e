package com.gentoro.kbgen.query;

import java.util.List;

/** Sampled facts, ordered by hop then by enumeration order, plus per-hop shortfalls. */
public record QueryDerivation(List<QueryFact> facts, List<Shortfall> shortfalls) {
  public QueryDerivation {
    facts = List.copyOf(facts);
    shortfalls = List.copyOf(shortfalls);
  }

  public List<QueryFact> factsAt(int hop) {
    return facts.stream().filter(f -> f.hopDistance() == hop).toList();
  }
}
