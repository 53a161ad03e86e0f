/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.elements.analysis;

import com.elements.periodic.Element;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The result of analyzing a set of elements: a likelihood verdict, the predicted bond type, the candidate formulas
 * and a narrative explaining the verdict.  Instances are immutable.
 */
@JsonAutoDetect(
    fieldVisibility = JsonAutoDetect.Visibility.NONE,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE
)
public class CompoundAnalysis {

  public static final int MAX_SURFACED_CANDIDATES = 20;

  @JsonProperty("likelihood")
  private Likelihood likelihood;

  @JsonProperty("bond_type")
  private BondType bondType;

  @JsonProperty("candidates")
  private List<CompoundCandidate> candidates;

  @JsonProperty("electronegativity_difference")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private Double electronegativityDifference;

  @JsonProperty("rationale")
  private String rationale;

  @JsonProperty("user_specified")
  private boolean userSpecified;

  private List<Element> elements;

  /**
   * @param elements The analyzed elements, already in ascending atomic number order.
   * @param candidates Candidate formulas; only the first MAX_SURFACED_CANDIDATES are kept.
   * @param electronegativityDifference The max pairwise electronegativity difference, or null if unknown.
   */
  public CompoundAnalysis(Likelihood likelihood, BondType bondType, List<CompoundCandidate> candidates,
                          Double electronegativityDifference, String rationale, List<Element> elements,
                          boolean userSpecified) {
    this.likelihood = likelihood;
    this.bondType = bondType;
    List<CompoundCandidate> surfaced = candidates.size() > MAX_SURFACED_CANDIDATES ?
        candidates.subList(0, MAX_SURFACED_CANDIDATES) : candidates;
    this.candidates = Collections.unmodifiableList(new ArrayList<>(surfaced));
    this.electronegativityDifference = electronegativityDifference;
    this.rationale = rationale;
    this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    this.userSpecified = userSpecified;
  }

  public Likelihood getLikelihood() {
    return likelihood;
  }

  public BondType getBondType() {
    return bondType;
  }

  public List<CompoundCandidate> getCandidates() {
    return candidates;
  }

  public Optional<Double> getElectronegativityDifference() {
    return Optional.ofNullable(electronegativityDifference);
  }

  public String getRationale() {
    return rationale;
  }

  public List<Element> getElements() {
    return elements;
  }

  @JsonProperty("elements")
  public List<String> getElementSymbols() {
    List<String> symbols = new ArrayList<>(elements.size());
    for (Element element : elements) {
      symbols.add(element.getSymbol());
    }
    return symbols;
  }

  public boolean isUserSpecified() {
    return userSpecified;
  }

  /**
   * Returns a copy of this analysis backed by a known-compound description: the verdict is raised to LIKELY and the
   * description is put in front of the existing rationale.  This never lowers the verdict.
   * @param description The known-compound sentence.
   * @return The strengthened analysis.
   */
  public CompoundAnalysis withKnownCompound(String description) {
    String combined = rationale == null || rationale.isEmpty() ? description : description + " " + rationale;
    return new CompoundAnalysis(Likelihood.strongest(likelihood, Likelihood.LIKELY), bondType, candidates,
        electronegativityDifference, combined, elements, userSpecified);
  }

  @Override
  public String toString() {
    return String.format("%s %s (%s): %s", getElementSymbols(), likelihood.getLabel(), bondType.getLabel(), rationale);
  }
}
