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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Searches for charge-balanced formulas over three or more elements.
 *
 * The primary search gives every element a single preferred oxidation state (smallest magnitude, positive on ties)
 * and walks atom counts 0..MAX_ATOMS element by element, depth first, pruning partial assignments whose charge can no
 * longer be cancelled by the elements that are left.  If that finds nothing, a pairwise fallback balances every pair
 * of elements on its own, trying all of their oxidation states.
 */
public class MultiElementFormulaSearch {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MultiElementFormulaSearch.class);

  public static final int MAX_ATOMS = 12;
  public static final int MAX_FORMULAS = 50;
  public static final int MAX_FALLBACK_FORMULAS = 10;

  // Above this many candidates there are too many viable stoichiometries to single one out.
  public static final int AMBIGUOUS_CANDIDATE_COUNT = 20;
  public static final double MIXED_CHARACTER_THRESHOLD = 1.5;

  /**
   * @param elements At least two elements in ascending atomic number order.
   * @param classification The bond classification of the set; must have electronegativity data.
   * @return The structural analysis, before any known-compound lookup.
   */
  public CompoundAnalysis search(List<Element> elements, BondClassification classification) {
    BondType bondType = classification.getBondType();
    double difference = classification.getMaxDifference().orElse(0.0);

    List<List<Integer>> nonZeroStates = new ArrayList<>(elements.size());
    List<Element> lacking = new ArrayList<>();
    for (Element element : elements) {
      List<Integer> states = ChargeBalance.nonZeroOxidationStates(element);
      nonZeroStates.add(states);
      if (states.isEmpty()) {
        lacking.add(element);
      }
    }
    if (!lacking.isEmpty()) {
      String rationale = String.format("%s %s non-zero oxidation states needed for compound formation.",
          BondClassifier.joinNames(lacking), lacking.size() == 1 ? "lacks" : "lack");
      return new CompoundAnalysis(Likelihood.UNLIKELY, bondType, Collections.emptyList(), difference, rationale,
          elements, false);
    }

    List<CompoundCandidate> candidates = findPreferredStateFormulas(elements, nonZeroStates);
    if (candidates.isEmpty()) {
      LOGGER.debug("No balanced formulas with preferred oxidation states for %s, trying element pairs",
          ChargeBalance.symbolString(elements));
      candidates = findPairwiseFormulas(elements, nonZeroStates);
    }
    LOGGER.debug("Found %d candidate formulas for %s", candidates.size(), ChargeBalance.symbolString(elements));

    int found = candidates.size();
    String formattedDifference = BondClassifier.formatDifference(difference);
    Likelihood likelihood;
    String rationale;
    if (found == 0) {
      likelihood = Likelihood.UNLIKELY;
      rationale = String.format("Unable to find charge-balanced combinations with available oxidation states " +
          "for %d elements.", elements.size());
    } else if (found > AMBIGUOUS_CANDIDATE_COUNT) {
      likelihood = Likelihood.POSSIBLE_BUT_UNSTABLE;
      rationale = String.format("Found %d possible charge-balanced formulas with max electronegativity difference " +
          "of %s. Multi-element compounds are often complex and may require specific conditions for stability.",
          found, formattedDifference);
    } else if (difference > MIXED_CHARACTER_THRESHOLD) {
      likelihood = Likelihood.POSSIBLE_BUT_UNSTABLE;
      rationale = String.format("Found %d possible formula%s with mixed ionic/covalent character " +
          "(\u0394EN = %s). Complex multi-element compounds may form under specific conditions.",
          found, found > 1 ? "s" : "", formattedDifference);
    } else {
      likelihood = Likelihood.POSSIBLE_BUT_UNSTABLE;
      rationale = String.format("Found %d charge-balanced formula%s with primarily covalent character " +
          "(\u0394EN = %s). Multi-element organic/molecular compounds may be stable but require specific " +
          "structural knowledge.",
          found, found > 1 ? "s" : "", formattedDifference);
    }
    return new CompoundAnalysis(likelihood, bondType, candidates, difference, rationale, elements, false);
  }

  /**
   * Picks the oxidation state with the smallest magnitude, preferring the positive one on a tie.
   */
  static int preferredOxidationState(List<Integer> nonZeroStates) {
    int preferred = nonZeroStates.get(0);
    for (Integer state : nonZeroStates) {
      int magnitude = Math.abs(state);
      int preferredMagnitude = Math.abs(preferred);
      if (magnitude < preferredMagnitude || (magnitude == preferredMagnitude && state > preferred)) {
        preferred = state;
      }
    }
    return preferred;
  }

  List<CompoundCandidate> findPreferredStateFormulas(List<Element> elements, List<List<Integer>> nonZeroStates) {
    int[] preferred = new int[elements.size()];
    for (int i = 0; i < elements.size(); i++) {
      preferred[i] = preferredOxidationState(nonZeroStates.get(i));
    }

    // maxCorrection[i] bounds how much charge elements i..n-1 can still cancel.
    int[] maxCorrection = new int[elements.size() + 1];
    for (int i = elements.size() - 1; i >= 0; i--) {
      int largestMagnitude = 0;
      for (int j = i; j < elements.size(); j++) {
        largestMagnitude = Math.max(largestMagnitude, Math.abs(preferred[j]));
      }
      maxCorrection[i] = (elements.size() - i) * MAX_ATOMS * largestMagnitude;
    }

    List<CompoundCandidate> results = new ArrayList<>();
    extendAssignment(elements, preferred, maxCorrection, 0, new int[elements.size()], 0, results);
    return results;
  }

  private void extendAssignment(List<Element> elements, int[] preferred, int[] maxCorrection, int index,
                                int[] counts, int charge, List<CompoundCandidate> results) {
    if (results.size() >= MAX_FORMULAS) {
      return;
    }

    if (index == elements.size()) {
      if (charge == 0 && countNonZero(counts) >= 2) {
        results.add(ChargeBalance.toCandidate(elements, counts, preferred));
      }
      return;
    }

    boolean last = index == elements.size() - 1;
    for (int count = 0; count <= MAX_ATOMS && results.size() < MAX_FORMULAS; count++) {
      int newCharge = charge + preferred[index] * count;
      if (last ? newCharge == 0 : Math.abs(newCharge) <= maxCorrection[index + 1]) {
        counts[index] = count;
        extendAssignment(elements, preferred, maxCorrection, index + 1, counts, newCharge, results);
      }
    }
    counts[index] = 0;
  }

  List<CompoundCandidate> findPairwiseFormulas(List<Element> elements, List<List<Integer>> nonZeroStates) {
    List<CompoundCandidate> results = new ArrayList<>();
    for (int i = 0; i < elements.size() - 1; i++) {
      for (int j = i + 1; j < elements.size(); j++) {
        for (Integer stateI : nonZeroStates.get(i)) {
          for (Integer stateJ : nonZeroStates.get(j)) {
            if (results.size() >= MAX_FALLBACK_FORMULAS) {
              return results;
            }
            if (!ChargeBalance.haveOppositeSigns(stateI, stateJ)) {
              continue;
            }
            int[] subscripts = ChargeBalance.balancedSubscripts(stateI, stateJ);
            int[] counts = new int[elements.size()];
            int[] states = new int[elements.size()];
            counts[i] = subscripts[0];
            counts[j] = subscripts[1];
            states[i] = stateI;
            states[j] = stateJ;
            results.add(ChargeBalance.toCandidate(elements, counts, states));
          }
        }
      }
    }
    return results;
  }

  private static int countNonZero(int[] counts) {
    int nonZero = 0;
    for (int count : counts) {
      if (count > 0) {
        nonZero++;
      }
    }
    return nonZero;
  }
}
