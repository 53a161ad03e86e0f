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

import com.elements.formula.CompoundFormula;
import com.elements.periodic.Element;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Judges a formula whose atom counts were chosen by the user.  No formulas are searched for; the question is only
 * whether some choice of one oxidation state per element makes the user's counts charge-neutral.
 */
public class UserFormulaValidator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(UserFormulaValidator.class);

  private BondClassifier bondClassifier;

  public UserFormulaValidator(BondClassifier bondClassifier) {
    this.bondClassifier = bondClassifier;
  }

  /**
   * @param elements All analyzed elements, in ascending atomic number order.
   * @param counts Positive atom counts for the elements in the user's formula.
   * @return The analysis of the user's formula.
   */
  public CompoundAnalysis validate(List<Element> elements, Map<Element, Integer> counts) {
    CompoundFormula formula = new CompoundFormula(counts);
    String userFormula = formula.toString();
    List<Element> formulaElements = new ArrayList<>(formula.getElementCounts().keySet());
    CompoundCandidate unassigned = CompoundCandidate.unassigned(userFormula);

    List<Element> nobleGases = BondClassifier.findNobleGases(formulaElements);
    if (!nobleGases.isEmpty()) {
      return new CompoundAnalysis(Likelihood.UNLIKELY, BondType.NONE, Collections.singletonList(unassigned), null,
          BondClassifier.describeNobleGases(nobleGases), elements, true);
    }

    BondClassification classification = bondClassifier.classify(formulaElements);
    if (!classification.hasSufficientData()) {
      String rationale = String.format("Insufficient electronegativity data available for complete analysis of " +
          "your formula %s.", userFormula);
      return new CompoundAnalysis(Likelihood.POSSIBLE_BUT_UNSTABLE, BondType.UNKNOWN,
          Collections.singletonList(unassigned), null, rationale, elements, true);
    }

    BondType bondType = classification.getBondType();
    double difference = classification.getMaxDifference().orElse(0.0);
    String formattedDifference = BondClassifier.formatDifference(difference);

    List<Integer> counted = new ArrayList<>(formulaElements.size());
    List<List<Integer>> states = new ArrayList<>(formulaElements.size());
    boolean allHaveStates = true;
    for (Element element : formulaElements) {
      counted.add(formula.getElementCount(element));
      List<Integer> elementStates = ChargeBalance.nonZeroOxidationStates(element);
      states.add(elementStates);
      allHaveStates &= !elementStates.isEmpty();
    }

    Optional<List<OxidationAssignment>> balance = Optional.empty();
    String imbalanceReason;
    if (allHaveStates) {
      balance = findBalance(formulaElements, counted, states, 0, 0, new ArrayList<>());
      imbalanceReason = "Could not find oxidation states that balance the total charge to zero.";
    } else {
      imbalanceReason = "Some elements lack defined oxidation states.";
    }

    if (!balance.isPresent()) {
      LOGGER.debug("User formula %s does not balance: %s", userFormula, imbalanceReason);
      String rationale = String.format("Your formula %s does not achieve perfect charge balance with common " +
          "oxidation states. %s The compound may still exist but could be unstable or require unusual bonding.",
          userFormula, imbalanceReason);
      return new CompoundAnalysis(Likelihood.POSSIBLE_BUT_UNSTABLE, bondType, Collections.singletonList(unassigned),
          difference, rationale, elements, true);
    }

    CompoundCandidate candidate = new CompoundCandidate(userFormula, balance.get());
    Optional<String> knownCompound = KnownCompounds.lookupFormula(formula);
    Likelihood likelihood;
    String rationale;
    if (knownCompound.isPresent()) {
      likelihood = Likelihood.LIKELY;
      rationale = String.format("Your formula %s is charge-balanced and matches known stable compound patterns. %s",
          userFormula, knownCompound.get());
    } else if (bondType == BondType.IONIC && difference > BondClassifier.IONIC_THRESHOLD) {
      likelihood = Likelihood.LIKELY;
      rationale = String.format("Your formula %s is charge-balanced with strong ionic character (\u0394EN = %s). " +
          "This suggests a stable ionic compound.", userFormula, formattedDifference);
    } else if (difference > BondClassifier.POLAR_THRESHOLD) {
      likelihood = Likelihood.LIKELY;
      rationale = String.format("Your formula %s is charge-balanced with %s bonding (\u0394EN = %s). " +
          "This could form a stable compound.", userFormula, bondType.getLabel(), formattedDifference);
    } else {
      likelihood = Likelihood.POSSIBLE_BUT_UNSTABLE;
      rationale = String.format("Your formula %s is charge-balanced but has weak electronegativity differences " +
          "(\u0394EN = %s). May require specific molecular structure.", userFormula, formattedDifference);
    }
    return new CompoundAnalysis(likelihood, bondType, Collections.singletonList(candidate), difference, rationale,
        elements, true);
  }

  /**
   * Depth-first search for one oxidation state per element that makes the formula neutral.  States are tried in the
   * order each element lists them, and the first neutral assignment wins.
   */
  private Optional<List<OxidationAssignment>> findBalance(List<Element> elements, List<Integer> counts,
                                                          List<List<Integer>> states, int index, int charge,
                                                          List<OxidationAssignment> selected) {
    if (index == elements.size()) {
      return charge == 0 ? Optional.of(new ArrayList<>(selected)) : Optional.empty();
    }

    int count = counts.get(index);
    for (Integer state : states.get(index)) {
      selected.add(new OxidationAssignment(elements.get(index).getSymbol(), state, count));
      Optional<List<OxidationAssignment>> result =
          findBalance(elements, counts, states, index + 1, charge + state * count, selected);
      selected.remove(selected.size() - 1);
      if (result.isPresent()) {
        return result;
      }
    }
    return Optional.empty();
  }
}
